/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.solve;

import static gov.sandia.symcalc.language.ExpressionReader.read;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.language.AccessVariable;
import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.type.Scalar;

import org.junit.Test;

public class SystemSolverTest {

    /**
        Builds a list of equations from alternating lhs and rhs strings.
    **/
    public static List<Equation> equations (String... sides) {
        List<Equation> result = new ArrayList<Equation> ();
        for (int i = 0; i < sides.length; i += 2) result.add (new Equation (read (sides[i]), read (sides[i + 1])));
        return result;
    }

    public static double value (Operator op, Bindings context) {
        return ((Scalar) op.eval (context)).value;
    }

    @Test
    public void testTwoByTwo() throws Exception {
        Map<String,Operator> result = SystemSolver.solveEquations (equations ("x+y", "1", "x-y", "1"));
        assertEquals (Arrays.asList ("x", "y"), new ArrayList<String> (result.keySet ()));
        assertEquals ("1", result.get ("x").render ());
        assertEquals ("0", result.get ("y").render ());
    }

    @Test
    public void testThreeByThree() throws Exception {
        List<Equation> system = equations
        (
            "x+y+z",   "6",
            "2*x-y+z", "3",
            "x+2*y-z", "2"
        );
        Map<String,Operator> result = SystemSolver.solveEquations (system, Arrays.asList ("x", "y", "z"));
        Bindings empty = new Bindings ();
        assertEquals (1, value (result.get ("x"), empty), 1e-9);
        assertEquals (2, value (result.get ("y"), empty), 1e-9);
        assertEquals (3, value (result.get ("z"), empty), 1e-9);
    }

    @Test
    public void testParameters() throws Exception {
        // a is not an unknown, so it remains in the answer.
        Map<String,Operator> result = SystemSolver.solveEquations (equations ("x+y", "a", "x-y", "1"), Arrays.asList ("x", "y"));
        Bindings context = new Bindings ("a", 5);
        assertEquals (3, value (result.get ("x"), context), 1e-12);
        assertEquals (2, value (result.get ("y"), context), 1e-12);
    }

    @Test
    public void testNonlinear() throws Exception {
        Map<String,Operator> result = SystemSolver.solveEquations (equations ("x+y", "3", "x*y", "2"));
        Bindings empty = new Bindings ();
        double x = value (result.get ("x"), empty);
        double y = value (result.get ("y"), empty);
        assertEquals (3, x + y, 1e-9);
        assertEquals (2, x * y, 1e-9);

        result = SystemSolver.solveEquations (equations ("x^2", "4", "y", "x+1"), Arrays.asList ("x", "y"));
        x = value (result.get ("x"), empty);
        assertEquals (4,     x * x, 1e-9);
        assertEquals (x + 1, value (result.get ("y"), empty), 1e-9);
    }

    @Test
    public void testUnderdetermined() throws Exception {
        Map<String,Operator> result = SystemSolver.solveEquations (equations ("x+y", "1"), Arrays.asList ("x", "y", "z"));
        assertEquals (3, result.size ());
        Operator y = result.get ("y");
        assertTrue (y instanceof AccessVariable);
        assertEquals ("y", y.render ());
        assertEquals ("z", result.get ("z").render ());
        assertEquals (-4, value (result.get ("x"), new Bindings ("y", 5)), 1e-12);
    }

    @Test
    public void testConditionOnParameters() throws Exception {
        // a-b=0 is left over as a condition, and y stays free.
        Map<String,Operator> result = SystemSolver.solveEquations (equations ("x+y", "a", "x+y", "b"), Arrays.asList ("x", "y"));
        assertEquals (2, result.size ());
        assertTrue (result.get ("y") instanceof AccessVariable);
        assertEquals (2, value (result.get ("x"), new Bindings ().set ("a", 3).set ("y", 1)), 1e-12);
    }

    @Test
    public void testRedundant() throws Exception {
        Map<String,Operator> result = SystemSolver.solveEquations (equations ("x+y", "2", "2*x+2*y", "4", "x", "1"));
        assertEquals ("1", result.get ("x").render ());
        assertEquals ("1", result.get ("y").render ());
    }

    @Test
    public void testInconsistent() throws Exception {
        try {
            SystemSolver.solveEquations (equations ("x+y", "1", "x+y", "2"));
            fail ("Expected InconsistentSystemException");
        } catch (InconsistentSystemException e) {
            assertTrue (e.residual instanceof Constant);
        }
    }

    @Test(expected = NoConvergenceException.class)
    public void testNoConvergence() throws Exception {
        SystemSolver.solveEquations (equations ("sin(x)+x", "y", "y", "x*x+cos(x)"));
    }

    @Test
    public void testRoundLimit() throws Exception {
        int saved = Settings.systemRounds;
        Settings.systemRounds = 0;
        try {
            SystemSolver.solveEquations (equations ("x+y", "1", "x-y", "1"));
            fail ("Expected NoConvergenceException");
        } catch (NoConvergenceException e) {
            assertTrue (e.getMessage ().contains ("0"));
        } finally {
            Settings.systemRounds = saved;
        }
    }

    @Test
    public void testFlatten() throws Exception {
        List<Object> flat = SystemSolver.solveEquationsFlat (equations ("x+y", "1", "x-y", "1"), Arrays.asList ("y", "x"));
        assertEquals (4, flat.size ());
        assertEquals ("y", flat.get (0));
        assertEquals ("0", ((Operator) flat.get (1)).render ());
        assertEquals ("x", flat.get (2));
        assertEquals ("1", ((Operator) flat.get (3)).render ());
    }
}
