/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.solve;

import static gov.sandia.symcalc.language.ExpressionReader.read;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.complex.Complex;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.algebra.NotPolynomialException;
import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.DepthExceededException;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.type.ComplexScalar;
import gov.sandia.symcalc.language.type.Scalar;

import org.junit.Test;

public class EquationSolverTest {

    /**
        Compares real roots as a multiset, ignoring order.
    **/
    public static void assertRoots (String message, double[] expected, Solutions s, Bindings context) {
        assertFalse (message + " is identity", s.isIdentity ());
        assertEquals (message + " " + s, expected.length, s.size ());
        List<Double> actual = new ArrayList<Double> ();
        for (Type t : s.getValues (context)) {
            assertTrue (message + " root " + t + " should be real", t instanceof Scalar);
            actual.add (((Scalar) t).value);
        }
        Collections.sort (actual);
        double[] sorted = expected.clone ();
        java.util.Arrays.sort (sorted);
        for (int i = 0; i < sorted.length; i++) {
            assertEquals (message + " " + s, sorted[i], actual.get (i), 1e-9 * Math.max (1, Math.abs (sorted[i])));
        }
    }

    public static void assertRoots (String expression, double... expected) throws Exception {
        assertRoots (expression, expected, EquationSolver.solve (read (expression), "x"), new Bindings ());
    }

    @Test
    public void testQuadraticOrder() throws Exception {
        Solutions s = EquationSolver.solve (new Equation (read ("x^2-1")), "x");
        assertEquals (2, s.size ());
        assertEquals ( 1, s.get (0).getDouble (), 0);
        assertEquals (-1, s.get (1).getDouble (), 0);
    }

    @Test
    public void testRealRoots() throws Exception {
        Object[] cases = {
            "2*x-4",                 new double[] {2},
            "3*x+1",                 new double[] {-1.0 / 3},
            "(x-1)*(x-2)",           new double[] {1, 2},
            "x^2-5*x+6",             new double[] {2, 3},
            "x^2-2*x+1",             new double[] {1, 1},
            "x^3",                   new double[] {0, 0, 0},
            "x^3-6*x^2+11*x-6",      new double[] {1, 2, 3},
            "(x-1)*(x-2)*(x-3)",     new double[] {1, 2, 3},
            "x^3-6*x^2+12*x-8",      new double[] {2, 2, 2},
            "x^4-x^2",               new double[] {0, 0, 1, -1},
            "(x-1)^2*(x+1)",         new double[] {1, 1, -1},
            "(x-1)*(x^2-1)",         new double[] {1, -1},
            "1/x-1",                 new double[] {1},
            "x/(x-1)",               new double[] {0},
            "(x^2-1)/(x-1)",         new double[] {-1},
            "1/x",                   new double[] {},
            "exp(x)*(x-4)",          new double[] {4},
            "2^x*(x-4)",             new double[] {4},
            "exp(x)*(x-4)^2",        new double[] {4, 4},
            "exp(x)",                new double[] {},
            "abs(x-1)-2",            new double[] {3, -1},
        };
        for (int i = 0; i < cases.length; i += 2) {
            String e = (String) cases[i];
            assertRoots (e, (double[]) cases[i + 1]);
        }
    }

    @Test
    public void testComplexRoots() throws Exception {
        Solutions s = EquationSolver.solve (read ("x^2+1"), "x");
        assertEquals (2, s.size ());
        for (Type t : s.getValues ()) {
            assertTrue (t instanceof ComplexScalar);
            ComplexScalar c = (ComplexScalar) t;
            assertEquals (0, c.getReal (), 1e-12);
            assertEquals (1, Math.abs (c.getImaginary ()), 1e-12);
        }

        s = EquationSolver.solve (read ("x^3-1"), "x");
        assertEquals (3, s.size ());
        int real = 0;
        for (Type t : s.getValues ()) {
            if (t instanceof Scalar) {
                assertEquals (1, ((Scalar) t).value, 1e-12);
                real++;
            } else {
                ComplexScalar c = (ComplexScalar) t;
                assertEquals (-0.5,              c.getReal (),                1e-12);
                assertEquals (Math.sqrt (3) / 2, Math.abs (c.getImaginary ()), 1e-12);
            }
        }
        assertEquals (1, real);
    }

    @Test
    public void testParametric() throws Exception {
        Solutions s = EquationSolver.solve (read ("x^2-a"), "x");
        assertRoots ("x^2-a", new double[] {2, -2}, s, new Bindings ("a", 4));

        s = EquationSolver.solve (new Equation (read ("a*x+b"), read ("c")), "x");
        assertRoots ("a*x+b=c", new double[] {2}, s, new Bindings ().set ("a", 3).set ("b", 1).set ("c", 7));
    }

    @Test
    public void testIsolation() throws Exception {
        Solutions s = EquationSolver.solve (new Equation (read ("exp(x)"), read ("5")), "x");
        assertRoots ("exp(x)=5", new double[] {Math.log (5)}, s, new Bindings ());
        assertRoots ("ln(x+1)", 0);
        assertRoots ("ln(x+1)^2-4", Math.exp (2) - 1, Math.exp (-2) - 1);
    }

    public static Complex power (Complex c, int n) {
        Complex result = Complex.ONE;
        for (int i = 0; i < n; i++) result = result.multiply (c);
        return result;
    }

    /**
        Checks that each root r satisfies r^n = value, and returns how many roots are real.
    **/
    public static int assertPowerRoots (Solutions s, int n, double value) {
        assertEquals (s.toString (), n, s.size ());
        int real = 0;
        for (Type t : s.getValues ()) {
            Complex c = ComplexScalar.toComplex (t);
            Complex p = power (c, n);
            assertEquals (s.toString (), value, p.getReal (),      1e-9 * Math.max (1, Math.abs (value)));
            assertEquals (s.toString (), 0,     p.getImaginary (), 1e-9 * Math.max (1, Math.abs (value)));
            if (t instanceof Scalar) real++;
        }
        return real;
    }

    @Test
    public void testHigherPowersListEveryRoot() throws Exception {
        Solutions s = EquationSolver.solve (read ("x^4-16"), "x");
        assertEquals (2, assertPowerRoots (s, 4, 16));
        assertTrue (s.contains (new Constant (2)));
        assertTrue (s.contains (new Constant (-2)));

        s = EquationSolver.solve (read ("x^4+1"), "x");
        assertEquals (0, assertPowerRoots (s, 4, -1));

        s = EquationSolver.solve (read ("x^5-32"), "x");
        assertEquals (1, assertPowerRoots (s, 5, 32));

        // 0 plus the four fourth roots of 1
        s = EquationSolver.solve (read ("x^5-x"), "x");
        assertEquals (5, s.size ());
        int real = 0;
        for (Type t : s.getValues ()) {
            Complex c = ComplexScalar.toComplex (t);
            Complex r = power (c, 5).subtract (c);
            assertEquals (0, r.abs (), 1e-9);
            if (t instanceof Scalar) real++;
        }
        assertEquals (3, real);
    }

    @Test(expected = UnsupportedDegreeException.class)
    public void testSymbolicHigherPower() throws Exception {
        EquationSolver.solve (read ("x^4-a"), "x");
    }

    @Test
    public void testMultiplicityLimit() throws Exception {
        try {
            EquationSolver.solve (read ("x^3000000000"), "x");
            fail ("Expected UnsupportedDegreeException");
        } catch (UnsupportedDegreeException e) {
            assertTrue (e.degree > Settings.multiplicityLimit);
        }

        int saved = Settings.multiplicityLimit;
        Settings.multiplicityLimit = 2;
        try {
            EquationSolver.solve (read ("(x-1)^3"), "x");
            fail ("Expected UnsupportedDegreeException");
        } catch (UnsupportedDegreeException e) {
            assertEquals (3, e.degree);
        } finally {
            Settings.multiplicityLimit = saved;
        }
    }

    @Test
    public void testIdentityAndNoSolution() throws Exception {
        assertTrue (EquationSolver.solve (read ("x-x"), "x").isIdentity ());
        assertTrue (EquationSolver.solve (new Equation (read ("(x+1)^2"), read ("x^2+2*x+1")), "x").isIdentity ());
        assertTrue (EquationSolver.solve (read ("0"), "x").isIdentity ());

        Solutions s = EquationSolver.solve (read ("y+1"), "x");
        assertFalse (s.isIdentity ());
        assertTrue (s.isEmpty ());
        assertTrue (EquationSolver.solve (read ("3"), "x").isEmpty ());
    }

    @Test(expected = UnsupportedDegreeException.class)
    public void testUnsupportedDegree() throws Exception {
        EquationSolver.solve (read ("x^5+x+1"), "x");
    }

    @Test
    public void testUnsupportedDegreeReportsDegree() throws Exception {
        try {
            EquationSolver.solve (read ("x^6+x^2+1"), "x");
            fail ("Expected UnsupportedDegreeException");
        } catch (UnsupportedDegreeException e) {
            assertEquals (6, e.degree);
        }
    }

    @Test(expected = NotPolynomialException.class)
    public void testNotPolynomial() throws Exception {
        EquationSolver.solve (read ("sin(x)+x"), "x");
    }

    @Test
    public void testDepthLimit() throws Exception {
        int saved = Settings.solverDepth;
        Settings.solverDepth = -1;
        try {
            EquationSolver.solve (read ("x-1"), "x");
            fail ("Expected DepthExceededException");
        } catch (DepthExceededException e) {
            // expected
        } finally {
            Settings.solverDepth = saved;
        }
    }

    @Test
    public void testSame() {
        assertTrue  (Solutions.same (read ("1"), read ("1.00000000001")));
        assertFalse (Solutions.same (read ("1"), read ("1.001")));
        assertTrue  (Solutions.same (read ("sqrt(a)"), read ("sqrt(a)")));
        assertEquals (3.0, Solutions.snap (2.99999999999), 0);
        assertEquals (2.5, Solutions.snap (2.5), 0);
    }
}
