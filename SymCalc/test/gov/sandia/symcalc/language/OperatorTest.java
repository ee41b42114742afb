/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import static gov.sandia.symcalc.language.ExpressionReader.read;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import gov.sandia.symcalc.language.function.Sine;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Multiply;

import org.junit.Test;

/**
    Non-evaluation operations on expression trees: rendering, structural equality,
    substitution and the polynomial test.
**/
public class OperatorTest {

    @Test
    public void testRender() {
        String[] render = {
            "x+y*2",          "x+y*2",
            "(x+y)*2",        "(x+y)*2",
            "x-(y-z)",        "x-(y-z)",
            "(x-y)-z",        "x-y-z",
            "x/(y*z)",        "x/(y*z)",
            "(x^y)^z",        "(x^y)^z",
            "x^y^z",          "x^y^z",
            "-(x+1)",         "-(x+1)",
            "sin(x+1)*2.5",   "sin(x+1)*2.5",
            "x*-3",           "x*-3",
        };
        for (int r = 0; r < render.length; r += 2) {
            assertEquals (render[r + 1], read (render[r]).render ());
        }

        // A negative literal is parenthesized, unlike negation.
        assertEquals ("x*(-3)", new Multiply (new AccessVariable ("x"), new Constant (-3)).render ());
    }

    @Test
    public void testCustomRenderer() {
        Renderer renderer = new Renderer () {
            public boolean render (Operator op) {
                if (op instanceof AccessVariable) {
                    result.append ("space." + ((AccessVariable) op).name);
                    return true;
                }
                return false;
            }
        };
        read ("x+y*4").render (renderer);
        assertEquals ("space.x+space.y*4", renderer.result.toString ());
    }

    @Test
    public void testStructuralEquality() {
        assertEquals (read ("sin(x)+2*y"), read ("sin(x)+2*y"));
        assertEquals (read ("sin(x)+2*y").hashCode (), read ("sin(x)+2*y").hashCode ());
        assertFalse (read ("x+y").equals (read ("y+x")));
        assertFalse (read ("x-y").equals (read ("x+y")));
        assertFalse (read ("ln(x)").equals (read ("log(x)")));
    }

    @Test
    public void testSubstitute() {
        Operator before = read ("x^2+sin(x*y)");
        Operator after  = before.substitute ("x", read ("z+1"));
        assertEquals (read ("(z+1)^2+sin((z+1)*y)"), after);
        assertEquals (read ("x^2+sin(x*y)"), before);  // input untouched

        // Unchanged subtrees are shared rather than copied.
        Add sum = (Add) read ("x+sin(y)");
        Add replaced = (Add) sum.substitute ("x", new Constant (3));
        assertSame (sum.operand1, replaced.operand1);
        assertNotSame (sum.operand0, replaced.operand0);
        assertSame (sum, sum.substitute ("w", new Constant (1)));
    }

    @Test
    public void testVariablesUsed() {
        List<String> names = new ArrayList<String> (read ("b*sin(a)+c/b+a").variablesUsed ());
        assertEquals (Arrays.asList ("b", "a", "c"), names);
        assertTrue (read ("f(q)").variablesUsed ().contains ("q"));
        assertTrue (read ("3+4").variablesUsed ().isEmpty ());
    }

    @Test
    public void testDependsOn() {
        Operator op = read ("a*x^2+b");
        assertTrue (op.dependsOn ("x"));
        assertFalse (op.dependsOn ("y"));
        assertEquals (2, read ("x*sin(x)+y").occurrences ("x"));
    }

    @Test
    public void testIsPolynomial() {
        Object[] cases = {
            // expression      non-strict  strict
            "3*x^2-x+1",       true,       true,
            "a*x^3+b",         true,       true,
            "sin(a)*x+1",      true,       false,
            "x^2/4",           true,       true,
            "sin(x)",          false,      false,
            "1/x",             false,      false,
            "x^-1",            false,      false,
            "x^0.5",           false,      false,
            "x^n",             false,      false,
            "2^x",             false,      false,
            "sqrt(x)",         false,      false,
            "(x+1)^3*(x-2)",   true,       true,
            "y",               true,       true,
            "exp(2)",          true,       false,
        };
        for (int c = 0; c < cases.length; c += 3) {
            Operator op = read ((String) cases[c]);
            assertEquals (cases[c] + " non-strict", cases[c + 1], op.isPolynomial ("x", false));
            assertEquals (cases[c] + " strict",     cases[c + 2], op.isPolynomial ("x", true));
        }
    }

    @Test
    public void testCreate() {
        Operator op = Operator.create ("sin", new AccessVariable ("x"));
        assertTrue (op instanceof Sine);
        op = Operator.create ("*", new Constant (2), new AccessVariable ("x"));
        assertTrue (op instanceof Multiply);
        assertEquals (read ("x^2"), Operator.create ("pow", new AccessVariable ("x"), new Constant (2)));
    }

    @Test
    public void testVisitor() {
        final List<String> seen = new ArrayList<String> ();
        read ("a+sin(b)*c").visit (new Visitor () {
            public boolean visit (Operator op) {
                if (op instanceof AccessVariable) seen.add (((AccessVariable) op).name);
                return true;
            }
        });
        assertEquals (Arrays.asList ("a", "b", "c"), seen);
    }
}
