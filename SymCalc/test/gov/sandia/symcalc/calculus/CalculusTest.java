/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus;

import static gov.sandia.symcalc.language.ExpressionReader.read;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.calculus.integrate.NoIntegrationRuleException;
import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.UnsupportedFormException;
import gov.sandia.symcalc.language.DepthExceededException;
import gov.sandia.symcalc.language.type.Scalar;

import org.junit.Test;

public class CalculusTest {

    public static double value (Operator op, Bindings context) {
        return ((Scalar) op.eval (context)).value;
    }

    public static void assertSameValues (String message, Operator expected, Operator actual, double... points) {
        for (double x : points) {
            Bindings context = new Bindings ().set ("x", x).set ("a", 2.5).set ("b", -0.75);
            double e = value (expected, context);
            assertEquals (message + " at x=" + x, e, value (actual, context), 1e-8 * Math.max (1, Math.abs (e)));
        }
    }

    @Test
    public void testDerivatives() {
        String[] cases = {
            // f                g = df/dx
            "x^3",              "3*x^2",
            "a*x+b",            "a",
            "x*sin(x)",         "sin(x)+x*cos(x)",
            "exp(2*x)",         "2*exp(2*x)",
            "ln(x)",            "1/x",
            "log(x,2)",         "1/(x*ln(2))",
            "x^x",              "x^x*(ln(x)+1)",
            "2^x",              "2^x*ln(2)",
            "abs(x-1)",         "(x-1)/abs(x-1)",
            "tan(x)",           "1/cos(x)^2",
            "sec(x)",           "sin(x)/cos(x)^2",
            "csc(x)",           "-cos(x)/sin(x)^2",
            "cot(x)",           "-1/sin(x)^2",
            "asin(x/2)",        "1/sqrt(4-x^2)",
            "acos(x)",          "-1/sqrt(1-x^2)",
            "atan(x)",          "1/(1+x^2)",
            "sinh(x)",          "cosh(x)",
            "cosh(x)",          "sinh(x)",
            "tanh(x)",          "1-tanh(x)^2",
            "sqrt(x)",          "0.5/sqrt(x)",
            "cbrt(x)",          "1/(3*cbrt(x)^2)",
            "x/(1+x^2)",        "(1-x^2)/(1+x^2)^2",
            "(x^2+1)^3",        "6*x*(x^2+1)^2",
            "x%3",              "1",
            "sin(cos(x))",      "-cos(cos(x))*sin(x)",
            "x^a",              "a*x^(a-1)",
        };
        for (int c = 0; c < cases.length; c += 2) {
            Operator derivative = Calculus.differentiate (read (cases[c]), "x");
            assertSameValues (cases[c], read (cases[c + 1]), derivative, 0.3, 0.7, 0.95);
        }
    }

    @Test
    public void testOtherVariablesAreConstant() {
        assertEquals ("0", Calculus.differentiate (read ("y^2+sin(y)"), "x").render ());
        assertEquals ("0", Calculus.differentiate (read ("f(y)"), "x").render ());
    }

    @Test
    public void testUnsupportedForms() {
        String[] cases = {
            "f(x)",
            "7%x",
        };
        for (String c : cases) {
            try {
                read (c).derivative ("x");
                fail ("Expected UnsupportedFormException for " + c);
            } catch (UnsupportedFormException e) {
                // expected
            }
        }
    }

    @Test
    public void testSineRoundTrip() throws NoIntegrationRuleException, DepthExceededException {
        Operator F = Calculus.integrate (read ("sin(x)"), "x");
        assertEquals ("-cos(x)", F.render ());
        assertEquals ("sin(x)", Calculus.differentiate (F, "x").render ());
    }

    @Test
    public void testHigherOrder() {
        Operator f = read ("x^4+sin(x)");
        assertSameValues ("order 0", f, Calculus.derivative (f, "x", 0), 0.5, 1.5);
        assertSameValues ("order 2", read ("12*x^2-sin(x)"), Calculus.derivative (f, "x", 2), 0.5, 1.5);
        assertSameValues ("order 5", read ("cos(x)"),        Calculus.derivative (f, "x", 5), 0.5, 1.5);
    }

    @Test
    public void testGradient() {
        List<Operator> g = Calculus.gradient (read ("x^2*y+y^3"), Arrays.asList ("x", "y"));
        Bindings context = new Bindings ().set ("x", 2).set ("y", 3);
        assertEquals (12, value (g.get (0), context), 1e-12);
        assertEquals (31, value (g.get (1), context), 1e-12);
    }

    @Test
    public void testTaylor() {
        Operator series = Calculus.maclaurinSeries (read ("exp(x)"), "x", 4);
        assertSameValues ("exp", read ("1+x+x^2/2+x^3/6+x^4/24"), series, -0.5, 0.1, 1.0);

        series = Calculus.maclaurinSeries (read ("sin(x)"), "x", 5);
        assertSameValues ("sin", read ("x-x^3/6+x^5/120"), series, -0.5, 0.1, 1.0);

        series = Calculus.taylorSeries (read ("ln(x)"), "x", 1, 2);
        assertSameValues ("ln", read ("(x-1)-(x-1)^2/2"), series, 0.5, 1.1, 2.0);

        assertEquals ("0", Calculus.maclaurinSeries (read ("x^3"), "x", 2).render ());
    }

    @Test
    public void testLimit() throws Exception {
        Object[] cases = {
            // f                  point  limit
            "x^2+3",              2.0,   7.0,
            "sin(x)/x",           0.0,   1.0,
            "(exp(x)-1)/x",       0.0,   1.0,
            "(1-cos(x))/x^2",     0.0,   0.5,
            "(x^2-1)/(x-1)",      1.0,   2.0,
            "ln(x)/(x-1)",        1.0,   1.0,
            "x/(x+1)",            1.0,   0.5,
        };
        for (int i = 0; i < cases.length; i += 3) {
            String f = (String) cases[i];
            Operator L = Calculus.limit (read (f), "x", (Double) cases[i + 1]);
            assertEquals (f, (Double) cases[i + 2], value (L, new Bindings ()), 1e-12);
        }

        // symbolic point
        Operator L = Calculus.limit (read ("(x^2-a^2)/(x-a)"), "x", read ("a"));
        assertEquals (6, value (L, new Bindings ("a", 3)), 1e-12);
    }

    @Test(expected = NoLimitException.class)
    public void testLimitDiverges() throws Exception {
        Calculus.limit (read ("1/x"), "x", 0);
    }

    @Test
    public void testLimitDepth() throws Exception {
        int saved = Settings.limitDepth;
        Settings.limitDepth = 0;
        try {
            Calculus.limit (read ("sin(x)/x"), "x", 0);
            fail ("Expected DepthExceededException");
        } catch (DepthExceededException e) {
            assertEquals (0, e.depth);
        } finally {
            Settings.limitDepth = saved;
        }
        assertEquals (5, value (Calculus.limit (read ("x+3"), "x", 2), new Bindings ()), 1e-12);
    }

    @Test
    public void testDefiniteIntegral() throws NoIntegrationRuleException, DepthExceededException {
        Operator area = Calculus.definiteIntegral (read ("x^2"), "x", 0, 3);
        assertEquals (9, value (area, new Bindings ()), 1e-12);

        area = Calculus.definiteIntegral (read ("cos(x)"), "x", 0, Math.PI / 2);
        assertEquals (1, value (area, new Bindings ()), 1e-12);

        area = Calculus.definiteIntegral (read ("1/x"), "x", 1, Math.E);
        assertEquals (1, value (area, new Bindings ()), 1e-12);
    }
}
