/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.algebra;

import static gov.sandia.symcalc.language.ExpressionReader.read;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import gov.sandia.symcalc.language.AccessVariable;
import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.type.Scalar;

import org.junit.Test;

public class PolynomialTest {

    @Test
    public void testNumericCoefficients() throws NotPolynomialException {
        Object[] cases = {
            "3*x^2-x+1",        new double[] {1, -1, 3},
            "(x+1)^2",          new double[] {1, 2, 1},
            "(x-1)*(x-2)*(x-3)", new double[] {-6, 11, -6, 1},
            "x^3/2",            new double[] {0, 0, 0, 0.5},
            "5",                new double[] {5},
            "x-x",              new double[] {0},
        };
        for (int c = 0; c < cases.length; c += 2) {
            Polynomial p = Polynomial.from (read ((String) cases[c]), "x");
            double[] expected = (double[]) cases[c + 1];
            assertEquals ((String) cases[c], expected.length - 1, p.degree ());
            for (int i = 0; i < expected.length; i++) {
                assertEquals (cases[c] + " [" + i + "]", expected[i], p.get (i).getDouble (), 1e-12);
            }
            assertTrue (p.isNumeric ());
        }
    }

    @Test
    public void testParametricCoefficients() throws NotPolynomialException {
        Polynomial p = Polynomial.from (read ("a*x^2+b*x+c*x"), "x");
        assertEquals (2, p.degree ());
        assertEquals (new AccessVariable ("a"), p.get (2));
        assertEquals (Simplifier.simplify (read ("b+c")), p.get (1));
        assertTrue (Polynomial.isZero (p.get (0)));
        assertFalse (p.isNumeric ());

        // Transcendental coefficients are fine as long as they don't involve x.
        p = Polynomial.from (read ("sin(t)*x+1"), "x");
        assertEquals (1, p.degree ());
        assertEquals (read ("sin(t)"), p.get (1));
    }

    @Test
    public void testNotPolynomial() {
        String[] cases = {
            "sin(x)",
            "1/x",
            "x^0.5",
            "2^x",
            "x^y",
            "sqrt(x)+1",
        };
        for (String c : cases) {
            try {
                Polynomial.from (read (c), "x");
                fail ("Expected NotPolynomialException for " + c);
            } catch (NotPolynomialException e) {
                assertTrue (e.getMessage ().contains ("x"));
            }
        }
    }

    @Test
    public void testRoundTrip() throws NotPolynomialException {
        Operator original = read ("(2*x-1)^3+x");
        Polynomial p = Polynomial.from (original, "x");
        Operator rebuilt = p.toOperator ();
        for (double x = -2; x <= 2; x += 0.5) {
            Bindings context = new Bindings ("x", x);
            double expected = ((Scalar) original.eval (context)).value;
            assertEquals (expected, ((Scalar) rebuilt.eval (context)).value, 1e-9);
            assertEquals (expected, ((Scalar) p.evaluate (new Scalar (x), context)).value, 1e-9);
        }
    }

    @Test
    public void testArithmetic() throws NotPolynomialException {
        Polynomial a = Polynomial.from (read ("x+1"), "x");
        Polynomial b = Polynomial.from (read ("x-1"), "x");
        Polynomial product = a.multiply (b);
        assertEquals (2, product.degree ());
        assertEquals (-1, product.get (0).getDouble (), 0);
        assertTrue (Polynomial.isZero (product.get (1)));
        assertEquals (1, a.subtract (b).degree () + 1);
        assertEquals (2, a.add (b).get (1).getDouble (), 0);
        assertEquals (3, a.power (3).degree ());
    }

    @Test
    public void testDivideAndGcd() {
        double[][] qr = Polynomial.divide (new double[] {-1, 0, 1}, new double[] {-1, 1});
        assertArrayEquals (new double[] {1, 1}, qr[0], 1e-12);
        assertArrayEquals (new double[] {0},    qr[1], 1e-12);

        // (x-1)(x-2) and (x-1)(x+3) share x-1
        double[] g = Polynomial.gcd (new double[] {2, -3, 1}, new double[] {-3, 2, 1});
        assertArrayEquals (new double[] {-1, 1}, g, 1e-9);

        // coprime
        g = Polynomial.gcd (new double[] {1, 0, 1}, new double[] {-1, 1});
        assertEquals (1, g.length);
    }

    @Test
    public void testFromArraySnaps() {
        Polynomial p = Polynomial.fromArray ("x", new double[] {2.00000000000001, -0.5});
        assertEquals (new Constant (2), p.get (0));
        assertEquals (new Constant (-0.5), p.get (1));
    }

    @Test
    public void testRationalFunction() throws NotPolynomialException {
        RationalFunction r = RationalFunction.from (read ("1/x+1/(x+1)"), "x");
        assertEquals (1, r.numerator.degree ());
        assertEquals (2, r.denominator.degree ());
        Operator combined = r.toOperator ();
        Bindings context = new Bindings ("x", 2);
        assertEquals (0.5 + 1.0 / 3, ((Scalar) combined.eval (context)).value, 1e-12);

        r = RationalFunction.from (read ("(x^2-4)/(x-2)"), "x").cancel ();
        assertEquals (1, r.numerator.degree ());
        assertEquals (0, r.denominator.degree ());
    }
}
