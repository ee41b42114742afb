/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.solve;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.complex.Complex;
import org.apache.log4j.Logger;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.algebra.Simplifier;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.function.CubeRoot;
import gov.sandia.symcalc.language.function.SquareRoot;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Negate;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.operator.Subtract;
import gov.sandia.symcalc.language.type.ComplexScalar;

/**
    Roots of a*x^3 + b*x^2 + c*x + d by Cardano's method.

    <p>With D0 = b^2-3ac and D1 = 2b^3-9abc+27a^2d, let C be a cube root of (D1 +- sqrt(D1^2-4D0^3))/2.
    Then the roots are -(b + xi^k C + D0/(xi^k C))/(3a) for k=0,1,2, where xi is a primitive cube
    root of unity. When D0 and D1 both vanish, C is 0 and the formula degenerates into 0/0. That
    case is a triple root at -b/(3a).
**/
public class Cubic
{
    private static Logger logger = Logger.getLogger (Cubic.class);

    public static final Complex xi = new Complex (-0.5, Math.sqrt (3) / 2);

    public static List<Operator> roots (Operator a, Operator b, Operator c, Operator d)
    {
        if (a instanceof Constant  &&  b instanceof Constant  &&  c instanceof Constant  &&  d instanceof Constant)
        {
            return roots
            (
                ComplexScalar.toComplex (((Constant) a).value),
                ComplexScalar.toComplex (((Constant) b).value),
                ComplexScalar.toComplex (((Constant) c).value),
                ComplexScalar.toComplex (((Constant) d).value)
            );
        }
        return symbolicRoots (a, b, c, d);
    }

    public static List<Operator> roots (Complex a, Complex b, Complex c, Complex d)
    {
        Complex bb  = b.multiply (b);
        Complex ac3 = a.multiply (c).multiply (3);
        Complex D0  = bb.subtract (ac3);

        Complex t0  = bb.multiply (b).multiply (2);
        Complex t1  = a.multiply (b).multiply (c).multiply (9);
        Complex t2  = a.multiply (a).multiply (d).multiply (27);
        Complex D1  = t0.subtract (t1).add (t2);

        boolean zero0 = Settings.isZero (D0.abs (), Math.max (bb.abs (), ac3.abs ()));
        boolean zero1 = Settings.isZero (D1.abs (), Math.max (t0.abs (), Math.max (t1.abs (), t2.abs ())));
        Complex a3 = a.multiply (3);
        List<Operator> result = new ArrayList<Operator> ();
        if (zero0  &&  zero1)
        {
            Operator root = Solutions.constant (b.negate ().divide (a3));
            logger.debug ("triple root " + root);
            for (int k = 0; k < 3; k++) result.add (root);
            return result;
        }
        if (zero0) D0 = Complex.ZERO;

        // Pick the sign that avoids cancellation, so C stays away from zero.
        Complex radical = D1.multiply (D1).subtract (D0.multiply (D0).multiply (D0).multiply (4)).sqrt ();
        Complex plus    = D1.add      (radical).divide (2);
        Complex minus   = D1.subtract (radical).divide (2);
        Complex C = (plus.abs () >= minus.abs () ? plus : minus).nthRoot (3).get (0);

        Complex xk = C;
        for (int k = 0; k < 3; k++)
        {
            Complex x = b.add (xk).add (D0.divide (xk)).negate ().divide (a3);
            result.add (Solutions.constant (x));
            xk = xk.multiply (xi);
        }
        return result;
    }

    /**
        Cardano's formula carried out on trees, for coefficients that involve other variables.
        The sign of the inner square root can't be chosen by magnitude, so the + branch is used,
        except when D0 is identically zero.
    **/
    public static List<Operator> symbolicRoots (Operator a, Operator b, Operator c, Operator d)
    {
        Operator D0 = Simplifier.simplify (new Subtract (new Power (b, new Constant (2)), new Multiply (new Constant (3), new Multiply (a, c))));
        Operator D1 = Simplifier.simplify
        (
            new Add
            (
                new Subtract
                (
                    new Multiply (new Constant (2), new Power (b, new Constant (3))),
                    new Multiply (new Constant (9), new Multiply (a, new Multiply (b, c)))
                ),
                new Multiply (new Constant (27), new Multiply (new Power (a, new Constant (2)), d))
            )
        );
        Operator a3 = new Multiply (new Constant (3), a);

        List<Operator> result = new ArrayList<Operator> ();
        if (Constant.isZero (D0)  &&  Constant.isZero (D1))
        {
            Operator root = Simplifier.simplify (new Divide (new Negate (b), a3));
            for (int k = 0; k < 3; k++) result.add (root);
            return result;
        }

        Operator C;
        if (Constant.isZero (D0))
        {
            C = Simplifier.simplify (new CubeRoot (D1));
        }
        else
        {
            Operator radical = new SquareRoot (new Subtract (new Power (D1, new Constant (2)), new Multiply (new Constant (4), new Power (D0, new Constant (3)))));
            C = Simplifier.simplify (new CubeRoot (new Divide (new Add (D1, radical), new Constant (2))));
        }

        Complex w = Complex.ONE;
        for (int k = 0; k < 3; k++)
        {
            Operator xk = C;
            if (k > 0) xk = new Multiply (new Constant (new ComplexScalar (w)), C);
            Operator x = new Divide (new Negate (new Add (new Add (b, xk), new Divide (D0, xk))), a3);
            result.add (Simplifier.simplify (x));
            w = w.multiply (xi);
        }
        return result;
    }
}
