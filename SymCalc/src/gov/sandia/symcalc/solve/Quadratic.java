/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.solve;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.complex.Complex;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.algebra.Simplifier;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.function.SquareRoot;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Negate;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.operator.Subtract;
import gov.sandia.symcalc.language.type.ComplexScalar;

/**
    Roots of a*x^2 + b*x + c by the quadratic formula.
    The root with +sqrt comes first. A double root is reported twice.
**/
public class Quadratic
{
    public static List<Operator> roots (Operator a, Operator b, Operator c)
    {
        if (a instanceof Constant  &&  b instanceof Constant  &&  c instanceof Constant)
        {
            return roots (ComplexScalar.toComplex (((Constant) a).value), ComplexScalar.toComplex (((Constant) b).value), ComplexScalar.toComplex (((Constant) c).value));
        }

        // Parametric coefficients
        Operator discriminant = Simplifier.simplify (new Subtract (new Power (b, new Constant (2)), new Multiply (new Constant (4), new Multiply (a, c))));
        Operator root         = Simplifier.simplify (new SquareRoot (discriminant));
        Operator minusB       = new Negate (b);
        Operator twoA         = new Multiply (new Constant (2), a);
        List<Operator> result = new ArrayList<Operator> ();
        result.add (Simplifier.simplify (new Divide (new Add      (minusB, root), twoA)));
        result.add (Simplifier.simplify (new Divide (new Subtract (minusB, root), twoA)));
        return result;
    }

    public static List<Operator> roots (Complex a, Complex b, Complex c)
    {
        Complex bb = b.multiply (b);
        Complex ac = a.multiply (c).multiply (4);
        Complex discriminant = bb.subtract (ac);
        if (Settings.isZero (discriminant.abs (), Math.max (bb.abs (), ac.abs ()))) discriminant = Complex.ZERO;
        Complex root = discriminant.sqrt ();
        Complex twoA = a.multiply (2);

        List<Operator> result = new ArrayList<Operator> ();
        result.add (Solutions.constant (b.negate ().add      (root).divide (twoA)));
        result.add (Solutions.constant (b.negate ().subtract (root).divide (twoA)));
        return result;
    }
}
