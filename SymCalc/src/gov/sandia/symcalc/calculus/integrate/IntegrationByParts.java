/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus.integrate;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.symcalc.algebra.Product;
import gov.sandia.symcalc.algebra.Simplifier;
import gov.sandia.symcalc.language.DepthExceededException;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.UnsupportedFormException;
import gov.sandia.symcalc.language.function.ArcCosine;
import gov.sandia.symcalc.language.function.ArcSine;
import gov.sandia.symcalc.language.function.ArcTangent;
import gov.sandia.symcalc.language.function.Cosecant;
import gov.sandia.symcalc.language.function.Cosine;
import gov.sandia.symcalc.language.function.Cotangent;
import gov.sandia.symcalc.language.function.Exp;
import gov.sandia.symcalc.language.function.Log;
import gov.sandia.symcalc.language.function.LogBase;
import gov.sandia.symcalc.language.function.Secant;
import gov.sandia.symcalc.language.function.Sine;
import gov.sandia.symcalc.language.function.Tangent;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.operator.Subtract;

/**
    integral(u dv) = u*v - integral(v du).

    <p>u is the factor that comes first in LIATE order: logarithmic, inverse trigonometric,
    algebraic, trigonometric, exponential. A logarithm or inverse trig function may stand alone,
    with dv = 1. An algebraic u is only paired with a trigonometric or exponential dv, so that
    each round lowers the degree of u and the recursion ends.
**/
public class IntegrationByParts implements IntegrationStrategy
{
    public static final int LOGARITHMIC   = 0;
    public static final int INVERSE       = 1;
    public static final int ALGEBRAIC     = 2;
    public static final int TRIGONOMETRIC = 3;
    public static final int EXPONENTIAL   = 4;
    public static final int OTHER         = 5;

    public static int classify (Operator base, Operator exponent, String variable)
    {
        if (exponent.dependsOn (variable))
        {
            if (base.dependsOn (variable)) return OTHER;
            return EXPONENTIAL;
        }
        boolean power1 = exponent.isScalar ()  &&  exponent.getDouble () == 1;
        if (base instanceof LogBase  &&  ((LogBase) base).operands[1].dependsOn (variable)) return OTHER;
        if (base instanceof Log  ||  base instanceof LogBase) return power1 ? LOGARITHMIC : OTHER;
        if (base instanceof ArcSine  ||  base instanceof ArcCosine  ||  base instanceof ArcTangent) return power1 ? INVERSE : OTHER;
        if (base instanceof Exp) return EXPONENTIAL;
        if (   base instanceof Sine  ||  base instanceof Cosine  ||  base instanceof Tangent
            || base instanceof Secant  ||  base instanceof Cosecant  ||  base instanceof Cotangent)
        {
            return TRIGONOMETRIC;
        }
        if (base.isPolynomial (variable, true)  &&  exponent.isScalar ()  &&  exponent.getDouble () > 0  &&  exponent.getDouble () == Math.rint (exponent.getDouble ())) return ALGEBRAIC;
        return OTHER;
    }

    public Operator integrate (Operator integrand, String variable, Integrator chain, int depth) throws DepthExceededException
    {
        Product p = Product.of (integrand);
        List<Product.Factor> dependent = p.dependentOn (variable);
        if (dependent.isEmpty ()) return null;

        Product.Factor u = null;
        int uClass = OTHER;
        List<Integer> classes = new ArrayList<Integer> ();
        for (Product.Factor f : dependent)
        {
            int c = classify (f.base, f.exponent, variable);
            if (c == OTHER) return null;
            classes.add (c);
            if (c < uClass)
            {
                u = f;
                uClass = c;
            }
        }
        if (uClass > ALGEBRAIC) return null;
        int count = 0;
        for (int c : classes) if (c == uClass) count++;
        if (count > 1) return null;
        if (uClass == ALGEBRAIC  &&  dependent.size () < 2) return null;

        Operator U  = u.base;
        if (! (u.exponent.isScalar ()  &&  u.exponent.getDouble () == 1)) U = new Power (u.base, u.exponent);
        Operator dv = Integrator.without (p, u);

        Operator du;
        try
        {
            du = Simplifier.simplify (U.derivative (variable));
        }
        catch (UnsupportedFormException e)
        {
            return null;
        }

        Operator v = chain.attempt (dv, variable, depth + 1);
        if (v == null) return null;
        Operator vdu = chain.attempt (new Multiply (Simplifier.simplify (v), du), variable, depth + 1);
        if (vdu == null) return null;
        return new Subtract (new Multiply (U, v), vdu);
    }
}
