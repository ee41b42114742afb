/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus.integrate;

import gov.sandia.symcalc.algebra.Product;
import gov.sandia.symcalc.algebra.Simplifier;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.UnsupportedFormException;
import gov.sandia.symcalc.language.function.AbsoluteValue;
import gov.sandia.symcalc.language.function.Cosine;
import gov.sandia.symcalc.language.function.CubeRoot;
import gov.sandia.symcalc.language.function.Exp;
import gov.sandia.symcalc.language.function.Log;
import gov.sandia.symcalc.language.function.Sine;
import gov.sandia.symcalc.language.function.SquareRoot;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Negate;
import gov.sandia.symcalc.language.operator.Power;

/**
    Recognizes k*g(u)*u', where g is sin, cos, exp, a power u^n or a constant base a^u.
    For each factor of the integrand that could be g(u), the rest of the product is divided by u'.
    If the simplified quotient k is free of the variable, the antiderivative is k*G(u).
    The case u^-1 gives k*ln|u|.
**/
public class Substitution implements IntegrationStrategy
{
    public Operator integrate (Operator integrand, String variable, Integrator chain, int depth)
    {
        Product p = Product.of (integrand);
        for (Product.Factor f : p.dependentOn (variable))
        {
            Operator result = tryFactor (p, f, variable);
            if (result != null) return result;
        }
        return null;
    }

    protected Operator tryFactor (Product p, Product.Factor f, String variable)
    {
        Operator base     = f.base;
        Operator exponent = f.exponent;
        Operator u;
        if (exponent.dependsOn (variable))
        {
            // a^u
            if (base.dependsOn (variable)) return null;
            u = exponent;
            Operator k = quotient (Integrator.without (p, f), u, variable);
            if (k == null) return null;
            return new Multiply (k, new Divide (new Power (base, u), new Log (base)));
        }

        if (Constant.isOne (exponent)  &&  (base instanceof Sine  ||  base instanceof Cosine  ||  base instanceof Exp))
        {
            u = ((Function) base).operands[0];
            Operator k = quotient (Integrator.without (p, f), u, variable);
            if (k != null)
            {
                if (base instanceof Sine  ) return new Multiply (k, new Negate (new Cosine (u)));
                if (base instanceof Cosine) return new Multiply (k, new Sine (u));
                return new Multiply (k, new Exp (u));
            }
        }

        // u^n, with roots written as fractional powers
        Operator n = exponent;
        u = base;
        if (base instanceof SquareRoot)
        {
            u = ((SquareRoot) base).operands[0];
            n = new Divide (exponent, new Constant (2));
        }
        else if (base instanceof CubeRoot)
        {
            u = ((CubeRoot) base).operands[0];
            n = new Divide (exponent, new Constant (3));
        }
        n = Simplifier.simplify (n);
        Operator k = quotient (Integrator.without (p, f), u, variable);
        if (k == null) return null;
        if (n.isScalar ()  &&  n.getDouble () == -1) return new Multiply (k, new Log (new AbsoluteValue (u)));
        Operator n1 = new Add (n, new Constant (1));
        return new Multiply (k, new Divide (new Power (u, n1), n1));
    }

    /**
        @return rest/u', simplified, or null if that still depends on the variable.
    **/
    protected static Operator quotient (Operator rest, Operator u, String variable)
    {
        Operator du;
        try
        {
            du = Simplifier.simplify (u.derivative (variable));
        }
        catch (UnsupportedFormException e)
        {
            return null;
        }
        if (Constant.isZero (du)) return null;
        Operator k = Simplifier.simplify (new Divide (rest, du));
        if (k.dependsOn (variable)) return null;
        return k;
    }
}
