/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus.integrate;

import java.util.List;

import gov.sandia.symcalc.algebra.NotPolynomialException;
import gov.sandia.symcalc.algebra.Polynomial;
import gov.sandia.symcalc.algebra.Product;
import gov.sandia.symcalc.algebra.Simplifier;
import gov.sandia.symcalc.language.AccessVariable;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.function.ArcSine;
import gov.sandia.symcalc.language.function.ArcTangent;
import gov.sandia.symcalc.language.function.SquareRoot;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Negate;

/**
    c/(p*x^2+q) --> c/(p*a)*atan(x/a) with a = sqrt(q/p), and
    c/sqrt(q-p*x^2) --> c/sqrt(p)*asin(x/a) with a = sqrt(q/p).
    q and p may be symbolic, as long as they are free of x.
    Numeric values must have the signs shown, so that a is real.
**/
public class InverseTrigonometric implements IntegrationStrategy
{
    public Operator integrate (Operator integrand, String variable, Integrator chain, int depth)
    {
        Product p = Product.of (integrand);
        List<Product.Factor> dependent = p.dependentOn (variable);
        if (dependent.size () != 1) return null;
        Product.Factor f = dependent.get (0);
        if (! f.exponent.isScalar ()) return null;
        double e = f.exponent.getDouble ();

        Operator quadratic;
        boolean  root;
        if      (e == -1  &&  f.base instanceof SquareRoot) {quadratic = ((SquareRoot) f.base).operands[0]; root = true;}
        else if (e == -0.5)                                  {quadratic = f.base;                              root = true;}
        else if (e == -1)                                    {quadratic = f.base;                              root = false;}
        else return null;

        if (! quadratic.isPolynomial (variable, false)) return null;
        Polynomial q;
        try
        {
            q = Polynomial.from (quadratic, variable);
        }
        catch (NotPolynomialException ex)
        {
            return null;
        }
        if (q.degree () != 2  ||  ! Polynomial.isZero (q.get (1))) return null;
        Operator q2 = q.get (2);
        Operator q0 = q.get (0);
        if (Polynomial.isZero (q0)) return null;

        Operator c = Integrator.constantPart (p, variable);
        AccessVariable x = new AccessVariable (variable);
        if (root)
        {
            // q0 - k*x^2, with k = -q2
            Operator k = Simplifier.simplify (new Negate (q2));
            if (negative (k)  ||  negative (q0)) return null;
            Operator a = Simplifier.simplify (new SquareRoot (new Divide (q0, k)));
            Operator scale = Simplifier.simplify (new Divide (c, new SquareRoot (k)));
            return new Multiply (scale, new ArcSine (new Divide (x, a)));
        }
        if (negative (q2)  ||  negative (q0)) return null;
        Operator a = Simplifier.simplify (new SquareRoot (new Divide (q0, q2)));
        Operator scale = Simplifier.simplify (new Divide (c, new Multiply (q2, a)));
        return new Multiply (scale, new ArcTangent (new Divide (x, a)));
    }

    /**
        @return true if the operator is a negative number, or visibly negated.
    **/
    protected static boolean negative (Operator op)
    {
        if (op instanceof Constant) return ! op.isScalar ()  ||  op.getDouble () < 0;
        return op instanceof Negate;
    }
}
