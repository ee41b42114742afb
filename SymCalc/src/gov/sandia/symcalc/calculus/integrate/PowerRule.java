/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus.integrate;

import java.util.List;

import gov.sandia.symcalc.algebra.Product;
import gov.sandia.symcalc.language.AccessVariable;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.function.AbsoluteValue;
import gov.sandia.symcalc.language.function.Log;
import gov.sandia.symcalc.language.function.SquareRoot;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Power;

/**
    c --> c*x, and c*x^n --> c*x^(n+1)/(n+1), with c*x^-1 --> c*ln|x|.
    The exponent may be any expression free of x. sqrt(x) counts as x^(1/2).
**/
public class PowerRule implements IntegrationStrategy
{
    public Operator integrate (Operator integrand, String variable, Integrator chain, int depth)
    {
        AccessVariable x = new AccessVariable (variable);
        if (! integrand.dependsOn (variable)) return new Multiply (integrand, x);

        Product p = Product.of (integrand);
        List<Product.Factor> dependent = p.dependentOn (variable);
        if (dependent.size () != 1) return null;
        Product.Factor f = dependent.get (0);
        if (f.exponent.dependsOn (variable)) return null;

        Operator n;
        if (Integrator.isVariable (f.base, variable))
        {
            n = f.exponent;
        }
        else if (f.base instanceof SquareRoot  &&  Integrator.isVariable (((SquareRoot) f.base).operands[0], variable))
        {
            n = new Divide (f.exponent, new Constant (2));
        }
        else
        {
            return null;
        }

        Operator c = Integrator.constantPart (p, variable);
        if (n.isScalar ()  &&  n.getDouble () == -1) return new Multiply (c, new Log (new AbsoluteValue (x)));
        Operator n1 = new Add (n, new Constant (1));
        return new Multiply (c, new Divide (new Power (x, n1), n1));
    }
}
