/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus.integrate;

import java.util.List;

import gov.sandia.symcalc.algebra.Product;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.DepthExceededException;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.type.Scalar;

/**
    c*f --> c*integral(f), where c is everything in the product that is free of the variable.
**/
public class ConstantMultiple implements IntegrationStrategy
{
    public Operator integrate (Operator integrand, String variable, Integrator chain, int depth) throws DepthExceededException
    {
        Product p = Product.of (integrand);
        List<Product.Factor> dependent = p.dependentOn (variable);
        if (dependent.isEmpty ()) return null;
        Operator c = Integrator.constantPart (p, variable);
        if (Constant.isOne (c)) return null;

        Operator f = Product.from (new Scalar (1), dependent).toOperator ();
        Operator F = chain.attempt (f, variable, depth + 1);
        if (F == null) return null;
        return new Multiply (c, F);
    }
}
