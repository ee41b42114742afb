/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus.integrate;

import gov.sandia.symcalc.algebra.TrigSimplifier;
import gov.sandia.symcalc.language.AccessVariable;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.DepthExceededException;
import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.function.AbsoluteValue;
import gov.sandia.symcalc.language.function.Cosecant;
import gov.sandia.symcalc.language.function.Cosine;
import gov.sandia.symcalc.language.function.Cotangent;
import gov.sandia.symcalc.language.function.Log;
import gov.sandia.symcalc.language.function.Secant;
import gov.sandia.symcalc.language.function.Sine;
import gov.sandia.symcalc.language.function.Tangent;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Negate;
import gov.sandia.symcalc.language.operator.Power;

/**
    Trigonometric functions of the bare variable, their squares, and sec^2 and csc^2.
    sin^2 and cos^2 are rewritten with half-angle identities and handed back to the chain.
**/
public class BasicTrigonometric implements IntegrationStrategy
{
    public Operator integrate (Operator integrand, String variable, Integrator chain, int depth) throws DepthExceededException
    {
        AccessVariable x = new AccessVariable (variable);
        if (integrand instanceof Function)
        {
            Function f = (Function) integrand;
            if (f.operands.length != 1  ||  ! Integrator.isVariable (f.operands[0], variable)) return null;
            if (f instanceof Sine     ) return new Negate (new Cosine (x));
            if (f instanceof Cosine   ) return new Sine (x);
            if (f instanceof Tangent  ) return new Negate (new Log (new AbsoluteValue (new Cosine (x))));
            if (f instanceof Cotangent) return new Log (new AbsoluteValue (new Sine (x)));
            if (f instanceof Secant   ) return new Log (new AbsoluteValue (new Add (new Secant (x), new Tangent (x))));
            if (f instanceof Cosecant ) return new Negate (new Log (new AbsoluteValue (new Add (new Cosecant (x), new Cotangent (x)))));
            return null;
        }

        if (! (integrand instanceof Power)) return null;
        Power p = (Power) integrand;
        if (! (p.operand0 instanceof Function)  ||  ! Constant.isInteger (p.operand1)  ||  p.operand1.getDouble () != 2) return null;
        Function f = (Function) p.operand0;
        if (f.operands.length != 1  ||  ! Integrator.isVariable (f.operands[0], variable)) return null;
        if (f instanceof Secant  ) return new Tangent (x);
        if (f instanceof Cosecant) return new Negate (new Cotangent (x));
        if (f instanceof Sine  ||  f instanceof Cosine)
        {
            return chain.attempt (TrigSimplifier.reducePowers (integrand), variable, depth + 1);
        }
        return null;
    }
}
