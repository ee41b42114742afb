/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus.integrate;

import gov.sandia.symcalc.language.AccessVariable;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.function.Exp;
import gov.sandia.symcalc.language.function.Log;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Power;

/**
    exp(x) --> exp(x), and a^x --> a^x/ln(a) for a base free of x.
**/
public class Exponential implements IntegrationStrategy
{
    public Operator integrate (Operator integrand, String variable, Integrator chain, int depth)
    {
        if (integrand instanceof Exp)
        {
            if (Integrator.isVariable (((Exp) integrand).operands[0], variable)) return integrand;
            return null;
        }
        if (integrand instanceof Power)
        {
            Power p = (Power) integrand;
            if (p.operand0.dependsOn (variable)  ||  ! Integrator.isVariable (p.operand1, variable)) return null;
            return new Divide (new Power (p.operand0, new AccessVariable (variable)), new Log (p.operand0));
        }
        return null;
    }
}
