/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus.integrate;

import gov.sandia.symcalc.language.DepthExceededException;
import gov.sandia.symcalc.language.Operator;

/**
    One pattern in the integration chain.
**/
public interface IntegrationStrategy
{
    /**
        @param integrand Already simplified.
        @param chain For integrating sub-expressions. Pass depth+1 to any recursive call.
        @return An antiderivative with respect to variable, or null if this strategy does not apply.
        A strategy that needs a recursive integral which fails also returns null.
    **/
    public Operator integrate (Operator integrand, String variable, Integrator chain, int depth) throws DepthExceededException;
}
