/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus.integrate;

import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.SymbolicException;

@SuppressWarnings("serial")
public class NoIntegrationRuleException extends SymbolicException
{
    public final Operator integrand;

    public NoIntegrationRuleException (Operator integrand, String variable)
    {
        super ("No integration rule applies to " + integrand + " with respect to " + variable);
        this.integrand = integrand;
    }
}
