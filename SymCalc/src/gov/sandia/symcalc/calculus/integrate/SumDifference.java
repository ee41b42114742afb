/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus.integrate;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.symcalc.algebra.Expander;
import gov.sandia.symcalc.algebra.Sum;
import gov.sandia.symcalc.language.DepthExceededException;
import gov.sandia.symcalc.language.Operator;

/**
    Integrates a sum term by term. Every term must succeed.
    A product that contains a sum, such as x*(x+1), is expanded first.
**/
public class SumDifference implements IntegrationStrategy
{
    public Operator integrate (Operator integrand, String variable, Integrator chain, int depth) throws DepthExceededException
    {
        List<Operator> terms = Sum.terms (integrand);
        if (terms.size () < 2)
        {
            terms = Sum.terms (Expander.expand (integrand));
            if (terms.size () < 2) return null;
        }

        List<Operator> result = new ArrayList<Operator> ();
        for (Operator t : terms)
        {
            Operator F = chain.attempt (t, variable, depth + 1);
            if (F == null) return null;
            result.add (F);
        }
        return Sum.sum (result);
    }
}
