/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus;

import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.SymbolicException;

@SuppressWarnings("serial")
public class NoLimitException extends SymbolicException
{
    public final Operator expression;

    public NoLimitException (Operator expression, String variable, Operator point)
    {
        super ("No finite limit of " + expression + " as " + variable + " approaches " + point);
        this.expression = expression;
    }
}
