/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.solve;

import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.SymbolicException;

/**
    The equation is polynomial, but its degree has no closed-form solver and the variable can't be isolated.
**/
@SuppressWarnings("serial")
public class UnsupportedDegreeException extends SymbolicException
{
    public final int degree;

    public UnsupportedDegreeException (Operator expression, String variable, int degree)
    {
        super ("Can't solve " + expression + " = 0 for " + variable + ": degree " + degree + " has no closed form");
        this.degree = degree;
    }
}
