/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.algebra;

import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.SymbolicException;

@SuppressWarnings("serial")
public class NotPolynomialException extends SymbolicException
{
    public NotPolynomialException (Operator expression, String variable)
    {
        super ("Not a polynomial in " + variable + ": " + expression);
    }

    public NotPolynomialException (String message)
    {
        super (message);
    }
}
