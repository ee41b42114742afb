/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

/**
    The requested symbolic operation has no rule for this node, such as the derivative
    of an opaque function call or the inverse of a modulo.
**/
@SuppressWarnings("serial")
public class UnsupportedFormException extends EvaluationException
{
    public UnsupportedFormException (String message)
    {
        super (message);
    }
}
