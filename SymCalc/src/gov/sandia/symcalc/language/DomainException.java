/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

/**
    A real-valued operation was applied outside its domain, for example asin(2) or ln(-1).
    The same operation on a complex value does not raise this.
**/
@SuppressWarnings("serial")
public class DomainException extends EvaluationException
{
    public DomainException (String message)
    {
        super (message);
    }
}
