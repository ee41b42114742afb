/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

/**
    Root of the checked failures reported by the integrator and the solvers.
    Unlike EvaluationException, these are expected outcomes that callers should handle.
**/
@SuppressWarnings("serial")
public class SymbolicException extends Exception
{
    public SymbolicException (String message)
    {
        super (message);
    }

    public SymbolicException (String message, Throwable cause)
    {
        super (message, cause);
    }
}
