/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.solve;

import gov.sandia.symcalc.language.SymbolicException;

/**
    The system solver ran out of elimination rounds, or found no equation it could make progress on.
**/
@SuppressWarnings("serial")
public class NoConvergenceException extends SymbolicException
{
    public NoConvergenceException (String message)
    {
        super (message);
    }
}
