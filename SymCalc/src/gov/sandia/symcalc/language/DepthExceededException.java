/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

/**
    A recursive search (integration chain or equation solver) went deeper than its configured limit.
**/
@SuppressWarnings("serial")
public class DepthExceededException extends SymbolicException
{
    public final int depth;

    public DepthExceededException (String what, int depth)
    {
        super (what + " exceeded recursion depth " + depth);
        this.depth = depth;
    }
}
