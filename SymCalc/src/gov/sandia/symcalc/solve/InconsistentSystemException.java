/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.solve;

import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.SymbolicException;

@SuppressWarnings("serial")
public class InconsistentSystemException extends SymbolicException
{
    public final Operator residual;

    public InconsistentSystemException (Operator residual)
    {
        super ("System of equations is inconsistent: reduced to " + residual + " = 0");
        this.residual = residual;
    }
}
