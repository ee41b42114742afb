/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

@SuppressWarnings("serial")
public class UnboundVariableException extends EvaluationException
{
    public final String name;

    public UnboundVariableException (String name)
    {
        super ("Variable has no binding: " + name);
        this.name = name;
    }
}
