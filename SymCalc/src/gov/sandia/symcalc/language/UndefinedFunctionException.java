/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

@SuppressWarnings("serial")
public class UndefinedFunctionException extends EvaluationException
{
    public final String name;

    public UndefinedFunctionException (String name)
    {
        super ("Function is not defined: " + name);
        this.name = name;
    }
}
