/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import java.util.HashMap;
import java.util.Map;

import gov.sandia.symcalc.language.type.Scalar;

/**
    Evaluation environment: values for variables and implementations for named function calls.
**/
public class Bindings
{
    public interface Implementation
    {
        public Type apply (Type[] arguments) throws EvaluationException;
    }

    public Map<String,Type>           values    = new HashMap<String,Type> ();
    public Map<String,Implementation> functions = new HashMap<String,Implementation> ();

    public Bindings ()
    {
    }

    /**
        Convenience constructor for the common case of binding a single variable.
    **/
    public Bindings (String name, double value)
    {
        set (name, value);
    }

    public Bindings set (String name, double value)
    {
        values.put (name, new Scalar (value));
        return this;
    }

    public Bindings set (String name, Type value)
    {
        values.put (name, value);
        return this;
    }

    public boolean isBound (String name)
    {
        return values.containsKey (name);
    }

    public Type get (String name) throws UnboundVariableException
    {
        Type result = values.get (name);
        if (result == null) throw new UnboundVariableException (name);
        return result;
    }

    public Bindings define (String name, Implementation f)
    {
        functions.put (name, f);
        return this;
    }

    public Implementation getFunction (String name) throws UndefinedFunctionException
    {
        Implementation result = functions.get (name);
        if (result == null) throw new UndefinedFunctionException (name);
        return result;
    }
}
