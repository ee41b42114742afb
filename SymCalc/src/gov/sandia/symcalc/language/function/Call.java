/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.function;

import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.UnsupportedFormException;

/**
    Application of a named function that has no built-in implementation.
    The implementation is looked up in Bindings at evaluation time, so the call is
    opaque to every symbolic operation.
**/
public class Call extends Function
{
    public final String name;

    public Call (String name, Operator... operands)
    {
        super (operands);
        this.name = name;
    }

    public Function newInstance (Operator... operands)
    {
        return new Call (name, operands);
    }

    public boolean canFold ()
    {
        return false;
    }

    public Type eval (Bindings context)
    {
        Bindings.Implementation f = context.getFunction (name);
        Type[] arguments = new Type[operands.length];
        for (int i = 0; i < operands.length; i++) arguments[i] = operands[i].eval (context);
        return f.apply (arguments);
    }

    public Operator derivative (String variable) throws UnsupportedFormException
    {
        for (Operator o : operands)
        {
            if (o.dependsOn (variable)) throw new UnsupportedFormException ("No derivative rule for " + name + "()");
        }
        return new Constant (0);
    }

    public String getName ()
    {
        return name;
    }
}
