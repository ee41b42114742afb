/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

public class AccessVariable extends Operator
{
    public final String name;

    public AccessVariable (String name)
    {
        this.name = name;
    }

    public Type eval (Bindings context)
    {
        return context.get (name);
    }

    public Operator derivative (String name)
    {
        if (this.name.equals (name)) return new Constant (1);
        return new Constant (0);
    }

    public boolean isPolynomial (String name, boolean strict)
    {
        return true;
    }

    public String getName ()
    {
        return name;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof AccessVariable)) return false;
        return name.equals (((AccessVariable) that).name);
    }

    public int hashCode ()
    {
        return name.hashCode ();
    }
}
