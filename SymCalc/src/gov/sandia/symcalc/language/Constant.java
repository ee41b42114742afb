/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import gov.sandia.symcalc.language.type.ComplexScalar;
import gov.sandia.symcalc.language.type.Scalar;

public class Constant extends Operator
{
    public final Type value;

    public Constant (Type value)
    {
        this.value = value;
    }

    public Constant (double value)
    {
        this.value = new Scalar (value);
    }

    public Type eval (Bindings context)
    {
        return value;
    }

    public Operator derivative (String name)
    {
        return new Constant (0);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        String text = value.toString ();
        // A leading minus sign would otherwise bind ambiguously with the surrounding operator.
        if (text.startsWith ("-")) renderer.result.append ("(" + text + ")");
        else                       renderer.result.append (text);
    }

    public String getName ()
    {
        return value.toString ();
    }

    public boolean isNegative ()
    {
        return value instanceof Scalar  &&  ((Scalar) value).value < 0;
    }

    public boolean isComplex ()
    {
        return value instanceof ComplexScalar;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Constant)) return false;
        return value.equals (((Constant) that).value);
    }

    public int hashCode ()
    {
        return value.hashCode ();
    }

    public static boolean isZero (Operator op)
    {
        return op instanceof Constant  &&  ((Constant) op).value.isZero ();
    }

    public static boolean isOne (Operator op)
    {
        return op instanceof Constant  &&  ((Constant) op).value.isOne ();
    }

    /**
        @return true if op is a real constant with an integer value.
    **/
    public static boolean isInteger (Operator op)
    {
        return op instanceof Constant  &&  ((Constant) op).value instanceof Scalar  &&  ((Scalar) ((Constant) op).value).isInteger ();
    }
}
