/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

/**
    Holds a numeric value, and knows how to perform operations with all other numeric types.
    Encodes rules for automatic type promotion in the context of an operation.
**/
public abstract class Type implements Comparable<Type>
{
    public Type add (Type that) throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type subtract (Type that) throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type multiply (Type that) throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type divide (Type that) throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type modulo (Type that) throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type power (Type that) throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type negate () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type sin () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type cos () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type tan () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type asin () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type acos () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type atan () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type sinh () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type cosh () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type tanh () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type exp () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    /**
        Natural logarithm.
    **/
    public Type log () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type sqrt () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type cbrt () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type abs () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    /**
        @return The magnitude of this value, for tolerance tests.
    **/
    public abstract double magnitude ();

    /**
        @return true if this value is exactly zero.
    **/
    public abstract boolean isZero ();

    /**
        @return true if this value is exactly one.
    **/
    public boolean isOne ()
    {
        return false;
    }

    /**
        @return true if this value is within epsilon of that.
    **/
    public boolean approximately (Type that, double epsilon)
    {
        return subtract (that).magnitude () <= epsilon * Math.max (1, Math.max (magnitude (), that.magnitude ()));
    }

    /**
        Determines whether this type carries more information than that, for the purpose of
        promotion when two values meet in an operation.
    **/
    public boolean betterThan (Type that)
    {
        return false;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Type)) return false;
        return compareTo ((Type) that) == 0;
    }

    public abstract int hashCode ();
}
