/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.type;

import gov.sandia.symcalc.language.DomainException;
import gov.sandia.symcalc.language.EvaluationException;
import gov.sandia.symcalc.language.Type;

/**
    Real floating-point type.
    Operations that leave the real domain throw DomainException. When the other operand
    is complex, the operation is promoted to ComplexScalar instead.
**/
public class Scalar extends Type
{
    public final double value;

    public static final double epsilon = Math.ulp (1.0);

    public Scalar (double value)
    {
        this.value = value == 0 ? 0 : value;  // fold -0 into 0 so that structural comparison treats them alike
    }

    public boolean isZero ()
    {
        return value == 0;
    }

    public boolean isOne ()
    {
        return value == 1;
    }

    public boolean isInteger ()
    {
        return value == Math.rint (value)  &&  ! Double.isInfinite (value);
    }

    public double magnitude ()
    {
        return Math.abs (value);
    }

    public ComplexScalar promote ()
    {
        return new ComplexScalar (value, 0);
    }

    public Type add (Type that) throws EvaluationException
    {
        if (that instanceof Scalar       ) return new Scalar (value + ((Scalar) that).value);
        if (that instanceof ComplexScalar) return promote ().add (that);
        throw new EvaluationException ("type mismatch");
    }

    public Type subtract (Type that) throws EvaluationException
    {
        if (that instanceof Scalar       ) return new Scalar (value - ((Scalar) that).value);
        if (that instanceof ComplexScalar) return promote ().subtract (that);
        throw new EvaluationException ("type mismatch");
    }

    public Type multiply (Type that) throws EvaluationException
    {
        if (that instanceof Scalar       ) return new Scalar (value * ((Scalar) that).value);
        if (that instanceof ComplexScalar) return promote ().multiply (that);
        throw new EvaluationException ("type mismatch");
    }

    public Type divide (Type that) throws EvaluationException
    {
        if (that instanceof Scalar       ) return new Scalar (value / ((Scalar) that).value);
        if (that instanceof ComplexScalar) return promote ().divide (that);
        throw new EvaluationException ("type mismatch");
    }

    public Type modulo (Type that) throws EvaluationException
    {
        if (that instanceof Scalar)
        {
            double b = ((Scalar) that).value;
            return new Scalar (value - Math.floor (value / b) * b);
        }
        throw new EvaluationException ("type mismatch");
    }

    public Type power (Type that) throws EvaluationException
    {
        if (that instanceof Scalar)
        {
            double b = ((Scalar) that).value;
            if (value < 0  &&  b != Math.rint (b)) throw new DomainException ("Negative base " + this + " raised to non-integer power " + that);
            return new Scalar (Math.pow (value, b));
        }
        if (that instanceof ComplexScalar) return promote ().power (that);
        throw new EvaluationException ("type mismatch");
    }

    public Type negate ()
    {
        return new Scalar (-value);
    }

    public Type sin ()
    {
        return new Scalar (Math.sin (value));
    }

    public Type cos ()
    {
        return new Scalar (Math.cos (value));
    }

    public Type tan ()
    {
        return new Scalar (Math.tan (value));
    }

    public Type asin ()
    {
        if (value < -1  ||  value > 1) throw new DomainException ("asin(" + this + ") is outside [-1,1]");
        return new Scalar (Math.asin (value));
    }

    public Type acos ()
    {
        if (value < -1  ||  value > 1) throw new DomainException ("acos(" + this + ") is outside [-1,1]");
        return new Scalar (Math.acos (value));
    }

    public Type atan ()
    {
        return new Scalar (Math.atan (value));
    }

    public Type sinh ()
    {
        return new Scalar (Math.sinh (value));
    }

    public Type cosh ()
    {
        return new Scalar (Math.cosh (value));
    }

    public Type tanh ()
    {
        return new Scalar (Math.tanh (value));
    }

    public Type exp ()
    {
        return new Scalar (Math.exp (value));
    }

    public Type log ()
    {
        if (value < 0) throw new DomainException ("Logarithm of negative number " + this);
        return new Scalar (Math.log (value));
    }

    public Type sqrt ()
    {
        if (value < 0) throw new DomainException ("Square root of negative number " + this);
        return new Scalar (Math.sqrt (value));
    }

    public Type cbrt ()
    {
        return new Scalar (Math.cbrt (value));
    }

    public Type abs ()
    {
        return new Scalar (Math.abs (value));
    }

    public boolean betterThan (Type that)
    {
        return false;
    }

    /**
        Formats a double without spurious precision, for example "2" rather than "2.0".
    **/
    public static String print (double d)
    {
        // Round to integer?
        long l = Math.round (d);
        if (l != 0  &&  Math.abs (d - l) < epsilon) return String.valueOf (l);

        String result = String.valueOf (d).toLowerCase ();  // get rid of upper-case E
        result = result.replace (".0e", "e");
        if (result.endsWith (".0")) result = result.substring (0, result.length () - 2);
        if (result.equals ("-0")) result = "0";
        return result;
    }

    public String toString ()
    {
        return print (value);
    }

    public int compareTo (Type that)
    {
        if (that instanceof Scalar       ) return Double.compare (value, ((Scalar) that).value);
        if (that instanceof ComplexScalar) return promote ().compareTo (that);
        throw new EvaluationException ("type mismatch");
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Scalar)) return false;
        return Double.compare (value, ((Scalar) that).value) == 0;
    }

    public int hashCode ()
    {
        return Double.hashCode (value);
    }
}
