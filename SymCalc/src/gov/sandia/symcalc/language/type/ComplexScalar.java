/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.type;

import org.apache.commons.math3.complex.Complex;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.language.EvaluationException;
import gov.sandia.symcalc.language.Type;

/**
    Complex floating-point type, backed by commons-math Complex.
    Every operation accepts a Scalar operand by promoting it. Transcendental functions
    return principal values, so they are total where Scalar would throw DomainException.
**/
public class ComplexScalar extends Type
{
    public final Complex value;

    public ComplexScalar (double real, double imaginary)
    {
        value = new Complex (real, imaginary);
    }

    public ComplexScalar (Complex value)
    {
        this.value = value;
    }

    /**
        Converts a complex result to the simplest type that holds it.
        If the imaginary part is negligible relative to the real part, the result is a Scalar.
    **/
    public static Type reduce (Complex c)
    {
        if (Settings.isZero (c.getImaginary (), c.getReal ())) return new Scalar (c.getReal ());
        return new ComplexScalar (c);
    }

    public static Complex toComplex (Type t) throws EvaluationException
    {
        if (t instanceof ComplexScalar) return ((ComplexScalar) t).value;
        if (t instanceof Scalar       ) return new Complex (((Scalar) t).value, 0);
        throw new EvaluationException ("type mismatch");
    }

    public double getReal ()
    {
        return value.getReal ();
    }

    public double getImaginary ()
    {
        return value.getImaginary ();
    }

    public boolean isZero ()
    {
        return value.getReal () == 0  &&  value.getImaginary () == 0;
    }

    public double magnitude ()
    {
        return value.abs ();
    }

    public Type add (Type that) throws EvaluationException
    {
        return new ComplexScalar (value.add (toComplex (that)));
    }

    public Type subtract (Type that) throws EvaluationException
    {
        return new ComplexScalar (value.subtract (toComplex (that)));
    }

    public Type multiply (Type that) throws EvaluationException
    {
        return new ComplexScalar (value.multiply (toComplex (that)));
    }

    public Type divide (Type that) throws EvaluationException
    {
        return new ComplexScalar (value.divide (toComplex (that)));
    }

    public Type power (Type that) throws EvaluationException
    {
        Complex b = toComplex (that);
        if (isZero ())
        {
            if (b.getReal () > 0) return new ComplexScalar (0, 0);
            if (b.getReal () == 0  &&  b.getImaginary () == 0) return new ComplexScalar (1, 0);
        }
        if (that instanceof Scalar)
        {
            double e = ((Scalar) that).value;
            if (e == Math.rint (e)  &&  Math.abs (e) <= 64)  // exact repeated multiplication for small integer powers
            {
                Complex result = Complex.ONE;
                for (int i = (int) Math.abs (e); i > 0; i--) result = result.multiply (value);
                if (e < 0) result = Complex.ONE.divide (result);
                return new ComplexScalar (result);
            }
        }
        return new ComplexScalar (value.pow (b));
    }

    public Type negate ()
    {
        return new ComplexScalar (value.negate ());
    }

    public Type sin ()
    {
        return new ComplexScalar (value.sin ());
    }

    public Type cos ()
    {
        return new ComplexScalar (value.cos ());
    }

    public Type tan ()
    {
        return new ComplexScalar (value.tan ());
    }

    public Type asin ()
    {
        return new ComplexScalar (value.asin ());
    }

    public Type acos ()
    {
        return new ComplexScalar (value.acos ());
    }

    public Type atan ()
    {
        return new ComplexScalar (value.atan ());
    }

    public Type sinh ()
    {
        return new ComplexScalar (value.sinh ());
    }

    public Type cosh ()
    {
        return new ComplexScalar (value.cosh ());
    }

    public Type tanh ()
    {
        return new ComplexScalar (value.tanh ());
    }

    public Type exp ()
    {
        return new ComplexScalar (value.exp ());
    }

    public Type log ()
    {
        return new ComplexScalar (value.log ());
    }

    public Type sqrt ()
    {
        return new ComplexScalar (value.sqrt ());
    }

    /**
        Principal cube root.
    **/
    public Type cbrt ()
    {
        if (isZero ()) return new ComplexScalar (0, 0);
        return new ComplexScalar (value.nthRoot (3).get (0));
    }

    public Type abs ()
    {
        return new Scalar (value.abs ());
    }

    public boolean betterThan (Type that)
    {
        return that instanceof Scalar;
    }

    public String toString ()
    {
        double re = value.getReal ();
        double im = value.getImaginary ();
        if (re == 0) return Scalar.print (im) + "i";
        String sign = im < 0 ? "-" : "+";
        return "(" + Scalar.print (re) + sign + Scalar.print (Math.abs (im)) + "i)";
    }

    public int compareTo (Type that)
    {
        Complex c = toComplex (that);
        int result = Double.compare (value.getReal (), c.getReal ());
        if (result != 0) return result;
        return Double.compare (value.getImaginary (), c.getImaginary ());
    }

    /**
        A complex value is never equal to a Scalar, even when its imaginary part is zero.
        This keeps structural comparison of Constants exact.
    **/
    public boolean equals (Object that)
    {
        if (! (that instanceof ComplexScalar)) return false;
        return compareTo ((Type) that) == 0;
    }

    public int hashCode ()
    {
        return 31 * Double.hashCode (value.getReal ()) + Double.hashCode (value.getImaginary ());
    }
}
