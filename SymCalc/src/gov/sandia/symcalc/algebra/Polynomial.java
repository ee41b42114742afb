/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.algebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.language.AccessVariable;
import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.operator.Subtract;
import gov.sandia.symcalc.language.type.Scalar;

/**
    Polynomial view of an expression in one variable.
    Coefficients are arbitrary trees that don't involve the variable, stored in order of
    ascending power. After construction, every coefficient is simplified and the leading
    coefficient is nonzero, except for the zero polynomial which has the single coefficient 0.
**/
public class Polynomial
{
    public final String      variable;
    protected List<Operator> coefficients;

    public Polynomial (String variable, List<Operator> ascending)
    {
        this.variable = variable;
        coefficients = new ArrayList<Operator> ();
        for (Operator c : ascending) coefficients.add (Simplifier.simplify (c));
        int last = coefficients.size () - 1;
        while (last > 0  &&  isZero (coefficients.get (last))) coefficients.remove (last--);
        if (coefficients.isEmpty ()) coefficients.add (new Constant (0));
    }

    /**
        Extracts the polynomial structure of an expression.
        @throws NotPolynomialException if the variable appears other than in non-negative integer powers,
        for example in a denominator, under a function, or in an exponent.
    **/
    public static Polynomial from (Operator expression, String variable) throws NotPolynomialException
    {
        Operator simple = Simplifier.simplify (expression);
        if (! simple.isPolynomial (variable, false)) throw new NotPolynomialException (expression, variable);
        Sum sum = Sum.of (Expander.expand (simple));

        List<Operator> c = new ArrayList<Operator> ();
        accumulate (c, 0, new Constant (sum.constant));
        for (Sum.Term t : sum.terms)
        {
            Product p = Product.of (t.monomial);
            Product rest = new Product ();
            rest.coefficient = t.coefficient.multiply (p.coefficient);
            int degree = 0;
            for (Product.Factor f : p.factors)
            {
                if (f.base instanceof AccessVariable  &&  ((AccessVariable) f.base).name.equals (variable))
                {
                    if (! Constant.isInteger (f.exponent)  ||  f.exponent.getDouble () < 0) throw new NotPolynomialException (expression, variable);
                    degree += (int) f.exponent.getDouble ();
                }
                else if (f.base.dependsOn (variable)  ||  f.exponent.dependsOn (variable))
                {
                    throw new NotPolynomialException (expression, variable);
                }
                else
                {
                    rest.factors.add (f);
                }
            }
            accumulate (c, degree, rest.toOperator ());
        }
        return new Polynomial (variable, c);
    }

    protected static void accumulate (List<Operator> c, int degree, Operator term)
    {
        while (c.size () <= degree) c.add (new Constant (0));
        c.set (degree, new Add (c.get (degree), term));
    }

    public static boolean isZero (Operator op)
    {
        return op instanceof Constant  &&  Sum.negligible (((Constant) op).value);
    }

    public int degree ()
    {
        return coefficients.size () - 1;
    }

    public boolean isZero ()
    {
        return coefficients.size () == 1  &&  isZero (coefficients.get (0));
    }

    /**
        @return The coefficient of variable^power, or 0 if power is beyond the degree.
    **/
    public Operator get (int power)
    {
        if (power < 0  ||  power >= coefficients.size ()) return new Constant (0);
        return coefficients.get (power);
    }

    public Operator leading ()
    {
        return coefficients.get (coefficients.size () - 1);
    }

    public List<Operator> getCoefficients ()
    {
        return Collections.unmodifiableList (coefficients);
    }

    public List<Operator> getCoefficientsDescending ()
    {
        List<Operator> result = new ArrayList<Operator> (coefficients);
        Collections.reverse (result);
        return result;
    }

    /**
        @return true if every coefficient is a numeric constant (real or complex).
    **/
    public boolean isNumeric ()
    {
        for (Operator c : coefficients) if (! (c instanceof Constant)) return false;
        return true;
    }

    /**
        @return true if every coefficient is a real constant.
    **/
    public boolean isReal ()
    {
        for (Operator c : coefficients) if (! c.isScalar ()) return false;
        return true;
    }

    public Operator toOperator ()
    {
        List<Operator> terms = new ArrayList<Operator> ();
        AccessVariable x = new AccessVariable (variable);
        for (int i = coefficients.size () - 1; i >= 0; i--)
        {
            Operator c = coefficients.get (i);
            if (isZero (c)) continue;
            if      (i == 0) terms.add (c);
            else if (i == 1) terms.add (new Multiply (c, x));
            else             terms.add (new Multiply (c, new Power (x, new Constant (i))));
        }
        return Simplifier.simplify (Sum.sum (terms));
    }

    /**
        Horner evaluation. Coefficients may refer to other variables bound in context.
    **/
    public Type evaluate (Type x, Bindings context)
    {
        Type result = new Scalar (0);
        for (int i = coefficients.size () - 1; i >= 0; i--)
        {
            result = result.multiply (x).add (coefficients.get (i).eval (context));
        }
        return result;
    }

    public Polynomial add (Polynomial that)
    {
        List<Operator> c = new ArrayList<Operator> ();
        int count = Math.max (coefficients.size (), that.coefficients.size ());
        for (int i = 0; i < count; i++) c.add (new Add (get (i), that.get (i)));
        return new Polynomial (variable, c);
    }

    public Polynomial subtract (Polynomial that)
    {
        List<Operator> c = new ArrayList<Operator> ();
        int count = Math.max (coefficients.size (), that.coefficients.size ());
        for (int i = 0; i < count; i++) c.add (new Subtract (get (i), that.get (i)));
        return new Polynomial (variable, c);
    }

    public Polynomial multiply (Polynomial that)
    {
        List<Operator> c = new ArrayList<Operator> ();
        for (int i = 0; i < coefficients.size (); i++)
        {
            for (int j = 0; j < that.coefficients.size (); j++)
            {
                accumulate (c, i + j, new Multiply (coefficients.get (i), that.coefficients.get (j)));
            }
        }
        return new Polynomial (variable, c);
    }

    public Polynomial power (int n)
    {
        List<Operator> one = new ArrayList<Operator> ();
        one.add (new Constant (1));
        Polynomial result = new Polynomial (variable, one);
        for (int i = 0; i < n; i++) result = result.multiply (this);
        return result;
    }

    public static Polynomial constant (String variable, Operator value)
    {
        List<Operator> c = new ArrayList<Operator> ();
        c.add (value);
        return new Polynomial (variable, c);
    }

    public String toString ()
    {
        return toOperator ().toString ();
    }

    // Numeric utilities ------------------------------------------------------
    // Real coefficient arrays in ascending order of power. The zero polynomial is an empty array.

    /**
        @return The real coefficients of this polynomial, or null if any coefficient is not a real constant.
    **/
    public double[] toArray ()
    {
        if (! isReal ()) return null;
        double[] result = new double[coefficients.size ()];
        for (int i = 0; i < result.length; i++) result[i] = coefficients.get (i).getDouble ();
        return trim (result, 1);
    }

    /**
        Builds a polynomial from real coefficients, snapping values that are within tolerance of an integer.
    **/
    public static Polynomial fromArray (String variable, double[] ascending)
    {
        List<Operator> c = new ArrayList<Operator> ();
        for (double a : ascending)
        {
            double r = Math.rint (a);
            if (Settings.isZero (a - r, a)) a = r;
            c.add (new Constant (a));
        }
        return new Polynomial (variable, c);
    }

    public static double maxMagnitude (double[] a)
    {
        double result = 0;
        for (double v : a) result = Math.max (result, Math.abs (v));
        return result;
    }

    /**
        Removes negligible leading (highest power) coefficients.
    **/
    public static double[] trim (double[] a, double scale)
    {
        int n = a.length;
        while (n > 0  &&  Settings.isZero (a[n-1], scale)) n--;
        if (n == a.length) return a;
        double[] result = new double[n];
        System.arraycopy (a, 0, result, 0, n);
        return result;
    }

    /**
        Long division.
        @return {quotient, remainder}
    **/
    public static double[][] divide (double[] a, double[] b)
    {
        if (b.length == 0) throw new ArithmeticException ("Polynomial division by zero");
        if (a.length < b.length) return new double[][] {new double[0], a.clone ()};
        double[] r = a.clone ();
        double[] q = new double[a.length - b.length + 1];
        double lead = b[b.length - 1];
        for (int i = q.length - 1; i >= 0; i--)
        {
            double t = r[i + b.length - 1] / lead;
            q[i] = t;
            for (int j = 0; j < b.length; j++) r[i + j] -= t * b[j];
        }
        double[] remainder = new double[b.length - 1];
        System.arraycopy (r, 0, remainder, 0, remainder.length);
        return new double[][] {q, remainder};
    }

    /**
        Greatest common divisor by Euclid's algorithm, normalized to be monic.
        Remainders below tolerance (relative to the largest input coefficient) count as zero.
    **/
    public static double[] gcd (double[] a, double[] b)
    {
        double scale = Math.max (maxMagnitude (a), maxMagnitude (b));
        a = trim (a, scale);
        b = trim (b, scale);
        if (a.length < b.length)
        {
            double[] t = a;
            a = b;
            b = t;
        }
        while (b.length > 0)
        {
            double[] r = trim (divide (a, b)[1], scale);
            a = b;
            b = r;
        }
        if (a.length == 0) return a;
        double lead = a[a.length - 1];
        double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) result[i] = a[i] / lead;
        return result;
    }
}
