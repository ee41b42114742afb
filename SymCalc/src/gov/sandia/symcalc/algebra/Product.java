/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.algebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.EvaluationException;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Negate;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.type.Scalar;

/**
    Flattened view of a product: a numeric coefficient times a list of base^exponent factors.
    Nested Multiply, Divide, Negate and Power nodes are unpacked, numeric literals are folded
    into the coefficient, and equal bases are combined by adding their exponents.

    <p>toOperator() rebuilds the canonical tree: coefficient leftmost, factors in the order
    given by OperatorComparator, and factors with negative numeric exponents moved into a
    single denominator. Flattening the canonical tree again produces the same Product, which
    is what makes the simplifier idempotent on products.
**/
public class Product
{
    public static class Factor
    {
        public final Operator base;
        public Operator       exponent;

        public Factor (Operator base, Operator exponent)
        {
            this.base     = base;
            this.exponent = exponent;
        }
    }

    public Type         coefficient = new Scalar (1);
    public List<Factor> factors     = new ArrayList<Factor> ();

    public static Product of (Operator op)
    {
        Product result = new Product ();
        result.multiply (op, false);
        return result;
    }

    /**
        Multiplies this product by the given tree, or divides by it if invert is true.
    **/
    public void multiply (Operator op, boolean invert)
    {
        if (op instanceof Constant)
        {
            Type value = ((Constant) op).value;
            if (invert) coefficient = coefficient.divide   (value);
            else        coefficient = coefficient.multiply (value);
            return;
        }
        if (op instanceof Negate)
        {
            coefficient = coefficient.negate ();
            multiply (((Negate) op).operand, invert);
            return;
        }
        if (op instanceof Multiply)
        {
            Multiply m = (Multiply) op;
            multiply (m.operand0, invert);
            multiply (m.operand1, invert);
            return;
        }
        if (op instanceof Divide)
        {
            Divide d = (Divide) op;
            multiply (d.operand0,   invert);
            multiply (d.operand1, ! invert);
            return;
        }
        if (op instanceof Power)
        {
            Power p = (Power) op;
            Operator e = p.operand1;
            if (invert) e = negate (e);
            addFactor (p.operand0, e);
            return;
        }
        addFactor (op, new Constant (invert ? -1 : 1));
    }

    public void addFactor (Operator base, Operator exponent)
    {
        if (base instanceof Constant  &&  exponent instanceof Constant)
        {
            Type folded = fold (((Constant) base).value, ((Constant) exponent).value);
            if (folded != null)
            {
                coefficient = coefficient.multiply (folded);
                return;
            }
        }
        for (Factor f : factors)
        {
            if (f.base.equals (base))
            {
                f.exponent = add (f.exponent, exponent);
                return;
            }
        }
        factors.add (new Factor (base, exponent));
    }

    /**
        @return The factors whose base depends on the named variable.
    **/
    public List<Factor> dependentOn (String variable)
    {
        List<Factor> result = new ArrayList<Factor> ();
        for (Factor f : factors) if (f.base.dependsOn (variable)  ||  f.exponent.dependsOn (variable)) result.add (f);
        return result;
    }

    /**
        Builds a new product from a subset of the factors, with the given coefficient.
    **/
    public static Product from (Type coefficient, List<Factor> factors)
    {
        Product result = new Product ();
        result.coefficient = coefficient;
        for (Factor f : factors) result.factors.add (new Factor (f.base, f.exponent));
        return result;
    }

    public Operator toOperator ()
    {
        if (coefficient.isZero ()) return new Constant (0);

        List<Factor> sorted = new ArrayList<Factor> ();
        for (Factor f : factors) if (! Constant.isZero (f.exponent)) sorted.add (f);
        Collections.sort (sorted, new Comparator<Factor> ()
        {
            public int compare (Factor a, Factor b)
            {
                return OperatorComparator.compareStructure (a.base, b.base);
            }
        });

        Operator numerator   = null;
        Operator denominator = null;
        for (Factor f : sorted)
        {
            if (f.exponent.isScalar ()  &&  f.exponent.getDouble () < 0)
            {
                denominator = times (denominator, power (f.base, new Constant (-f.exponent.getDouble ())));
            }
            else
            {
                numerator = times (numerator, power (f.base, f.exponent));
            }
        }

        if (numerator == null  &&  denominator == null) return new Constant (coefficient);
        boolean one      = coefficient.isOne ();
        boolean minusOne = coefficient instanceof Scalar  &&  ((Scalar) coefficient).value == -1;

        Operator top;
        if      (numerator == null) top = new Constant (coefficient);
        else if (one              ) top = numerator;
        else if (minusOne         ) top = new Negate (numerator);
        else                        top = new Multiply (new Constant (coefficient), numerator);

        if (denominator == null) return top;
        return new Divide (top, denominator);
    }

    protected static Operator times (Operator a, Operator b)
    {
        if (a == null) return b;
        return new Multiply (a, b);
    }

    protected static Operator power (Operator base, Operator exponent)
    {
        if (Constant.isOne (exponent)) return base;
        return new Power (base, exponent);
    }

    protected static Operator add (Operator a, Operator b)
    {
        if (a instanceof Constant  &&  b instanceof Constant) return new Constant (((Constant) a).value.add (((Constant) b).value));
        return new Add (a, b).simplify ();
    }

    protected static Operator negate (Operator e)
    {
        if (e instanceof Constant) return new Constant (((Constant) e).value.negate ());
        return new Negate (e).simplify ();
    }

    /**
        @return base^exponent as a number, or null if the result leaves the real domain.
    **/
    protected static Type fold (Type base, Type exponent)
    {
        try
        {
            return base.power (exponent);
        }
        catch (EvaluationException e)
        {
            return null;
        }
    }
}
