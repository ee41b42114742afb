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

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Negate;
import gov.sandia.symcalc.language.operator.Subtract;
import gov.sandia.symcalc.language.type.Scalar;

/**
    Flattened view of a sum: a numeric constant plus a list of coefficient*monomial terms.
    Each monomial is a canonical Product with coefficient 1, so like terms are found by
    structural equality and combined by adding coefficients. A numeric coefficient applied
    to a nested sum is distributed into it.
**/
public class Sum
{
    public static class Term
    {
        public Type           coefficient;
        public final Operator monomial;

        public Term (Type coefficient, Operator monomial)
        {
            this.coefficient = coefficient;
            this.monomial    = monomial;
        }
    }

    public Type       constant = new Scalar (0);
    public List<Term> terms    = new ArrayList<Term> ();

    public static Sum of (Operator op)
    {
        Sum result = new Sum ();
        result.add (op, new Scalar (1));
        return result;
    }

    /**
        Adds scale*op to this sum.
    **/
    public void add (Operator op, Type scale)
    {
        if (op instanceof Constant)
        {
            constant = constant.add (scale.multiply (((Constant) op).value));
            return;
        }
        if (op instanceof Add)
        {
            add (((Add) op).operand0, scale);
            add (((Add) op).operand1, scale);
            return;
        }
        if (op instanceof Subtract)
        {
            add (((Subtract) op).operand0, scale);
            add (((Subtract) op).operand1, scale.negate ());
            return;
        }
        if (op instanceof Negate)
        {
            add (((Negate) op).operand, scale.negate ());
            return;
        }

        Product p = Product.of (op);
        Type c = scale.multiply (p.coefficient);
        p.coefficient = new Scalar (1);
        Operator monomial = p.toOperator ();
        if (monomial instanceof Constant)
        {
            constant = constant.add (c.multiply (((Constant) monomial).value));
            return;
        }
        if (monomial instanceof Add  ||  monomial instanceof Subtract)  // distribute numeric coefficient
        {
            add (monomial, c);
            return;
        }
        for (Term t : terms)
        {
            if (t.monomial.equals (monomial))
            {
                t.coefficient = t.coefficient.add (c);
                return;
            }
        }
        terms.add (new Term (c, monomial));
    }

    public static boolean negligible (Type value)
    {
        return value.magnitude () <= Settings.epsilon;
    }

    public static boolean isNegative (Type value)
    {
        return value instanceof Scalar  &&  ((Scalar) value).value < 0;
    }

    /**
        @return The term operator coefficient*monomial in canonical product form.
    **/
    public static Operator scale (Operator monomial, Type coefficient)
    {
        Product p = Product.of (monomial);
        p.coefficient = p.coefficient.multiply (coefficient);
        return p.toOperator ();
    }

    public Operator toOperator ()
    {
        TrigSimplifier.collectPythagorean (this);

        List<Term> live = new ArrayList<Term> ();
        for (Term t : terms) if (! negligible (t.coefficient)) live.add (t);
        Collections.sort (live, new Comparator<Term> ()
        {
            public int compare (Term a, Term b)
            {
                return OperatorComparator.instance.compare (a.monomial, b.monomial);
            }
        });

        Operator result = null;
        for (Term t : live)
        {
            Type c = t.coefficient;
            if      (result == null  ) result = scale (t.monomial, c);
            else if (isNegative (c)) result = new Subtract (result, scale (t.monomial, c.negate ()));
            else                     result = new Add      (result, scale (t.monomial, c));
        }

        if (result == null) return new Constant (negligible (constant) ? new Scalar (0) : constant);
        if (negligible (constant)) return result;
        if (isNegative (constant)) return new Subtract (result, new Constant (constant.negate ()));
        return new Add (result, new Constant (constant));
    }

    /**
        @return The signed terms of op, treating anything that is not a sum as a single term.
        Nothing is simplified.
    **/
    public static List<Operator> terms (Operator op)
    {
        List<Operator> result = new ArrayList<Operator> ();
        collect (op, false, result);
        return result;
    }

    protected static void collect (Operator op, boolean negative, List<Operator> result)
    {
        if (op instanceof Add)
        {
            collect (((Add) op).operand0, negative, result);
            collect (((Add) op).operand1, negative, result);
        }
        else if (op instanceof Subtract)
        {
            collect (((Subtract) op).operand0,   negative, result);
            collect (((Subtract) op).operand1, ! negative, result);
        }
        else if (op instanceof Negate  &&  (((Negate) op).operand instanceof Add  ||  ((Negate) op).operand instanceof Subtract))
        {
            collect (((Negate) op).operand, ! negative, result);
        }
        else
        {
            result.add (negative ? new Negate (op) : op);
        }
    }

    /**
        Left-nested sum of the given terms. An empty list gives 0.
    **/
    public static Operator sum (List<Operator> terms)
    {
        Operator result = null;
        for (Operator t : terms)
        {
            if (result == null) result = t;
            else                result = new Add (result, t);
        }
        if (result == null) return new Constant (0);
        return result;
    }
}
