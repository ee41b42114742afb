/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.algebra;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Negate;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.operator.Subtract;

/**
    Distributes products over sums and multiplies out small integer powers of sums.
    Function arguments are left alone.
**/
public class Expander
{
    public static Operator expand (Operator expression)
    {
        Operator simple = Simplifier.simplify (expression);
        return Simplifier.simplify (distribute (simple));
    }

    protected static Operator distribute (Operator op)
    {
        if (op instanceof Add)
        {
            Add a = (Add) op;
            return new Add (distribute (a.operand0), distribute (a.operand1));
        }
        if (op instanceof Subtract)
        {
            Subtract s = (Subtract) op;
            return new Subtract (distribute (s.operand0), distribute (s.operand1));
        }
        if (op instanceof Negate)
        {
            return new Negate (distribute (((Negate) op).operand));
        }
        if (op instanceof Multiply)
        {
            Multiply m = (Multiply) op;
            return multiply (distribute (m.operand0), distribute (m.operand1));
        }
        if (op instanceof Divide)
        {
            Divide d = (Divide) op;
            List<Operator> terms = Sum.terms (distribute (d.operand0));
            List<Operator> quotients = new ArrayList<Operator> ();
            for (Operator t : terms) quotients.add (new Divide (t, d.operand1));
            return Sum.sum (quotients);
        }
        if (op instanceof Power)
        {
            Power p = (Power) op;
            Operator b = distribute (p.operand0);
            if (Constant.isInteger (p.operand1))
            {
                int n = (int) p.operand1.getDouble ();
                if (n >= 2  &&  n <= Settings.expandLimit  &&  Sum.terms (b).size () > 1)
                {
                    Operator result = b;
                    for (int i = 1; i < n; i++) result = multiply (result, b);
                    return result;
                }
            }
            return new Power (b, p.operand1);
        }
        return op;
    }

    /**
        Multiplies two expanded trees term by term.
    **/
    protected static Operator multiply (Operator a, Operator b)
    {
        List<Operator> ta = Sum.terms (a);
        List<Operator> tb = Sum.terms (b);
        if (ta.size () == 1  &&  tb.size () == 1) return new Multiply (a, b);
        List<Operator> products = new ArrayList<Operator> ();
        for (Operator x : ta)
        {
            for (Operator y : tb) products.add (new Multiply (x, y));
        }
        // Collect after each step, so repeated multiplication stays small.
        return Simplifier.simplify (Sum.sum (products));
    }
}
