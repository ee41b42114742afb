/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.algebra;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Transformer;
import gov.sandia.symcalc.language.function.Cosine;
import gov.sandia.symcalc.language.function.Sine;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.operator.Subtract;

/**
    Trigonometric identities that the general collectors can't see.
**/
public class TrigSimplifier
{
    /**
        Replaces each pair c*sin(u)^2 + c*cos(u)^2 in the sum by the constant c.
        Called by Sum before it rebuilds a tree.
    **/
    public static void collectPythagorean (Sum sum)
    {
        for (int i = 0; i < sum.terms.size (); i++)
        {
            Sum.Term s = sum.terms.get (i);
            Operator u = squaredArgument (s.monomial, Sine.class);
            if (u == null) continue;
            for (int j = 0; j < sum.terms.size (); j++)
            {
                Sum.Term c = sum.terms.get (j);
                Operator v = squaredArgument (c.monomial, Cosine.class);
                if (v == null  ||  ! v.equals (u)) continue;
                if (! s.coefficient.approximately (c.coefficient, Settings.epsilon)) continue;

                sum.constant = sum.constant.add (s.coefficient);
                sum.terms.remove (Math.max (i, j));
                sum.terms.remove (Math.min (i, j));
                i = -1;  // restart scan, since indices have shifted
                break;
            }
        }
    }

    /**
        @return u if op has the form f(u)^2, where f is an instance of the given class. Otherwise null.
    **/
    public static Operator squaredArgument (Operator op, Class<? extends Function> f)
    {
        if (! (op instanceof Power)) return null;
        Power p = (Power) op;
        if (! p.operand1.isScalar ()  ||  p.operand1.getDouble () != 2) return null;
        if (p.operand0.getClass () != f) return null;
        return ((Function) p.operand0).operands[0];
    }

    /**
        Rewrites even powers of sin and cos with the half-angle identities
        sin(u)^2 = (1-cos(2u))/2 and cos(u)^2 = (1+cos(2u))/2, so that no even power remains.
        This is not part of the default simplification pass, since it would undo the
        Pythagorean collection above. The integrator requests it explicitly.
    **/
    public static Operator reducePowers (Operator expression)
    {
        Operator result = expression.transform (new Transformer ()
        {
            public Operator transform (Operator op)
            {
                if (! (op instanceof Power)) return null;
                Power p = (Power) op;
                if (! Constant.isInteger (p.operand1)) return null;
                int n = (int) p.operand1.getDouble ();
                if (n < 2  ||  n % 2 != 0) return null;
                boolean sine = p.operand0 instanceof Sine;
                if (! sine  &&  ! (p.operand0 instanceof Cosine)) return null;

                Operator u     = ((Function) p.operand0).operands[0].transform (this);
                Operator cos2u = new Cosine (new Multiply (new Constant (2), u));
                Operator half;
                if (sine) half = new Divide (new Subtract (new Constant (1), cos2u), new Constant (2));
                else      half = new Divide (new Add      (new Constant (1), cos2u), new Constant (2));
                if (n == 2) return half;
                return reducePowers (Expander.expand (new Power (half, new Constant (n / 2))));
            }
        });
        return Simplifier.simplify (result);
    }
}
