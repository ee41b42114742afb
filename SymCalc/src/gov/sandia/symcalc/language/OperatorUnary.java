/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

public abstract class OperatorUnary extends Operator implements OperatorArithmetic
{
    public final Operator operand;

    protected OperatorUnary (Operator operand)
    {
        this.operand = operand;
    }

    /**
        Builds a node of the same class over a different operand.
    **/
    public abstract OperatorUnary newInstance (Operator operand);

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        operand.visit (visitor);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        Operator o = operand.transform (transformer);
        if (o == operand) return this;
        return newInstance (o);
    }

    public Operator simplify ()
    {
        Operator o = operand.simplify ();
        OperatorUnary result = o == operand ? this : newInstance (o);
        if (o instanceof Constant)
        {
            try
            {
                return new Constant (result.eval (new Bindings ()));
            }
            catch (EvaluationException e)
            {
                return result;  // Leave the expression symbolic, so evaluation reports the error in context.
            }
        }
        return result;
    }

    public boolean isPolynomial (String name, boolean strict)
    {
        return operand.isPolynomial (name, strict);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (getName ());
        boolean needParens = operand instanceof OperatorArithmetic  &&  precedence () < operand.precedence ();
        if (needParens) renderer.result.append ("(");
        operand.render (renderer);
        if (needParens) renderer.result.append (")");
    }

    public boolean equals (Object that)
    {
        if (that == null  ||  that.getClass () != getClass ()) return false;
        OperatorUnary o = (OperatorUnary) that;
        return operand.equals (o.operand);
    }

    public int hashCode ()
    {
        return getClass ().hashCode () * 31 + operand.hashCode ();
    }
}
