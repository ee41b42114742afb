/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.symcalc.solve.Isolation;

public abstract class OperatorBinary extends Operator implements OperatorArithmetic
{
    public final Operator operand0;
    public final Operator operand1;

    protected OperatorBinary (Operator operand0, Operator operand1)
    {
        this.operand0 = operand0;
        this.operand1 = operand1;
    }

    /**
        Builds a node of the same class over different operands.
    **/
    public abstract OperatorBinary newInstance (Operator operand0, Operator operand1);

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        operand0.visit (visitor);
        operand1.visit (visitor);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        Operator a = operand0.transform (transformer);
        Operator b = operand1.transform (transformer);
        if (a == operand0  &&  b == operand1) return this;
        return newInstance (a, b);
    }

    /**
        Simplifies both operands and folds the node if both become constant.
        Subclasses call this first, then apply their own rules to the result.
    **/
    public Operator simplify ()
    {
        Operator a = operand0.simplify ();
        Operator b = operand1.simplify ();
        OperatorBinary result = (a == operand0  &&  b == operand1) ? this : newInstance (a, b);
        if (a instanceof Constant  &&  b instanceof Constant)
        {
            try
            {
                return new Constant (result.eval (new Bindings ()));
            }
            catch (EvaluationException e)
            {
                return result;  // For example, a negative base to a fractional power stays symbolic.
            }
        }
        return result;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        render (renderer, getName ());
    }

    public void render (Renderer renderer, String middle)
    {
        // Left-hand child
        boolean needParens = false;
        if (operand0 instanceof OperatorArithmetic)
        {
            needParens =    precedence () < operand0.precedence ()   // read "<" as "comes before" rather than "less"
                         ||    precedence () == operand0.precedence ()
                            && associativity () == Associativity.RIGHT_TO_LEFT;
        }
        if (needParens) renderer.result.append ("(");
        operand0.render (renderer);
        if (needParens) renderer.result.append (")");

        renderer.result.append (middle);

        // Right-hand child
        needParens = false;
        if (operand1 instanceof OperatorArithmetic)
        {
            needParens =    precedence () < operand1.precedence ()
                         ||    precedence () == operand1.precedence ()
                            && associativity () == Associativity.LEFT_TO_RIGHT;
        }
        if (needParens) renderer.result.append ("(");
        operand1.render (renderer);
        if (needParens) renderer.result.append (")");
    }

    public void solve (Isolation statement) throws UnsupportedFormException
    {
        boolean in0 = operand0.dependsOn (statement.target);
        boolean in1 = operand1.dependsOn (statement.target);
        if (in0  &&  in1) throw new UnsupportedFormException ("Variable " + statement.target + " occurs in both operands of " + this);

        List<Operator> rhs = new ArrayList<Operator> ();
        if (in0)  // need left-inverse
        {
            for (Operator r : statement.rhs) rhs.add (inverse (operand1, r, true));
            statement.lhs = operand0;
        }
        else  // need right-inverse
        {
            for (Operator r : statement.rhs) rhs.add (inverse (operand0, r, false));
            statement.lhs = operand1;
        }
        statement.rhs = rhs;
    }

    /**
        In an isolation statement, moves one of our two operands over to the rhs.
        @param other The operand that does not contain the target.
        @param rhs The current rhs of the statement.
        @param keepLeft true if operand0 stays on the lhs, false if operand1 stays.
        @return A new operator to replace the rhs in the statement.
    **/
    public Operator inverse (Operator other, Operator rhs, boolean keepLeft) throws UnsupportedFormException
    {
        throw new UnsupportedFormException ("Can't invert this operator: " + this);
    }

    public boolean equals (Object that)
    {
        if (that == null  ||  that.getClass () != getClass ()) return false;
        OperatorBinary o = (OperatorBinary) that;
        return operand0.equals (o.operand0)  &&  operand1.equals (o.operand1);
    }

    public int hashCode ()
    {
        return (getClass ().hashCode () * 31 + operand0.hashCode ()) * 31 + operand1.hashCode ();
    }
}
