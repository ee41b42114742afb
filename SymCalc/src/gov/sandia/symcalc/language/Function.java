/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.type.Scalar;
import gov.sandia.symcalc.solve.Isolation;

public abstract class Function extends Operator
{
    public final Operator[] operands;  // always non-null, even if there are no positional parameters

    protected Function (Operator... operands)
    {
        this.operands = operands.clone ();
    }

    /**
        Builds a node of the same class over different operands.
    **/
    public abstract Function newInstance (Operator... operands);

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        for (int i = 0; i < operands.length; i++) operands[i].visit (visitor);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        Operator[] next = new Operator[operands.length];
        boolean changed = false;
        for (int i = 0; i < operands.length; i++)
        {
            next[i] = operands[i].transform (transformer);
            if (next[i] != operands[i]) changed = true;
        }
        if (! changed) return this;
        return newInstance (next);
    }

    /**
        Simplifies operands, then folds a call on constants only when the result is an exact
        integer, such as sqrt(4) or cos(0). Other values (sqrt(2), ln(3)) stay symbolic.
    **/
    public Operator simplify ()
    {
        Operator[] next = new Operator[operands.length];
        boolean changed = false;
        boolean constant = true;
        for (int i = 0; i < operands.length; i++)
        {
            next[i] = operands[i].simplify ();
            if (next[i] != operands[i]) changed = true;
            if (! (next[i] instanceof Constant)) constant = false;
        }
        Function result = changed ? newInstance (next) : this;
        if (constant  &&  canFold ())
        {
            try
            {
                Type value = result.eval (new Bindings ());
                if (value instanceof Scalar  &&  ((Scalar) value).isInteger ()) return new Constant (value);
            }
            catch (EvaluationException e)
            {
                return result;  // Out of domain. Keep the call so evaluation can report it.
            }
        }
        return result;
    }

    /**
        @return true if a call whose operands are all constant may be replaced by its value.
    **/
    public boolean canFold ()
    {
        return true;
    }

    /**
        Utility for single-argument functions: multiplies the outer derivative by the derivative of the argument.
    **/
    protected Operator chain (Operator outer, String name)
    {
        return new Multiply (outer, operands[0].derivative (name));
    }

    public void solve (Isolation statement) throws UnsupportedFormException
    {
        if (operands.length != 1) throw new UnsupportedFormException ("Can't solve for " + getName () + " with " + operands.length + " operands");
        List<Operator> rhs = new ArrayList<Operator> ();
        for (Operator r : statement.rhs) rhs.addAll (inverse (r));
        statement.lhs = operands[0];
        statement.rhs = rhs;
    }

    /**
        Applies the inverse of this function to one branch of the rhs.
        @return One or more candidate values for the operand. Functions that are not
        one-to-one return all real branches they know, principal branch first.
    **/
    public List<Operator> inverse (Operator rhs) throws UnsupportedFormException
    {
        throw new UnsupportedFormException ("Can't invert " + getName ());
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (getName () + "(");
        if (operands.length > 0)
        {
            operands[0].render (renderer);
            for (int i = 1; i < operands.length; i++)
            {
                renderer.result.append (", ");
                operands[i].render (renderer);
            }
        }
        renderer.result.append (")");
    }

    public boolean equals (Object that)
    {
        if (that == null  ||  that.getClass () != getClass ()) return false;
        Function f = (Function) that;
        return getName ().equals (f.getName ())  &&  Arrays.equals (operands, f.operands);
    }

    public int hashCode ()
    {
        return (getClass ().hashCode () * 31 + getName ().hashCode ()) * 31 + Arrays.hashCode (operands);
    }
}
