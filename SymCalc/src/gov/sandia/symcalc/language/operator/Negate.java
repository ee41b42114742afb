/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.operator;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.symcalc.algebra.Product;
import gov.sandia.symcalc.algebra.Sum;
import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.OperatorUnary;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.solve.Isolation;

public class Negate extends OperatorUnary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "UM";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("UM", operands, 1);
                return new Negate (operands[0]);
            }
        };
    }

    public Negate (Operator operand)
    {
        super (operand);
    }

    public OperatorUnary newInstance (Operator operand)
    {
        return new Negate (operand);
    }

    public int precedence ()
    {
        return 2;
    }

    public Associativity associativity ()
    {
        return Associativity.RIGHT_TO_LEFT;
    }

    public Operator simplify ()
    {
        Operator result = super.simplify ();
        if (! (result instanceof Negate)) return result;
        Operator o = ((Negate) result).operand;
        if (o instanceof Negate) return ((Negate) o).operand;  // --x --> x
        if (o instanceof Add  ||  o instanceof Subtract) return Sum.of (result).toOperator ();
        return Product.of (result).toOperator ();
    }

    public Operator derivative (String name)
    {
        return new Negate (operand.derivative (name));
    }

    public Type eval (Bindings context)
    {
        return operand.eval (context).negate ();
    }

    public void solve (Isolation statement)
    {
        List<Operator> rhs = new ArrayList<Operator> ();
        for (Operator r : statement.rhs) rhs.add (new Negate (r));
        statement.lhs = operand;
        statement.rhs = rhs;
    }

    public String getName ()
    {
        return "-";
    }
}
