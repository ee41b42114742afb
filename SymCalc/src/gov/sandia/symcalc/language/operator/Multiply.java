/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.operator;

import gov.sandia.symcalc.algebra.Product;
import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.OperatorBinary;
import gov.sandia.symcalc.language.Type;

public class Multiply extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "*";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("*", operands, 2);
                return new Multiply (operands[0], operands[1]);
            }
        };
    }

    public Multiply (Operator operand0, Operator operand1)
    {
        super (operand0, operand1);
    }

    public OperatorBinary newInstance (Operator operand0, Operator operand1)
    {
        return new Multiply (operand0, operand1);
    }

    public int precedence ()
    {
        return 4;
    }

    public Operator simplify ()
    {
        Operator result = super.simplify ();
        if (! (result instanceof Multiply)) return result;
        return Product.of (result).toOperator ();
    }

    public Operator derivative (String name)
    {
        // (fg)' = f'g + fg'
        return new Add (new Multiply (operand0.derivative (name), operand1), new Multiply (operand0, operand1.derivative (name)));
    }

    public boolean isPolynomial (String name, boolean strict)
    {
        return operand0.isPolynomial (name, strict)  &&  operand1.isPolynomial (name, strict);
    }

    public Type eval (Bindings context)
    {
        return operand0.eval (context).multiply (operand1.eval (context));
    }

    public Operator inverse (Operator other, Operator rhs, boolean keepLeft)
    {
        return new Divide (rhs, other);
    }

    public String getName ()
    {
        return "*";
    }
}
