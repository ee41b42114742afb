/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.operator;

import gov.sandia.symcalc.algebra.Sum;
import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.OperatorBinary;
import gov.sandia.symcalc.language.Type;

public class Subtract extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "-";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("-", operands, 2);
                return new Subtract (operands[0], operands[1]);
            }
        };
    }

    public Subtract (Operator operand0, Operator operand1)
    {
        super (operand0, operand1);
    }

    public OperatorBinary newInstance (Operator operand0, Operator operand1)
    {
        return new Subtract (operand0, operand1);
    }

    public int precedence ()
    {
        return 5;
    }

    public Operator simplify ()
    {
        Operator result = super.simplify ();
        if (! (result instanceof Subtract)) return result;
        return Sum.of (result).toOperator ();
    }

    public Operator derivative (String name)
    {
        return new Subtract (operand0.derivative (name), operand1.derivative (name));
    }

    public boolean isPolynomial (String name, boolean strict)
    {
        return operand0.isPolynomial (name, strict)  &&  operand1.isPolynomial (name, strict);
    }

    public Type eval (Bindings context)
    {
        return operand0.eval (context).subtract (operand1.eval (context));
    }

    public Operator inverse (Operator other, Operator rhs, boolean keepLeft)
    {
        if (keepLeft) return new Add (rhs, other);  // a-b=r --> a=r+b
        return new Subtract (other, rhs);           // a-b=r --> b=a-r
    }

    public String getName ()
    {
        return "-";
    }
}
