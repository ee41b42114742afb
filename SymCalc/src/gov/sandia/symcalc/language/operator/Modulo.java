/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.operator;

import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.OperatorBinary;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.UnsupportedFormException;

/**
    Floored modulo, so the result takes the sign of the divisor.
**/
public class Modulo extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "%";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("%", operands, 2);
                return new Modulo (operands[0], operands[1]);
            }
        };
    }

    public Modulo (Operator operand0, Operator operand1)
    {
        super (operand0, operand1);
    }

    public OperatorBinary newInstance (Operator operand0, Operator operand1)
    {
        return new Modulo (operand0, operand1);
    }

    public int precedence ()
    {
        return 4;
    }

    /**
        a%b = a - b*floor(a/b), so where the divisor is constant the derivative is that of a,
        almost everywhere.
    **/
    public Operator derivative (String name) throws UnsupportedFormException
    {
        if (operand1.dependsOn (name)) throw new UnsupportedFormException ("Derivative of modulo with variable divisor: " + this);
        return operand0.derivative (name);
    }

    public Type eval (Bindings context)
    {
        return operand0.eval (context).modulo (operand1.eval (context));
    }

    public String getName ()
    {
        return "%";
    }
}
