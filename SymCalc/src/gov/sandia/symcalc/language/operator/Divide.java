/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.operator;

import gov.sandia.symcalc.algebra.Product;
import gov.sandia.symcalc.algebra.RationalFunction;
import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.OperatorBinary;
import gov.sandia.symcalc.language.Type;

public class Divide extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "/";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("/", operands, 2);
                return new Divide (operands[0], operands[1]);
            }
        };
    }

    public Divide (Operator operand0, Operator operand1)
    {
        super (operand0, operand1);
    }

    public OperatorBinary newInstance (Operator operand0, Operator operand1)
    {
        return new Divide (operand0, operand1);
    }

    public int precedence ()
    {
        return 4;
    }

    public Operator simplify ()
    {
        Operator result = super.simplify ();
        if (! (result instanceof Divide)) return result;
        Operator cancelled = RationalFunction.cancel ((Divide) result);
        if (cancelled != null) return cancelled;
        return Product.of (result).toOperator ();
    }

    public Operator derivative (String name)
    {
        // (f/g)' = (f'g - fg') / g^2
        return new Divide
        (
            new Subtract (new Multiply (operand0.derivative (name), operand1), new Multiply (operand0, operand1.derivative (name))),
            new Power (operand1, new Constant (2))
        );
    }

    public boolean isPolynomial (String name, boolean strict)
    {
        if (operand1.dependsOn (name)) return false;
        if (strict  &&  operand1.isTranscendental ()) return false;
        return operand0.isPolynomial (name, strict);
    }

    public Type eval (Bindings context)
    {
        return operand0.eval (context).divide (operand1.eval (context));
    }

    public Operator inverse (Operator other, Operator rhs, boolean keepLeft)
    {
        if (keepLeft) return new Multiply (rhs, other);  // a/b=r --> a=r*b
        return new Divide (other, rhs);                  // a/b=r --> b=a/r
    }

    public String getName ()
    {
        return "/";
    }
}
