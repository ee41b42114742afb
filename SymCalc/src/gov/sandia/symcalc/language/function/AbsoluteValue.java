/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.function;

import java.util.Arrays;
import java.util.List;

import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Negate;

public class AbsoluteValue extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "abs";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("abs", operands, 1);
                return new AbsoluteValue (operands[0]);
            }
        };
    }

    public AbsoluteValue (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("abs", operands, 1);
        return new AbsoluteValue (operands[0]);
    }

    public Type eval (Bindings context)
    {
        return operands[0].eval (context).abs ();
    }

    /**
        d|u| = u*u'/|u|, which is undefined only where u=0.
    **/
    public Operator derivative (String name)
    {
        Operator u = operands[0];
        return new Divide (new Multiply (u, u.derivative (name)), this);
    }

    public List<Operator> inverse (Operator rhs)
    {
        return Arrays.asList (rhs, new Negate (rhs));
    }

    public String getName ()
    {
        return "abs";
    }
}
