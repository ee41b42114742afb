/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.function;

import java.util.Collections;
import java.util.List;

import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Power;

public class SquareRoot extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "sqrt";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("sqrt", operands, 1);
                return new SquareRoot (operands[0]);
            }
        };
    }

    public SquareRoot (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("sqrt", operands, 1);
        return new SquareRoot (operands[0]);
    }

    public Type eval (Bindings context)
    {
        return operands[0].eval (context).sqrt ();
    }

    public Operator derivative (String name)
    {
        Operator u = operands[0];
        return new Divide (u.derivative (name), new Multiply (new Constant (2), this));
    }

    public List<Operator> inverse (Operator rhs)
    {
        return Collections.singletonList (new Power (rhs, new Constant (2)));
    }

    public String getName ()
    {
        return "sqrt";
    }
}
