/*
Copyright 2017-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.function;

import java.util.Collections;
import java.util.List;

import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.operator.Divide;

/**
    Natural logarithm.
**/
public class Log extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "ln";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("ln", operands, 1);
                return new Log (operands[0]);
            }
        };
    }

    public Log (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("ln", operands, 1);
        return new Log (operands[0]);
    }

    public Operator simplify ()
    {
        Operator result = super.simplify ();
        if (result instanceof Log  &&  ((Log) result).operands[0] instanceof Exp)  // ln(exp(f)) --> f
        {
            return ((Exp) ((Log) result).operands[0]).operands[0];
        }
        return result;
    }

    public Type eval (Bindings context)
    {
        return operands[0].eval (context).log ();
    }

    public Operator derivative (String name)
    {
        Operator u = operands[0];
        return new Divide (u.derivative (name), u);
    }

    public List<Operator> inverse (Operator rhs)
    {
        return Collections.singletonList (new Exp (rhs));
    }

    public String getName ()
    {
        return "ln";
    }
}
