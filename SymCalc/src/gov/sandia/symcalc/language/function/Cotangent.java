/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
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
import gov.sandia.symcalc.language.operator.Negate;
import gov.sandia.symcalc.language.operator.Power;

/**
    cot(x) = cos(x)/sin(x)
**/
public class Cotangent extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "cot";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("cot", operands, 1);
                return new Cotangent (operands[0]);
            }
        };
    }

    public Cotangent (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("cot", operands, 1);
        return new Cotangent (operands[0]);
    }

    public Type eval (Bindings context)
    {
        Type arg = operands[0].eval (context);
        return arg.cos ().divide (arg.sin ());
    }

    public Operator derivative (String name)
    {
        return chain (new Negate (new Power (new Cosecant (operands[0]), new Constant (2))), name);
    }

    public List<Operator> inverse (Operator rhs)
    {
        return Collections.singletonList (new ArcTangent (new Divide (new Constant (1), rhs)));
    }

    public String getName ()
    {
        return "cot";
    }
}
