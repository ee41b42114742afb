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
import gov.sandia.symcalc.language.operator.Power;

public class Tangent extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "tan";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("tan", operands, 1);
                return new Tangent (operands[0]);
            }
        };
    }

    public Tangent (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("tan", operands, 1);
        return new Tangent (operands[0]);
    }

    public Type eval (Bindings context)
    {
        return operands[0].eval (context).tan ();
    }

    public Operator derivative (String name)
    {
        return chain (new Power (new Secant (operands[0]), new Constant (2)), name);
    }

    public List<Operator> inverse (Operator rhs)
    {
        return Collections.singletonList (new ArcTangent (rhs));
    }

    public String getName ()
    {
        return "tan";
    }
}
