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
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.type.Scalar;

/**
    sec(x) = 1/cos(x)
**/
public class Secant extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "sec";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("sec", operands, 1);
                return new Secant (operands[0]);
            }
        };
    }

    public Secant (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("sec", operands, 1);
        return new Secant (operands[0]);
    }

    public Type eval (Bindings context)
    {
        return new Scalar (1).divide (operands[0].eval (context).cos ());
    }

    public Operator derivative (String name)
    {
        return chain (new Multiply (this, new Tangent (operands[0])), name);
    }

    public List<Operator> inverse (Operator rhs)
    {
        return Collections.singletonList (new ArcCosine (new Divide (new Constant (1), rhs)));
    }

    public String getName ()
    {
        return "sec";
    }
}
