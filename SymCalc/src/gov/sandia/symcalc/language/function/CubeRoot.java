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
import gov.sandia.symcalc.language.operator.Power;

/**
    Real cube root for real arguments, so cbrt(-8) = -2. Complex arguments get the principal root.
**/
public class CubeRoot extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "cbrt";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("cbrt", operands, 1);
                return new CubeRoot (operands[0]);
            }
        };
    }

    public CubeRoot (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("cbrt", operands, 1);
        return new CubeRoot (operands[0]);
    }

    public Type eval (Bindings context)
    {
        return operands[0].eval (context).cbrt ();
    }

    public Operator derivative (String name)
    {
        Operator u = operands[0];
        return new Divide (u.derivative (name), new Multiply (new Constant (3), new Power (this, new Constant (2))));
    }

    public List<Operator> inverse (Operator rhs)
    {
        return Collections.singletonList (new Power (rhs, new Constant (3)));
    }

    public String getName ()
    {
        return "cbrt";
    }
}
