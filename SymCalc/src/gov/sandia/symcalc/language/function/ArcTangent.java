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
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Power;

public class ArcTangent extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "atan";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("atan", operands, 1);
                return new ArcTangent (operands[0]);
            }
        };
    }

    public ArcTangent (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("atan", operands, 1);
        return new ArcTangent (operands[0]);
    }

    public Type eval (Bindings context)
    {
        return operands[0].eval (context).atan ();
    }

    public Operator derivative (String name)
    {
        Operator u = operands[0];
        return new Divide (u.derivative (name), new Add (new Constant (1), new Power (u, new Constant (2))));
    }

    public List<Operator> inverse (Operator rhs)
    {
        return Collections.singletonList (new Tangent (rhs));
    }

    public String getName ()
    {
        return "atan";
    }
}
