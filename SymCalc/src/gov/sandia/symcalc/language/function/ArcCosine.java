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
import gov.sandia.symcalc.language.operator.Subtract;

public class ArcCosine extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "acos";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("acos", operands, 1);
                return new ArcCosine (operands[0]);
            }
        };
    }

    public ArcCosine (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("acos", operands, 1);
        return new ArcCosine (operands[0]);
    }

    public Type eval (Bindings context)
    {
        return operands[0].eval (context).acos ();
    }

    public Operator derivative (String name)
    {
        Operator u = operands[0];
        return new Negate (new Divide (u.derivative (name), new SquareRoot (new Subtract (new Constant (1), new Power (u, new Constant (2))))));
    }

    public List<Operator> inverse (Operator rhs)
    {
        return Collections.singletonList (new Cosine (rhs));
    }

    public String getName ()
    {
        return "acos";
    }
}
