/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
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
import gov.sandia.symcalc.language.operator.Negate;

public class Cosine extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "cos";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("cos", operands, 1);
                return new Cosine (operands[0]);
            }
        };
    }

    public Cosine (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("cos", operands, 1);
        return new Cosine (operands[0]);
    }

    public Type eval (Bindings context)
    {
        return operands[0].eval (context).cos ();
    }

    public Operator derivative (String name)
    {
        return chain (new Negate (new Sine (operands[0])), name);
    }

    public List<Operator> inverse (Operator rhs)
    {
        return Collections.singletonList (new ArcCosine (rhs));
    }

    public String getName ()
    {
        return "cos";
    }
}
