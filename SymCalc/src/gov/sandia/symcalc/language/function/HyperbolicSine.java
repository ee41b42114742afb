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
import gov.sandia.symcalc.language.operator.Power;

public class HyperbolicSine extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "sinh";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("sinh", operands, 1);
                return new HyperbolicSine (operands[0]);
            }
        };
    }

    public HyperbolicSine (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("sinh", operands, 1);
        return new HyperbolicSine (operands[0]);
    }

    public Type eval (Bindings context)
    {
        return operands[0].eval (context).sinh ();
    }

    public Operator derivative (String name)
    {
        return chain (new HyperbolicCosine (operands[0]), name);
    }

    /**
        asinh(r) = ln(r + sqrt(r^2+1))
    **/
    public List<Operator> inverse (Operator rhs)
    {
        return Collections.singletonList (new Log (new Add (rhs, new SquareRoot (new Add (new Power (rhs, new Constant (2)), new Constant (1))))));
    }

    public String getName ()
    {
        return "sinh";
    }
}
