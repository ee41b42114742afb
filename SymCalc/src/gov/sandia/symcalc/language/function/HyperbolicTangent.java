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
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.operator.Subtract;

public class HyperbolicTangent extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "tanh";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("tanh", operands, 1);
                return new HyperbolicTangent (operands[0]);
            }
        };
    }

    public HyperbolicTangent (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("tanh", operands, 1);
        return new HyperbolicTangent (operands[0]);
    }

    public Type eval (Bindings context)
    {
        return operands[0].eval (context).tanh ();
    }

    public Operator derivative (String name)
    {
        return chain (new Subtract (new Constant (1), new Power (this, new Constant (2))), name);
    }

    /**
        atanh(r) = ln((1+r)/(1-r))/2
    **/
    public List<Operator> inverse (Operator rhs)
    {
        Operator ratio = new Divide (new Add (new Constant (1), rhs), new Subtract (new Constant (1), rhs));
        return Collections.singletonList (new Multiply (new Constant (0.5), new Log (ratio)));
    }

    public String getName ()
    {
        return "tanh";
    }
}
