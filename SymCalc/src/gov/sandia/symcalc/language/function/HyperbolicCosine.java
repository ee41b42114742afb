/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.function;

import java.util.Arrays;
import java.util.List;

import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Negate;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.operator.Subtract;

public class HyperbolicCosine extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "cosh";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("cosh", operands, 1);
                return new HyperbolicCosine (operands[0]);
            }
        };
    }

    public HyperbolicCosine (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("cosh", operands, 1);
        return new HyperbolicCosine (operands[0]);
    }

    public Type eval (Bindings context)
    {
        return operands[0].eval (context).cosh ();
    }

    public Operator derivative (String name)
    {
        return chain (new HyperbolicSine (operands[0]), name);
    }

    /**
        cosh is even, so both acosh(r) = ln(r + sqrt(r^2-1)) and its negative are returned.
    **/
    public List<Operator> inverse (Operator rhs)
    {
        Operator principal = new Log (new Add (rhs, new SquareRoot (new Subtract (new Power (rhs, new Constant (2)), new Constant (1)))));
        return Arrays.asList (principal, new Negate (principal));
    }

    public String getName ()
    {
        return "cosh";
    }
}
