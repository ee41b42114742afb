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

public class Exp extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "exp";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("exp", operands, 1);
                return new Exp (operands[0]);
            }
        };
    }

    public Exp (Operator operand)
    {
        super (operand);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("exp", operands, 1);
        return new Exp (operands[0]);
    }

    public Operator simplify ()
    {
        Operator result = super.simplify ();
        if (result instanceof Exp  &&  ((Exp) result).operands[0] instanceof Log)  // exp(ln(f)) --> f
        {
            return ((Log) ((Exp) result).operands[0]).operands[0];
        }
        return result;
    }

    public Type eval (Bindings context)
    {
        return operands[0].eval (context).exp ();
    }

    public Operator derivative (String name)
    {
        return chain (this, name);
    }

    public List<Operator> inverse (Operator rhs)
    {
        return Collections.singletonList (new Log (rhs));
    }

    public String getName ()
    {
        return "exp";
    }
}
