/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.function;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.DomainException;
import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.UnsupportedFormException;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.type.Scalar;
import gov.sandia.symcalc.solve.Isolation;

/**
    Logarithm with an explicit base: log(x, b).
    When called with a single operand, the base is 10.
**/
public class LogBase extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "log";
            }

            public Operator createInstance (Operator... operands)
            {
                if (operands.length == 1) return new LogBase (operands[0], new Constant (10));
                checkArity ("log", operands, 2);
                return new LogBase (operands[0], operands[1]);
            }
        };
    }

    public LogBase (Operator operand, Operator base)
    {
        super (operand, base);
    }

    public Function newInstance (Operator... operands)
    {
        checkArity ("log", operands, 2);
        return new LogBase (operands[0], operands[1]);
    }

    public Operator getBase ()
    {
        return operands[1];
    }

    public Type eval (Bindings context)
    {
        Type base = operands[1].eval (context);
        if (base instanceof Scalar)
        {
            double b = ((Scalar) base).value;
            if (b <= 0  ||  b == 1) throw new DomainException ("Invalid logarithm base " + base);
        }
        return operands[0].eval (context).log ().divide (base.log ());
    }

    public Operator derivative (String name)
    {
        Operator u = operands[0];
        Operator b = operands[1];
        if (! b.dependsOn (name))  // u' / (u*ln(b))
        {
            return new Divide (u.derivative (name), new Multiply (u, new Log (b)));
        }
        return new Divide (new Log (u), new Log (b)).derivative (name);
    }

    public void solve (Isolation statement) throws UnsupportedFormException
    {
        if (operands[1].dependsOn (statement.target)) throw new UnsupportedFormException ("Can't isolate a variable in the base of " + this);
        List<Operator> rhs = new ArrayList<Operator> ();
        for (Operator r : statement.rhs) rhs.add (new Power (operands[1], r));
        statement.lhs = operands[0];
        statement.rhs = rhs;
    }

    public String getName ()
    {
        return "log";
    }
}
