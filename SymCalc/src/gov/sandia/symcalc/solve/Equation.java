/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.solve;

import java.util.LinkedHashSet;
import java.util.Set;

import gov.sandia.symcalc.algebra.Simplifier;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.operator.Subtract;

public class Equation
{
    public final Operator lhs;
    public final Operator rhs;

    public Equation (Operator lhs, Operator rhs)
    {
        this.lhs = lhs;
        this.rhs = rhs;
    }

    /**
        Shorthand for expression = 0.
    **/
    public Equation (Operator expression)
    {
        this (expression, new Constant (0));
    }

    /**
        @return lhs-rhs, simplified. The equation holds exactly where this is zero.
    **/
    public Operator normalize ()
    {
        return Simplifier.simplify (new Subtract (lhs, rhs));
    }

    public Set<String> variablesUsed ()
    {
        Set<String> result = new LinkedHashSet<String> (lhs.variablesUsed ());
        result.addAll (rhs.variablesUsed ());
        return result;
    }

    public Equation substitute (String name, Operator replacement)
    {
        return new Equation (lhs.substitute (name, replacement), rhs.substitute (name, replacement));
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Equation)) return false;
        Equation e = (Equation) that;
        return lhs.equals (e.lhs)  &&  rhs.equals (e.rhs);
    }

    public int hashCode ()
    {
        return lhs.hashCode () * 31 + rhs.hashCode ();
    }

    public String toString ()
    {
        return lhs + " = " + rhs;
    }
}
