/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.solve;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.algebra.Simplifier;
import gov.sandia.symcalc.language.AccessVariable;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.UnsupportedFormException;

/**
    Statement of the form lhs = rhs, where lhs contains a single occurrence of the target variable.
    Each step asks the outermost operator on the lhs to move itself to the rhs, until the lhs is
    just the variable. Inverses with more than one branch (even powers, abs, cosh) split the rhs
    into several alternatives, so rhs is a list.
**/
public class Isolation
{
    public final String   target;
    public Operator       lhs;
    public List<Operator> rhs;

    public Isolation (Operator lhs, Operator rhs, String target)
    {
        this.target = target;
        this.lhs    = lhs;
        this.rhs    = new ArrayList<Operator> ();
        this.rhs.add (rhs);
    }

    public static boolean applies (Operator expression, String target)
    {
        return expression.occurrences (target) == 1;
    }

    /**
        Runs the isolation to completion.
        @return The simplified alternatives for the target, in branch order.
        @throws UnsupportedFormException if some operator on the path has no inverse.
    **/
    public List<Operator> solve () throws UnsupportedFormException
    {
        if (lhs.occurrences (target) != 1) throw new UnsupportedFormException ("Can't isolate " + target + " in " + lhs + " because it occurs " + lhs.occurrences (target) + " times");
        for (Operator r : rhs) if (r.dependsOn (target)) throw new UnsupportedFormException ("Can't isolate " + target + " because it also occurs on the right side");

        int steps = 0;
        while (! (lhs instanceof AccessVariable  &&  ((AccessVariable) lhs).name.equals (target)))
        {
            if (++steps > Settings.solverDepth) throw new UnsupportedFormException ("Isolation of " + target + " did not terminate");
            lhs.solve (this);
        }

        List<Operator> result = new ArrayList<Operator> ();
        for (Operator r : rhs) result.add (Simplifier.simplify (r));
        rhs = result;
        return result;
    }

    public String toString ()
    {
        return lhs + " = " + rhs;
    }
}
