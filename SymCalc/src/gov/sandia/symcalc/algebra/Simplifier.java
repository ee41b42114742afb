/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.algebra;

import org.apache.log4j.Logger;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.language.Operator;

/**
    Entry point for algebraic simplification.
    Each node knows its own local rules (see Operator.simplify()). This class repeats whole-tree
    passes until the tree stops changing, so simplify(simplify(e)) equals simplify(e).
    The result always has the same value as the input wherever the input is defined.
**/
public class Simplifier
{
    private static Logger logger = Logger.getLogger (Simplifier.class);

    public static Operator simplify (Operator expression)
    {
        Operator current = expression;
        for (int pass = 0; pass < Settings.simplifierPasses; pass++)
        {
            Operator next = current.simplify ();
            if (next.equals (current)) return next;
            current = next;
        }
        logger.debug ("Reached pass limit while simplifying " + expression);
        return current;
    }
}
