/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

/**
    A visitor for Operator which replaces the current node with a rewritten tree.
    Trees are immutable, so a node whose operands come back changed rebuilds itself,
    while an untouched subtree is returned as the same object.
**/
public class Transformer
{
    /**
        @return The replacement Operator, or null if no action was taken. When null is
        returned, the Operator performs its own default action, which is to recurse down
        the tree then return itself (or a rebuilt copy if any operand changed).
    **/
    public Operator transform (Operator op)
    {
        return null;
    }
}
