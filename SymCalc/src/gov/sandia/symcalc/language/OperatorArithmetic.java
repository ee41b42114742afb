/*
Copyright 2018-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

/**
    As part of an algebraic expression, this class takes one or two numbers and returns a number.
    Basically, anything that's not a Function. Rendering uses this to decide where parentheses go.
**/
public interface OperatorArithmetic
{
}
