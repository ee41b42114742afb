/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.solve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.math3.complex.Complex;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.EvaluationException;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.type.ComplexScalar;
import gov.sandia.symcalc.language.type.Scalar;

/**
    Result of solving a single equation for one variable.
    Either an identity (every value of the variable satisfies the equation), or an ordered
    list of roots in which a repeated root appears once per multiplicity. An empty list means
    there is no solution.
**/
public class Solutions implements Iterable<Operator>
{
    protected boolean        identity;
    protected List<Operator> roots = new ArrayList<Operator> ();

    public Solutions ()
    {
    }

    public Solutions (List<Operator> roots)
    {
        this.roots.addAll (roots);
    }

    public static Solutions identity ()
    {
        Solutions result = new Solutions ();
        result.identity = true;
        return result;
    }

    public boolean isIdentity ()
    {
        return identity;
    }

    public boolean isEmpty ()
    {
        return ! identity  &&  roots.isEmpty ();
    }

    public int size ()
    {
        return roots.size ();
    }

    public Operator get (int index)
    {
        return roots.get (index);
    }

    /**
        @return The roots as expression trees. For an identity this is empty.
    **/
    public List<Operator> getRoots ()
    {
        return Collections.unmodifiableList (roots);
    }

    /**
        Evaluates each root. Roots of a parametric equation refer to other variables,
        so they need to be evaluated in a context that binds them.
    **/
    public List<Type> getValues (Bindings context) throws EvaluationException
    {
        List<Type> result = new ArrayList<Type> ();
        for (Operator r : roots) result.add (r.eval (context));
        return result;
    }

    public List<Type> getValues () throws EvaluationException
    {
        return getValues (new Bindings ());
    }

    public Iterator<Operator> iterator ()
    {
        return getRoots ().iterator ();
    }

    public void add (Operator root)
    {
        roots.add (root);
    }

    /**
        @return true if some root already in the list equals the given one, either structurally
        or numerically within tolerance.
    **/
    public boolean contains (Operator root)
    {
        for (Operator r : roots) if (same (r, root)) return true;
        return false;
    }

    public static boolean same (Operator a, Operator b)
    {
        if (a instanceof Constant  &&  b instanceof Constant)
        {
            return ((Constant) a).value.approximately (((Constant) b).value, Settings.epsilon);
        }
        return a.equals (b);
    }

    /**
        Converts a numerically computed root into a constant, dropping an imaginary part that is
        round-off and snapping parts that are within tolerance of an integer.
    **/
    public static Constant constant (Complex root)
    {
        double re = snap (root.getReal ());
        double im = snap (root.getImaginary ());
        if (Settings.isZero (im, re)) return new Constant (new Scalar (re));
        return new Constant (new ComplexScalar (re, im));
    }

    public static double snap (double value)
    {
        double r = Math.rint (value);
        if (Settings.isZero (value - r, value)) return r;
        return value;
    }

    public String toString ()
    {
        if (identity) return "all values";
        return roots.toString ();
    }
}
