/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.solve;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.apache.log4j.Logger;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.algebra.NotPolynomialException;
import gov.sandia.symcalc.algebra.Polynomial;
import gov.sandia.symcalc.algebra.Simplifier;
import gov.sandia.symcalc.language.AccessVariable;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.SymbolicException;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Negate;

/**
    Solves a system of equations by substitution and elimination.

    <p>Each round picks an equation in which some unknown appears linearly with a coefficient that
    is free of the other unknowns, solves it for that unknown, and substitutes the result into the
    remaining equations. Only when no such equation exists does a nonlinear equation get handed to
    EquationSolver, so a single nonlinear equation is solved last, after the linear ones have
    reduced it to one unknown. Finally the isolated values are substituted back, in reverse order.

    <p>Equations that reduce to 0=0 are dropped. An equation that reduces to a nonzero constant means
    the system is inconsistent. Unknowns that no equation determines are reported as themselves, and
    the others are expressed in terms of them.
**/
public class SystemSolver
{
    private static Logger logger = Logger.getLogger (SystemSolver.class);

    protected Set<String>           unknowns  = new LinkedHashSet<String> ();
    protected List<Operator>        remaining = new ArrayList<Operator> ();
    protected Map<String,Operator>  isolated  = new LinkedHashMap<String,Operator> ();  // in order of elimination

    public static Map<String,Operator> solveEquations (List<Equation> equations) throws InconsistentSystemException, NoConvergenceException
    {
        return solveEquations (equations, null);
    }

    /**
        @param variables The unknowns. If null, every variable that appears in the equations is an unknown.
        @return Map from each unknown to its value, in the order the unknowns were given, or else
        in order of first appearance in the equations.
    **/
    public static Map<String,Operator> solveEquations (List<Equation> equations, Collection<String> variables) throws InconsistentSystemException, NoConvergenceException
    {
        SystemSolver s = new SystemSolver ();
        if (variables == null) for (Equation e : equations) s.unknowns.addAll (e.variablesUsed ());
        else                   s.unknowns.addAll (variables);
        for (Equation e : equations) s.remaining.add (e.normalize ());
        Set<String> order = new LinkedHashSet<String> (s.unknowns);

        s.eliminate ();
        Map<String,Operator> resolved = s.backSubstitute ();

        Map<String,Operator> result = new LinkedHashMap<String,Operator> ();
        for (String name : order)
        {
            Operator value = resolved.get (name);
            if (value == null) value = new AccessVariable (name);
            result.put (name, value);
        }
        return result;
    }

    /**
        Same as solveEquations(), but returns the result as an alternating list [name, value, name, value, ...].
    **/
    public static List<Object> solveEquationsFlat (List<Equation> equations, Collection<String> variables) throws InconsistentSystemException, NoConvergenceException
    {
        return flatten (solveEquations (equations, variables));
    }

    public static List<Object> flatten (Map<String,Operator> solution)
    {
        List<Object> result = new ArrayList<Object> ();
        for (Entry<String,Operator> e : solution.entrySet ())
        {
            result.add (e.getKey ());
            result.add (e.getValue ());
        }
        return result;
    }

    protected void eliminate () throws InconsistentSystemException, NoConvergenceException
    {
        int round = 0;
        while (true)
        {
            dropIdentities ();
            if (remaining.isEmpty ()  ||  unknowns.isEmpty ()) break;
            if (! involvesUnknown ()) break;  // only conditions on parameters are left
            if (++round > Settings.systemRounds) throw new NoConvergenceException ("System solver did not finish within " + Settings.systemRounds + " rounds");

            if (eliminateLinear ()) continue;
            if (eliminateNonlinear (true)) continue;
            if (eliminateNonlinear (false)) continue;
            throw new NoConvergenceException ("Can't isolate any of " + unknowns + " in " + remaining);
        }
        if (! remaining.isEmpty ()) logger.debug ("conditions on parameters: " + remaining);
    }

    protected void dropIdentities () throws InconsistentSystemException
    {
        List<Operator> next = new ArrayList<Operator> ();
        for (Operator e : remaining)
        {
            if (EquationSolver.isIdentity (e))
            {
                logger.debug ("dropping identity");
                continue;
            }
            if (e instanceof Constant) throw new InconsistentSystemException (e);
            next.add (e);
        }
        remaining = next;
    }

    /**
        Finds the first equation that is linear in some unknown, with a coefficient free of all unknowns.
    **/
    protected boolean eliminateLinear ()
    {
        for (Operator e : remaining)
        {
            for (String x : unknowns)
            {
                if (! e.dependsOn (x)  ||  ! e.isPolynomial (x, false)) continue;
                Polynomial p;
                try
                {
                    p = Polynomial.from (e, x);
                }
                catch (NotPolynomialException ex)
                {
                    continue;
                }
                if (p.degree () != 1) continue;
                Operator c1 = p.get (1);
                if (dependsOnUnknown (c1)) continue;

                Operator value = Simplifier.simplify (new Divide (new Negate (p.get (0)), c1));
                logger.debug ("linear: " + x + " = " + value);
                accept (e, x, value);
                return true;
            }
        }
        return false;
    }

    /**
        Hands an equation to the single-variable solver.
        @param single Only consider equations that involve exactly one unknown.
    **/
    protected boolean eliminateNonlinear (boolean single)
    {
        for (Operator e : remaining)
        {
            List<String> present = new ArrayList<String> ();
            for (String x : unknowns) if (e.dependsOn (x)) present.add (x);
            if (single  &&  present.size () != 1) continue;

            for (String x : present)
            {
                Solutions s;
                try
                {
                    s = EquationSolver.solve (e, x);
                }
                catch (SymbolicException ex)
                {
                    logger.debug ("can't solve " + e + " for " + x + ": " + ex.getMessage ());
                    continue;
                }
                if (s.isIdentity ()  ||  s.isEmpty ()) continue;

                Operator value = choose (s);
                if (value.dependsOn (x)) continue;
                if (s.size () > 1) logger.debug ("choosing " + x + " = " + value + " from " + s);
                else               logger.debug ("nonlinear: " + x + " = " + value);
                accept (e, x, value);
                return true;
            }
        }
        return false;
    }

    /**
        Prefers the first real root.
    **/
    protected static Operator choose (Solutions s)
    {
        for (Operator r : s) if (! (r instanceof Constant)  ||  r.isScalar ()) return r;
        return s.get (0);
    }

    protected boolean involvesUnknown ()
    {
        for (Operator e : remaining) if (dependsOnUnknown (e)) return true;
        return false;
    }

    protected boolean dependsOnUnknown (Operator op)
    {
        for (String x : unknowns) if (op.dependsOn (x)) return true;
        return false;
    }

    protected void accept (Operator equation, String x, Operator value)
    {
        unknowns.remove (x);
        isolated.put (x, value);
        List<Operator> next = new ArrayList<Operator> ();
        for (Operator e : remaining)
        {
            if (e == equation) continue;
            next.add (Simplifier.simplify (e.substitute (x, value)));
        }
        remaining = next;
    }

    protected Map<String,Operator> backSubstitute ()
    {
        List<String> names = new ArrayList<String> (isolated.keySet ());
        Map<String,Operator> resolved = new LinkedHashMap<String,Operator> ();
        for (int i = names.size () - 1; i >= 0; i--)
        {
            String   x     = names.get (i);
            Operator value = isolated.get (x);
            for (Entry<String,Operator> e : resolved.entrySet ()) value = value.substitute (e.getKey (), e.getValue ());
            resolved.put (x, Simplifier.simplify (value));
        }
        return resolved;
    }
}
