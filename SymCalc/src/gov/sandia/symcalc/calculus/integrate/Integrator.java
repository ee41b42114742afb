/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus.integrate;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.algebra.Product;
import gov.sandia.symcalc.algebra.Simplifier;
import gov.sandia.symcalc.language.AccessVariable;
import gov.sandia.symcalc.language.DepthExceededException;
import gov.sandia.symcalc.language.Operator;

/**
    Finds antiderivatives by trying an ordered list of strategies. The first strategy that
    returns a result wins. Strategies recurse back into the chain for sub-expressions, with
    an explicit depth counter.
**/
public class Integrator
{
    private static Logger logger = Logger.getLogger (Integrator.class);

    protected List<IntegrationStrategy> strategies;

    /**
        The standard chain, ordered from cheap exact patterns to general heuristics.
    **/
    public static List<IntegrationStrategy> defaultStrategies ()
    {
        List<IntegrationStrategy> result = new ArrayList<IntegrationStrategy> ();
        result.add (new PowerRule ());
        result.add (new BasicTrigonometric ());
        result.add (new Exponential ());
        result.add (new ConstantMultiple ());
        result.add (new Substitution ());
        result.add (new IntegrationByParts ());
        result.add (new InverseTrigonometric ());
        result.add (new SumDifference ());
        return result;
    }

    public Integrator ()
    {
        this (defaultStrategies ());
    }

    public Integrator (List<IntegrationStrategy> strategies)
    {
        this.strategies = new ArrayList<IntegrationStrategy> (strategies);
    }

    public List<IntegrationStrategy> getStrategies ()
    {
        return strategies;
    }

    /**
        @return A simplified antiderivative, without constant of integration.
        @throws NoIntegrationRuleException if the chain is exhausted.
    **/
    public Operator integrate (Operator integrand, String variable) throws NoIntegrationRuleException, DepthExceededException
    {
        Operator result = attempt (integrand, variable, 0);
        if (result == null) throw new NoIntegrationRuleException (integrand, variable);
        return Simplifier.simplify (result);
    }

    /**
        Runs the chain once. This is the entry point strategies use for recursion.
        @return An unsimplified antiderivative, or null if no strategy applies.
    **/
    public Operator attempt (Operator integrand, String variable, int depth) throws DepthExceededException
    {
        if (depth > Settings.integratorDepth) throw new DepthExceededException ("Integrator", Settings.integratorDepth);
        Operator f = Simplifier.simplify (integrand);
        for (IntegrationStrategy s : strategies)
        {
            Operator result = s.integrate (f, variable, this, depth);
            if (result != null)
            {
                if (logger.isDebugEnabled ()) logger.debug (depth + " " + s.getClass ().getSimpleName () + ": " + f + " --> " + result);
                return result;
            }
        }
        return null;
    }

    // Utility functions shared by strategies ---------------------------------

    public static boolean isVariable (Operator op, String variable)
    {
        return op instanceof AccessVariable  &&  ((AccessVariable) op).name.equals (variable);
    }

    /**
        @return The part of p that does not depend on the variable: coefficient times independent factors.
    **/
    public static Operator constantPart (Product p, String variable)
    {
        List<Product.Factor> independent = new ArrayList<Product.Factor> ();
        for (Product.Factor f : p.factors) if (! f.base.dependsOn (variable)  &&  ! f.exponent.dependsOn (variable)) independent.add (f);
        return Product.from (p.coefficient, independent).toOperator ();
    }

    /**
        @return p without the given factor, as a tree.
    **/
    public static Operator without (Product p, Product.Factor factor)
    {
        List<Product.Factor> rest = new ArrayList<Product.Factor> (p.factors);
        rest.remove (factor);
        return Product.from (p.coefficient, rest).toOperator ();
    }
}
