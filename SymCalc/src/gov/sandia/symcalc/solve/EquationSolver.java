/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.solve;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.algebra.Expander;
import gov.sandia.symcalc.algebra.NotPolynomialException;
import gov.sandia.symcalc.algebra.Polynomial;
import gov.sandia.symcalc.algebra.Product;
import gov.sandia.symcalc.algebra.RationalFunction;
import gov.sandia.symcalc.algebra.Simplifier;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.DepthExceededException;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.UnsupportedFormException;
import gov.sandia.symcalc.language.function.Exp;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Negate;

/**
    Solves a single equation for one variable.

    <p>The equation is first normalized to E = 0. Then, in order:
    <ul>
    <li>E identically zero: every value is a solution.
    <li>E is a product: solve each factor that involves the variable. A factor raised to an integer
        power n contributes its roots n times. Roots shared between factors are reported once.
        Roots of factors in the denominator are excluded.
    <li>E is a rational function: solve the numerator and exclude poles.
    <li>E is a polynomial: closed forms for degree 1 through 3. Coefficients may involve other variables.
    <li>Otherwise, if the variable occurs exactly once, isolate it by inverting operators.
    </ul>
**/
public class EquationSolver
{
    private static Logger logger = Logger.getLogger (EquationSolver.class);

    public static Solutions solve (Equation equation, String variable) throws NotPolynomialException, UnsupportedDegreeException, DepthExceededException
    {
        return solve (equation.normalize (), variable, 0);
    }

    /**
        Solves expression = 0.
    **/
    public static Solutions solve (Operator expression, String variable) throws NotPolynomialException, UnsupportedDegreeException, DepthExceededException
    {
        return solve (expression, variable, 0);
    }

    protected static Solutions solve (Operator expression, String variable, int depth) throws NotPolynomialException, UnsupportedDegreeException, DepthExceededException
    {
        if (depth > Settings.solverDepth) throw new DepthExceededException ("Equation solver", Settings.solverDepth);

        Operator E = Simplifier.simplify (expression);
        if (isIdentity (E))
        {
            logger.debug ("identity: " + expression + " = 0");
            return Solutions.identity ();
        }
        if (! E.dependsOn (variable))
        {
            logger.debug ("no solution for " + variable + ": " + E + " = 0 does not involve it");
            return new Solutions ();
        }

        Solutions result = solveFactors (E, variable, depth);
        if (result != null) return result;

        if (! E.isPolynomial (variable, false))
        {
            result = solveRational (E, variable, depth);
            if (result != null) return result;
            return isolate (E, variable, new NotPolynomialException (E, variable));
        }

        Polynomial p = Polynomial.from (E, variable);
        logger.debug ("polynomial of degree " + p.degree () + " in " + variable + ": " + p);
        return solvePolynomial (p, E, depth);
    }

    public static boolean isIdentity (Operator E)
    {
        if (Constant.isZero (E)) return true;
        return Constant.isZero (Expander.expand (E));
    }

    /**
        Handles products, powers and quotients by solving each dependent factor separately.
        @return null if E is not a product of more than one dependent factor, or a factor can't be split this way.
    **/
    protected static Solutions solveFactors (Operator E, String variable, int depth) throws NotPolynomialException, UnsupportedDegreeException, DepthExceededException
    {
        Product p = Product.of (E);
        List<Product.Factor> numerator   = new ArrayList<Product.Factor> ();
        List<Product.Factor> denominator = new ArrayList<Product.Factor> ();
        List<Product.Factor> dependent   = p.dependentOn (variable);
        for (Product.Factor f : dependent)
        {
            if (f.exponent.dependsOn (variable))
            {
                // b^x with constant b never vanishes, so it contributes no roots.
                if (f.base.dependsOn (variable)) return null;
                continue;
            }
            if (f.base instanceof Exp) continue;  // likewise exp(u)
            if (f.exponent.isScalar ()  &&  f.exponent.getDouble () < 0) denominator.add (f);
            else                                                         numerator  .add (f);
        }
        boolean skipped = numerator.size () + denominator.size () < dependent.size ();
        if (! skipped  &&  denominator.isEmpty ()  &&  numerator.size () == 1  &&  Constant.isOne (numerator.get (0).exponent)) return null;

        Solutions result = new Solutions ();
        for (Product.Factor f : numerator)
        {
            Solutions s = solve (f.base, variable, depth + 1);
            if (s.isIdentity ()) return s;
            int repeat = 1;
            if (Constant.isInteger (f.exponent))
            {
                double n = f.exponent.getDouble ();
                if (n > Settings.multiplicityLimit) throw new UnsupportedDegreeException (E, variable, (int) Math.min (n, Integer.MAX_VALUE));
                repeat = (int) n;
            }
            List<Operator> added = new ArrayList<Operator> ();
            for (Operator r : s)
            {
                if (result.contains (r)  &&  ! added.contains (r)) continue;  // already contributed by an earlier factor
                added.add (r);
                for (int i = 0; i < repeat; i++) result.add (r);
            }
        }
        if (denominator.isEmpty ()) return result;

        List<Operator> poles = new ArrayList<Operator> ();
        for (Product.Factor f : denominator) poles.add (f.base);
        return excludePoles (result, poles, variable);
    }

    /**
        Brings a sum of quotients over a common denominator, then solves the numerator.
        @return null if E isn't a rational function of the variable.
    **/
    protected static Solutions solveRational (Operator E, String variable, int depth) throws NotPolynomialException, UnsupportedDegreeException, DepthExceededException
    {
        RationalFunction r;
        try
        {
            r = RationalFunction.from (E, variable);
        }
        catch (NotPolynomialException e)
        {
            return null;
        }
        if (r.denominator.degree () == 0) return null;
        logger.debug ("rational: " + r);
        List<Operator> poles = new ArrayList<Operator> ();
        poles.add (r.denominator.toOperator ());
        return excludePoles (solve (r.numerator.toOperator (), variable, depth + 1), poles, variable);
    }

    protected static Solutions excludePoles (Solutions candidates, List<Operator> poles, String variable)
    {
        if (candidates.isIdentity ()) return candidates;
        Solutions result = new Solutions ();
        for (Operator r : candidates)
        {
            boolean pole = false;
            for (Operator d : poles)
            {
                if (isIdentity (Simplifier.simplify (d.substitute (variable, r))))
                {
                    pole = true;
                    break;
                }
            }
            if (pole) logger.debug ("excluding " + variable + " = " + r + " because it makes a denominator vanish");
            else      result.add (r);
        }
        return result;
    }

    protected static Solutions solvePolynomial (Polynomial p, Operator E, int depth) throws NotPolynomialException, UnsupportedDegreeException, DepthExceededException
    {
        String variable = p.variable;
        switch (p.degree ())
        {
            case 0:
                if (Polynomial.isZero (p.get (0))) return Solutions.identity ();
                return new Solutions ();
            case 1:
            {
                Solutions result = new Solutions ();
                result.add (Simplifier.simplify (new Divide (new Negate (p.get (0)), p.get (1))));
                return result;
            }
            case 2:
                return new Solutions (Quadratic.roots (p.get (2), p.get (1), p.get (0)));
            case 3:
                return new Solutions (Cubic.roots (p.get (3), p.get (2), p.get (1), p.get (0)));
        }

        // Factor out the lowest power of the variable, as in x^4-x^2 = x^2(x^2-1).
        int lowest = 0;
        while (Polynomial.isZero (p.get (lowest))) lowest++;
        if (lowest > 0)
        {
            List<Operator> shifted = new ArrayList<Operator> ();
            for (int i = lowest; i <= p.degree (); i++) shifted.add (p.get (i));
            Polynomial rest = new Polynomial (variable, shifted);
            Solutions result = new Solutions ();
            Operator zero = new Constant (0);
            for (int i = 0; i < lowest; i++) result.add (zero);
            for (Operator r : solve (rest.toOperator (), variable, depth + 1))
            {
                if (! Solutions.same (r, zero)) result.add (r);
            }
            return result;
        }

        return isolate (E, variable, new UnsupportedDegreeException (E, variable, p.degree ()));
    }

    /**
        Last resort: invert operators along the single path to the variable.
        @param failure Thrown if isolation does not apply.
    **/
    protected static <T extends Exception> Solutions isolate (Operator E, String variable, T failure) throws T
    {
        if (! Isolation.applies (E, variable)) throw failure;
        try
        {
            List<Operator> roots = new Isolation (E, new Constant (0), variable).solve ();
            logger.debug ("isolated " + variable + " in " + E + ": " + roots);
            return new Solutions (roots);
        }
        catch (UnsupportedFormException e)
        {
            logger.debug ("isolation failed: " + e.getMessage ());
            throw failure;
        }
    }
}
