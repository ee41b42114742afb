/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.algebra.Expander;
import gov.sandia.symcalc.algebra.Product;
import gov.sandia.symcalc.algebra.Simplifier;
import gov.sandia.symcalc.calculus.integrate.Integrator;
import gov.sandia.symcalc.calculus.integrate.NoIntegrationRuleException;
import gov.sandia.symcalc.language.AccessVariable;
import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.DepthExceededException;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.UnsupportedFormException;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.operator.Subtract;
import gov.sandia.symcalc.language.type.Scalar;

/**
    Entry points for symbolic calculus. Results are simplified.
**/
public class Calculus
{
    private static Logger logger = Logger.getLogger (Calculus.class);

    public static Integrator integrator = new Integrator ();

    public static Operator differentiate (Operator expression, String variable) throws UnsupportedFormException
    {
        return Simplifier.simplify (expression.derivative (variable));
    }

    /**
        @param order Number of times to differentiate. 0 returns the simplified expression.
    **/
    public static Operator derivative (Operator expression, String variable, int order) throws UnsupportedFormException
    {
        if (order < 0) throw new IllegalArgumentException ("Negative derivative order: " + order);
        Operator result = Simplifier.simplify (expression);
        for (int i = 0; i < order; i++) result = differentiate (result, variable);
        return result;
    }

    /**
        @return The first partial derivatives, in the order the variables are given.
    **/
    public static List<Operator> gradient (Operator expression, List<String> variables) throws UnsupportedFormException
    {
        List<Operator> result = new ArrayList<Operator> ();
        for (String v : variables) result.add (differentiate (expression, v));
        return result;
    }

    /**
        Taylor polynomial of the given order around point:
        sum over k of f^(k)(point) / k! * (variable-point)^k
    **/
    public static Operator taylorSeries (Operator expression, String variable, Operator point, int order) throws UnsupportedFormException
    {
        if (order < 0) throw new IllegalArgumentException ("Negative series order: " + order);
        Operator offset = new Subtract (new AccessVariable (variable), point);
        Operator result = null;
        Operator f = Simplifier.simplify (expression);
        double factorial = 1;
        for (int k = 0; k <= order; k++)
        {
            if (k > 0)
            {
                f = differentiate (f, variable);
                factorial *= k;
            }
            Operator coefficient = Simplifier.simplify (new Divide (f.substitute (variable, point), new Constant (factorial)));
            if (Constant.isZero (coefficient)) continue;
            Operator term = coefficient;
            if (k > 0) term = new Multiply (coefficient, new Power (offset, new Constant (k)));
            if (result == null) result = term;
            else                result = new Add (result, term);
        }
        if (result == null) return new Constant (0);
        return Simplifier.simplify (result);
    }

    public static Operator taylorSeries (Operator expression, String variable, double point, int order) throws UnsupportedFormException
    {
        return taylorSeries (expression, variable, new Constant (point), order);
    }

    public static Operator maclaurinSeries (Operator expression, String variable, int order) throws UnsupportedFormException
    {
        return taylorSeries (expression, variable, new Constant (0), order);
    }

    /**
        Limit of the expression as the variable approaches point. Direct substitution is used
        unless it produces 0/0, in which case l'Hopital's rule is applied, up to Settings.limitDepth times.
        @throws NoLimitException if the denominator vanishes but the numerator does not.
    **/
    public static Operator limit (Operator expression, String variable, Operator point) throws NoLimitException, DepthExceededException
    {
        return limit (expression, variable, point, 0);
    }

    public static Operator limit (Operator expression, String variable, double point) throws NoLimitException, DepthExceededException
    {
        return limit (expression, variable, new Constant (point), 0);
    }

    protected static Operator limit (Operator expression, String variable, Operator point, int depth) throws NoLimitException, DepthExceededException
    {
        if (depth > Settings.limitDepth) throw new DepthExceededException ("Limit", Settings.limitDepth);

        // Split into numerator and denominator by the sign of each exponent.
        Product p = Product.of (Simplifier.simplify (expression));
        List<Product.Factor> over  = new ArrayList<Product.Factor> ();
        List<Product.Factor> under = new ArrayList<Product.Factor> ();
        for (Product.Factor f : p.factors)
        {
            if (f.exponent.isScalar ()  &&  f.exponent.getDouble () < 0) under.add (new Product.Factor (f.base, new Constant (-f.exponent.getDouble ())));
            else                                                         over .add (f);
        }
        Operator numerator = Product.from (p.coefficient, over).toOperator ();
        Operator N = Simplifier.simplify (numerator.substitute (variable, point));
        if (under.isEmpty ()) return N;

        Operator denominator = Product.from (new Scalar (1), under).toOperator ();
        Operator D = Simplifier.simplify (denominator.substitute (variable, point));
        if (! vanishes (D)) return Simplifier.simplify (new Divide (N, D));
        if (! vanishes (N)) throw new NoLimitException (expression, variable, point);

        logger.debug ("0/0 at " + variable + " = " + point + ", applying l'Hopital to " + numerator + " / " + denominator);
        Operator ratio = new Divide (differentiate (numerator, variable), differentiate (denominator, variable));
        return limit (ratio, variable, point, depth + 1);
    }

    protected static boolean vanishes (Operator op)
    {
        if (Constant.isZero (op)) return true;
        if (op.variablesUsed ().isEmpty ()) return Settings.isZero (op.eval (new Bindings ()).magnitude ());
        return Constant.isZero (Expander.expand (op));
    }

    public static Operator integrate (Operator expression, String variable) throws NoIntegrationRuleException, DepthExceededException
    {
        return integrator.integrate (expression, variable);
    }

    /**
        Evaluates F(upper) - F(lower), where F is an antiderivative.
        The integrand is assumed continuous on the interval.
    **/
    public static Operator definiteIntegral (Operator expression, String variable, Operator lower, Operator upper) throws NoIntegrationRuleException, DepthExceededException
    {
        Operator F = integrate (expression, variable);
        return Simplifier.simplify (new Subtract (F.substitute (variable, upper), F.substitute (variable, lower)));
    }

    public static Operator definiteIntegral (Operator expression, String variable, double lower, double upper) throws NoIntegrationRuleException, DepthExceededException
    {
        return definiteIntegral (expression, variable, new Constant (lower), new Constant (upper));
    }
}
