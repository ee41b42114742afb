/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.algebra;

import java.util.Set;

import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Negate;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.operator.Subtract;

/**
    Quotient of two polynomials in the same variable.
**/
public class RationalFunction
{
    public final Polynomial numerator;
    public final Polynomial denominator;

    public RationalFunction (Polynomial numerator, Polynomial denominator)
    {
        this.numerator   = numerator;
        this.denominator = denominator;
    }

    /**
        Brings an expression over a common denominator.
        @throws NotPolynomialException if some part is neither polynomial nor a quotient of polynomials.
    **/
    public static RationalFunction from (Operator expression, String variable) throws NotPolynomialException
    {
        return build (Simplifier.simplify (expression), variable);
    }

    protected static RationalFunction build (Operator op, String variable) throws NotPolynomialException
    {
        if (op.isPolynomial (variable, false))
        {
            return new RationalFunction (Polynomial.from (op, variable), Polynomial.constant (variable, new Constant (1)));
        }
        if (op instanceof Add  ||  op instanceof Subtract)
        {
            Operator a = op instanceof Add ? ((Add) op).operand0 : ((Subtract) op).operand0;
            Operator b = op instanceof Add ? ((Add) op).operand1 : ((Subtract) op).operand1;
            RationalFunction A = build (a, variable);
            RationalFunction B = build (b, variable);
            Polynomial an = A.numerator.multiply (B.denominator);
            Polynomial bn = B.numerator.multiply (A.denominator);
            Polynomial n  = op instanceof Add ? an.add (bn) : an.subtract (bn);
            return new RationalFunction (n, A.denominator.multiply (B.denominator));
        }
        if (op instanceof Negate)
        {
            RationalFunction A = build (((Negate) op).operand, variable);
            return new RationalFunction (Polynomial.constant (variable, new Constant (0)).subtract (A.numerator), A.denominator);
        }
        if (op instanceof Multiply)
        {
            RationalFunction A = build (((Multiply) op).operand0, variable);
            RationalFunction B = build (((Multiply) op).operand1, variable);
            return new RationalFunction (A.numerator.multiply (B.numerator), A.denominator.multiply (B.denominator));
        }
        if (op instanceof Divide)
        {
            RationalFunction A = build (((Divide) op).operand0, variable);
            RationalFunction B = build (((Divide) op).operand1, variable);
            return new RationalFunction (A.numerator.multiply (B.denominator), A.denominator.multiply (B.numerator));
        }
        if (op instanceof Power  &&  Constant.isInteger (((Power) op).operand1))
        {
            Power p = (Power) op;
            int n = (int) p.operand1.getDouble ();
            RationalFunction A = build (p.operand0, variable);
            if (n >= 0) return new RationalFunction (A.numerator.power (n), A.denominator.power (n));
            return new RationalFunction (A.denominator.power (-n), A.numerator.power (-n));
        }
        throw new NotPolynomialException (op, variable);
    }

    /**
        Divides out the greatest common divisor of numerator and denominator.
        Only done when both have real numeric coefficients. Otherwise returns this unchanged.
    **/
    public RationalFunction cancel ()
    {
        double[] n = numerator  .toArray ();
        double[] d = denominator.toArray ();
        if (n == null  ||  d == null  ||  d.length == 0) return this;
        double[] g = Polynomial.gcd (n, d);
        if (g.length < 2) return this;
        String x = numerator.variable;
        return new RationalFunction
        (
            Polynomial.fromArray (x, Polynomial.divide (n, g)[0]),
            Polynomial.fromArray (x, Polynomial.divide (d, g)[0])
        );
    }

    public Operator toOperator ()
    {
        if (denominator.degree () == 0) return Simplifier.simplify (new Divide (numerator.toOperator (), denominator.toOperator ()));
        return new Divide (numerator.toOperator (), denominator.toOperator ());
    }

    /**
        Cancels a common polynomial factor from a quotient of two polynomials in the same single
        variable with real numeric coefficients, for example (x^2-1)/(x-1) --> x+1.
        @return The reduced tree, or null if the quotient doesn't qualify or has no common factor.
    **/
    public static Operator cancel (Divide quotient)
    {
        Set<String> variables = quotient.variablesUsed ();
        if (variables.size () != 1) return null;
        String x = variables.iterator ().next ();
        if (! quotient.operand1.dependsOn (x)) return null;
        if (! quotient.operand0.isPolynomial (x, true)  ||  ! quotient.operand1.isPolynomial (x, true)) return null;
        try
        {
            RationalFunction r = new RationalFunction (Polynomial.from (quotient.operand0, x), Polynomial.from (quotient.operand1, x));
            RationalFunction c = r.cancel ();
            if (c == r) return null;
            return Simplifier.simplify (c.toOperator ());
        }
        catch (NotPolynomialException e)
        {
            return null;
        }
    }

    public String toString ()
    {
        return "(" + numerator + ")/(" + denominator + ")";
    }
}
