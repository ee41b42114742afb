/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.operator;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.complex.Complex;

import gov.sandia.symcalc.algebra.Product;
import gov.sandia.symcalc.algebra.Simplifier;
import gov.sandia.symcalc.language.Bindings;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.OperatorBinary;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.UnsupportedFormException;
import gov.sandia.symcalc.language.function.Log;
import gov.sandia.symcalc.language.function.SquareRoot;
import gov.sandia.symcalc.language.type.ComplexScalar;
import gov.sandia.symcalc.solve.Isolation;
import gov.sandia.symcalc.solve.Solutions;

public class Power extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "^";
            }

            public Operator createInstance (Operator... operands)
            {
                checkArity ("^", operands, 2);
                return new Power (operands[0], operands[1]);
            }
        };
    }

    public Power (Operator operand0, Operator operand1)
    {
        super (operand0, operand1);
    }

    public OperatorBinary newInstance (Operator operand0, Operator operand1)
    {
        return new Power (operand0, operand1);
    }

    public int precedence ()
    {
        return 2;
    }

    public Associativity associativity ()
    {
        return Associativity.RIGHT_TO_LEFT;
    }

    public Operator simplify ()
    {
        Operator result = super.simplify ();
        if (! (result instanceof Power)) return result;
        Power    p = (Power) result;
        Operator b = p.operand0;
        Operator e = p.operand1;

        if (Constant.isZero (e)) return new Constant (1);  // x^0 --> 1
        if (Constant.isOne  (e)) return b;                 // x^1 --> x
        if (Constant.isOne  (b)) return new Constant (1);  // 1^x --> 1
        if (Constant.isZero (b)  &&  e.isScalar ()  &&  e.getDouble () > 0) return new Constant (0);

        if (Constant.isInteger (e))
        {
            double n = e.getDouble ();
            if (b instanceof Power)  // (b^m)^n --> b^(m*n)
            {
                Power inner = (Power) b;
                return new Power (inner.operand0, new Multiply (inner.operand1, e)).simplify ();
            }
            if (b instanceof SquareRoot  &&  n % 2 == 0)  // sqrt(f)^(2k) --> f^k
            {
                return new Power (((SquareRoot) b).operands[0], new Constant (n / 2)).simplify ();
            }
            if (b instanceof Negate)  // (-f)^n --> f^n or -(f^n)
            {
                Operator inner = new Power (((Negate) b).operand, e);
                if (n % 2 == 0) return inner.simplify ();
                return new Negate (inner).simplify ();
            }
        }

        // Negative numeric powers become denominators.
        if (e.isScalar ()  &&  e.getDouble () < 0) return Product.of (p).toOperator ();
        return p;
    }

    /**
        A constant exponent uses the ordinary power rule. A variable exponent is handled by
        rewriting f^g as exp(g*ln(f)), which gives f^g * (g'*ln(f) + g*f'/f).
    **/
    public Operator derivative (String name)
    {
        Operator f = operand0;
        Operator g = operand1;
        if (! g.dependsOn (name))
        {
            Operator n1;
            if (g.isScalar ()) n1 = new Constant (g.getDouble () - 1);
            else               n1 = new Subtract (g, new Constant (1));
            return new Multiply (new Multiply (g, new Power (f, n1)), f.derivative (name));
        }
        if (! f.dependsOn (name))  // a^g --> a^g * ln(a) * g'
        {
            return new Multiply (new Multiply (this, new Log (f)), g.derivative (name));
        }
        return new Multiply
        (
            this,
            new Add
            (
                new Multiply (g.derivative (name), new Log (f)),
                new Divide (new Multiply (g, f.derivative (name)), f)
            )
        );
    }

    public boolean isPolynomial (String name, boolean strict)
    {
        if (! operand1.dependsOn (name)  &&  Constant.isInteger (operand1)  &&  operand1.getDouble () >= 0)
        {
            return operand0.isPolynomial (name, strict);
        }
        return super.isPolynomial (name, strict);
    }

    public Type eval (Bindings context)
    {
        return operand0.eval (context).power (operand1.eval (context));
    }

    /**
        An integer power n of the target has |n| roots. When the rhs is a number, all of them are
        listed, principal root first. A symbolic rhs is handled only for squares, as +/- the square root.
    **/
    public void solve (Isolation statement) throws UnsupportedFormException
    {
        if (! operand0.dependsOn (statement.target)  ||  ! Constant.isInteger (operand1)  ||  Math.abs (operand1.getDouble ()) < 2)
        {
            super.solve (statement);
            return;
        }

        int n = (int) operand1.getDouble ();
        List<Operator> rhs = new ArrayList<Operator> ();
        for (Operator r : statement.rhs)
        {
            Operator s = Simplifier.simplify (r);
            if (s instanceof Constant)
            {
                Complex c = ComplexScalar.toComplex (((Constant) s).value);
                if (n < 0)
                {
                    if (c.equals (Complex.ZERO)) continue;  // x^-n never reaches 0
                    c = c.reciprocal ();
                }
                for (Complex root : c.nthRoot (Math.abs (n))) rhs.add (Solutions.constant (root));
            }
            else if (Math.abs (n) == 2)
            {
                Operator root = inverse (operand1, r, true);
                rhs.add (root);
                rhs.add (new Negate (root));
            }
            else
            {
                throw new UnsupportedFormException ("Can't list all " + Math.abs (n) + " roots of " + s);
            }
        }
        statement.lhs = operand0;
        statement.rhs = rhs;
    }

    public Operator inverse (Operator other, Operator rhs, boolean keepLeft)
    {
        if (keepLeft)  // b^e=r --> b=r^(1/e)
        {
            Operator reciprocal;
            if (other.isScalar ()) reciprocal = new Constant (1 / other.getDouble ());
            else                   reciprocal = new Divide (new Constant (1), other);
            return new Power (rhs, reciprocal);
        }
        return new Divide (new Log (rhs), new Log (other));  // b^e=r --> e=ln(r)/ln(b)
    }

    public String getName ()
    {
        return "^";
    }
}
