/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import gov.sandia.symcalc.language.function.AbsoluteValue;
import gov.sandia.symcalc.language.function.ArcCosine;
import gov.sandia.symcalc.language.function.ArcSine;
import gov.sandia.symcalc.language.function.ArcTangent;
import gov.sandia.symcalc.language.function.Call;
import gov.sandia.symcalc.language.function.Cosecant;
import gov.sandia.symcalc.language.function.Cosine;
import gov.sandia.symcalc.language.function.Cotangent;
import gov.sandia.symcalc.language.function.CubeRoot;
import gov.sandia.symcalc.language.function.Exp;
import gov.sandia.symcalc.language.function.HyperbolicCosine;
import gov.sandia.symcalc.language.function.HyperbolicSine;
import gov.sandia.symcalc.language.function.HyperbolicTangent;
import gov.sandia.symcalc.language.function.Log;
import gov.sandia.symcalc.language.function.LogBase;
import gov.sandia.symcalc.language.function.Secant;
import gov.sandia.symcalc.language.function.Sine;
import gov.sandia.symcalc.language.function.SquareRoot;
import gov.sandia.symcalc.language.function.Tangent;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Modulo;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Negate;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.operator.Subtract;
import gov.sandia.symcalc.language.type.Scalar;
import gov.sandia.symcalc.solve.Isolation;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeMap;

/**
    Base class of the expression tree.
    Trees are immutable. Every rewrite (simplify, derivative, substitute, transform) builds
    new nodes and shares the subtrees it leaves untouched. Two trees are equal when they
    have the same structure, as determined by equals().
**/
public abstract class Operator
{
    public interface Factory
    {
        public String   name ();  ///< Unique string for searching in the table of registered operators.
        public Operator createInstance (Operator... operands);
    }

    public enum Associativity
    {
        LEFT_TO_RIGHT,
        RIGHT_TO_LEFT
    }

    public Associativity associativity ()
    {
        return Associativity.LEFT_TO_RIGHT;
    }

    public int precedence ()
    {
        return 1;
    }

    public void visit (Visitor visitor)
    {
        visitor.visit (this);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        return this;
    }

    /**
        Computes the numeric value of this tree.
        @throws UnboundVariableException if a variable has no value in context.
        @throws DomainException if a real-valued operation leaves its domain.
        @throws UndefinedFunctionException if a named call has no implementation in context.
    **/
    public abstract Type eval (Bindings context) throws EvaluationException;

    /**
        Rewrites this tree toward canonical form, without changing its value.
        Operands are simplified first, then local rules apply to the rebuilt node.
        A single call need not reach a fixed point. Simplifier iterates until it does.
    **/
    public Operator simplify ()
    {
        return this;
    }

    /**
        Symbolic derivative with respect to the named variable. The result is not simplified.
        @throws UnsupportedFormException if this node has no derivative rule.
    **/
    public abstract Operator derivative (String name) throws UnsupportedFormException;

    /**
        Replaces every access to the named variable with the given tree. No evaluation is done.
    **/
    public Operator substitute (final String name, final Operator replacement)
    {
        return transform (new Transformer ()
        {
            public Operator transform (Operator op)
            {
                if (op instanceof AccessVariable  &&  ((AccessVariable) op).name.equals (name)) return replacement;
                return null;
            }
        });
    }

    /**
        @return Names of all variables referenced in this tree, in order of first appearance
        during a depth-first, left-to-right walk.
    **/
    public Set<String> variablesUsed ()
    {
        final Set<String> result = new LinkedHashSet<String> ();
        visit (new Visitor ()
        {
            public boolean visit (Operator op)
            {
                if (op instanceof AccessVariable) result.add (((AccessVariable) op).name);
                return true;
            }
        });
        return result;
    }

    public boolean dependsOn (String name)
    {
        return occurrences (name) > 0;
    }

    /**
        @return The number of times the named variable is accessed in this tree.
    **/
    public int occurrences (final String name)
    {
        class CountVisitor extends Visitor
        {
            public int count;
            public boolean visit (Operator op)
            {
                if (op instanceof AccessVariable  &&  ((AccessVariable) op).name.equals (name)) count++;
                return true;
            }
        }
        CountVisitor cv = new CountVisitor ();
        visit (cv);
        return cv.count;
    }

    /**
        Determines whether this tree is a polynomial in the named variable, meaning that the
        variable only appears under addition, subtraction, multiplication and non-negative
        integer powers, and no denominator depends on it.
        @param strict When false, sub-terms that do not involve the variable may be anything
        (they act as coefficients). When true, no transcendental function may appear anywhere.
    **/
    public boolean isPolynomial (String name, boolean strict)
    {
        if (dependsOn (name)) return false;
        return ! strict  ||  ! isTranscendental ();
    }

    /**
        @return true if any function node appears in this tree.
    **/
    public boolean isTranscendental ()
    {
        class FunctionVisitor extends Visitor
        {
            public boolean found;
            public boolean visit (Operator op)
            {
                if (op instanceof Function)
                {
                    found = true;
                    return false;
                }
                return ! found;
            }
        }
        FunctionVisitor fv = new FunctionVisitor ();
        visit (fv);
        return fv.found;
    }

    /**
        Moves one step of this operator from the lhs of the statement to its rhs,
        so that the lhs becomes the operand that contains the target variable.
    **/
    public void solve (Isolation statement) throws UnsupportedFormException
    {
        throw new UnsupportedFormException ("Can't solve for this operator: " + this);
    }

    /**
        Utility function to determine whether this operator tree contains a subtree structurally equal to the given one.
    **/
    public boolean contains (final Operator target)
    {
        class ContainsVisitor extends Visitor
        {
            public boolean found;
            public boolean visit (Operator op)
            {
                if (found) return false;
                if (op.equals (target))
                {
                    found = true;
                    return false;
                }
                return true;
            }
        }
        ContainsVisitor cv = new ContainsVisitor ();
        visit (cv);
        return cv.found;
    }

    public String render ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (getName ());
    }

    /**
        @return The symbol or function name of this node, as used by the renderer.
    **/
    public abstract String getName ();

    public String toString ()
    {
        return render ();
    }

    /**
        Extracts the value of a scalar constant without using eval().
        If this is not a scalar constant, then return 0.
    **/
    public double getDouble ()
    {
        if (! (this instanceof Constant)) return 0;
        Type value = ((Constant) this).value;
        if (value instanceof Scalar) return ((Scalar) value).value;
        return 0;
    }

    /**
        Determines if this is a scalar constant without using eval().
    **/
    public boolean isScalar ()
    {
        if (! (this instanceof Constant)) return false;
        return ((Constant) this).value instanceof Scalar;
    }

    public abstract boolean equals (Object that);

    public abstract int hashCode ();


    // Static interface ------------------------------------------------------

    public static TreeMap<String,Factory> operators = new TreeMap<String,Factory> ();

    public static void register (Factory f)
    {
        operators.put (f.name (), f);
    }

    static
    {
        // Functions
        register (AbsoluteValue    .factory ());
        register (ArcCosine        .factory ());
        register (ArcSine          .factory ());
        register (ArcTangent       .factory ());
        register (Cosecant         .factory ());
        register (Cosine           .factory ());
        register (Cotangent        .factory ());
        register (CubeRoot         .factory ());
        register (Exp              .factory ());
        register (HyperbolicCosine .factory ());
        register (HyperbolicSine   .factory ());
        register (HyperbolicTangent.factory ());
        register (Log              .factory ());
        register (LogBase          .factory ());
        register (Secant           .factory ());
        register (Sine             .factory ());
        register (SquareRoot       .factory ());
        register (Tangent          .factory ());
        operators.put ("pow", Power.factory ());  // map pow() function to ^ operator

        // Operators
        register (Add     .factory ());
        register (Divide  .factory ());
        register (Modulo  .factory ());
        register (Multiply.factory ());
        register (Negate  .factory ());
        register (Power   .factory ());
        register (Subtract.factory ());
    }

    /**
        Builds a node by its registered name, for example "sin" or "+".
        Names that are not registered produce a Call, which is evaluated through
        the functions defined in Bindings.
    **/
    public static Operator create (String name, Operator... operands)
    {
        Factory f = operators.get (name);
        if (f == null) return new Call (name, operands);
        return f.createInstance (operands);
    }

    /**
        Utility for factories: verifies the number of operands supplied to a named node.
    **/
    public static void checkArity (String name, Operator[] operands, int count)
    {
        if (operands.length != count) throw new EvaluationException (name + " takes " + count + " operand(s), but got " + operands.length);
    }
}
