/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.algebra;

import java.util.Comparator;

import gov.sandia.symcalc.language.AccessVariable;
import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.OperatorBinary;
import gov.sandia.symcalc.language.OperatorUnary;
import gov.sandia.symcalc.language.Type;
import gov.sandia.symcalc.language.function.Call;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Modulo;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.operator.Subtract;
import gov.sandia.symcalc.language.type.Scalar;

/**
    Total order over expression trees, consistent with equals().
    Used to put the operands of commutative operators into canonical order, so that
    like terms line up regardless of how the input was written.
    Trees are compared first by base, then by exponent (higher first), then by full structure.
    This puts polynomial terms in order of descending degree: x^2, x, then constants.
**/
public class OperatorComparator implements Comparator<Operator>
{
    public static final OperatorComparator instance = new OperatorComparator ();

    public int compare (Operator a, Operator b)
    {
        int result = compareStructure (base (a), base (b));
        if (result != 0) return result;
        result = compareStructure (exponent (b), exponent (a));
        if (result != 0) return result;
        return compareStructure (a, b);
    }

    public static Operator base (Operator op)
    {
        if (op instanceof Power) return ((Power) op).operand0;
        return op;
    }

    public static Operator exponent (Operator op)
    {
        if (op instanceof Power) return ((Power) op).operand1;
        return new Constant (1);
    }

    public static int rank (Operator op)
    {
        if (op instanceof Constant      ) return 0;
        if (op instanceof AccessVariable) return 1;
        if (op instanceof Power         ) return 2;
        if (op instanceof Multiply      ) return 3;
        if (op instanceof Divide        ) return 4;
        if (op instanceof Call          ) return 6;
        if (op instanceof Function      ) return 5;
        if (op instanceof OperatorUnary ) return 7;
        if (op instanceof Add           ) return 8;
        if (op instanceof Subtract      ) return 9;
        if (op instanceof Modulo        ) return 10;
        return 11;
    }

    public static int compareStructure (Operator a, Operator b)
    {
        int result = Integer.compare (rank (a), rank (b));
        if (result != 0) return result;

        if (a instanceof Constant) return compareValues (((Constant) a).value, ((Constant) b).value);
        if (a instanceof AccessVariable) return ((AccessVariable) a).name.compareTo (((AccessVariable) b).name);

        result = a.getClass ().getName ().compareTo (b.getClass ().getName ());
        if (result != 0) return result;

        if (a instanceof OperatorUnary) return compareStructure (((OperatorUnary) a).operand, ((OperatorUnary) b).operand);
        if (a instanceof OperatorBinary)
        {
            OperatorBinary A = (OperatorBinary) a;
            OperatorBinary B = (OperatorBinary) b;
            result = compareStructure (A.operand0, B.operand0);
            if (result != 0) return result;
            return compareStructure (A.operand1, B.operand1);
        }
        if (a instanceof Function)
        {
            Function A = (Function) a;
            Function B = (Function) b;
            result = A.getName ().compareTo (B.getName ());
            if (result != 0) return result;
            result = Integer.compare (A.operands.length, B.operands.length);
            if (result != 0) return result;
            for (int i = 0; i < A.operands.length; i++)
            {
                result = compareStructure (A.operands[i], B.operands[i]);
                if (result != 0) return result;
            }
            return 0;
        }
        return 0;
    }

    /**
        Real values come before complex values. Within each kind, natural numeric order.
    **/
    public static int compareValues (Type a, Type b)
    {
        boolean ra = a instanceof Scalar;
        boolean rb = b instanceof Scalar;
        if (ra != rb) return ra ? -1 : 1;
        return a.compareTo (b);
    }
}
