/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Divide;
import gov.sandia.symcalc.language.operator.Modulo;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Negate;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.operator.Subtract;

/**
    Minimal infix reader so tests can write expressions as text.
    Precedence from low to high: + -, * / %, unary -, ^ (right associative).
    A name followed by parentheses is built with Operator.create().
**/
public class ExpressionReader
{
    protected String text;
    protected int    position;

    public static Operator read (String text)
    {
        ExpressionReader r = new ExpressionReader ();
        r.text = text;
        Operator result = r.sum ();
        r.skipSpace ();
        if (r.position < text.length ()) throw new IllegalArgumentException ("Unexpected '" + text.charAt (r.position) + "' in " + text);
        return result;
    }

    protected void skipSpace ()
    {
        while (position < text.length ()  &&  Character.isWhitespace (text.charAt (position))) position++;
    }

    protected boolean accept (char c)
    {
        skipSpace ();
        if (position < text.length ()  &&  text.charAt (position) == c)
        {
            position++;
            return true;
        }
        return false;
    }

    protected Operator sum ()
    {
        Operator result = product ();
        while (true)
        {
            if      (accept ('+')) result = new Add      (result, product ());
            else if (accept ('-')) result = new Subtract (result, product ());
            else return result;
        }
    }

    protected Operator product ()
    {
        Operator result = unary ();
        while (true)
        {
            if      (accept ('*')) result = new Multiply (result, unary ());
            else if (accept ('/')) result = new Divide   (result, unary ());
            else if (accept ('%')) result = new Modulo   (result, unary ());
            else return result;
        }
    }

    protected Operator unary ()
    {
        if (accept ('-')) return new Negate (unary ());
        return power ();
    }

    protected Operator power ()
    {
        Operator base = atom ();
        if (accept ('^')) return new Power (base, unary ());
        return base;
    }

    protected Operator atom ()
    {
        skipSpace ();
        if (accept ('('))
        {
            Operator result = sum ();
            if (! accept (')')) throw new IllegalArgumentException ("Missing ) in " + text);
            return result;
        }
        int start = position;
        char c = position < text.length () ? text.charAt (position) : 0;
        if (Character.isDigit (c)  ||  c == '.')
        {
            while (position < text.length ()  &&  (Character.isDigit (text.charAt (position))  ||  text.charAt (position) == '.')) position++;
            if (position < text.length ()  &&  (text.charAt (position) == 'e'  ||  text.charAt (position) == 'E'))
            {
                position++;
                if (text.charAt (position) == '-'  ||  text.charAt (position) == '+') position++;
                while (position < text.length ()  &&  Character.isDigit (text.charAt (position))) position++;
            }
            return new Constant (Double.parseDouble (text.substring (start, position)));
        }
        if (Character.isLetter (c))
        {
            while (position < text.length ()  &&  (Character.isLetterOrDigit (text.charAt (position))  ||  text.charAt (position) == '_')) position++;
            String name = text.substring (start, position);
            if (! accept ('(')) return new AccessVariable (name);
            List<Operator> arguments = new ArrayList<Operator> ();
            if (! accept (')'))
            {
                do arguments.add (sum ());
                while (accept (','));
                if (! accept (')')) throw new IllegalArgumentException ("Missing ) after arguments of " + name);
            }
            return Operator.create (name, arguments.toArray (new Operator[arguments.size ()]));
        }
        throw new IllegalArgumentException ("Unexpected input at " + position + " in " + text);
    }
}
