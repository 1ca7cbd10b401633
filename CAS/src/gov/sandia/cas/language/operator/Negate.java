/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language.operator;

import gov.sandia.cas.language.Constant;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.OperatorUnary;
import gov.sandia.cas.language.Simplifier;

/**
    Unary minus.
**/
public class Negate extends OperatorUnary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "neg";
            }

            public Operator createInstance ()
            {
                return new Negate ();
            }
        };
    }

    public Negate ()
    {
    }

    public Negate (Object operand)
    {
        super (operand);
    }

    public Kind kind ()
    {
        return Kind.NEGATE;
    }

    public Associativity associativity ()
    {
        return Associativity.RIGHT_TO_LEFT;
    }

    public int precedence ()
    {
        return 2;
    }

    protected Operator derivative (Operator d)
    {
        return new Negate (d);
    }

    public double apply (double a)
    {
        return -a;
    }

    public Operator simplify (Simplifier simplifier)
    {
        Operator result = super.simplify (simplifier);
        if (result != this) return result;

        if (operand instanceof Negate) return ((Negate) operand).operand;  // --A --> A
        if (operand.equals (Constant.INFINITY         )) return Constant.NEGATIVE_INFINITY;
        if (operand.equals (Constant.NEGATIVE_INFINITY)) return Constant.INFINITY;
        return this;
    }

    public String toString ()
    {
        return "-";
    }
}
