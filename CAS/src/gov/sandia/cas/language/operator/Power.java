/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language.operator;

import gov.sandia.cas.language.Constant;
import gov.sandia.cas.language.DomainException;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.OperatorBinary;
import gov.sandia.cas.language.Simplifier;
import gov.sandia.cas.language.Variable;
import gov.sandia.cas.language.function.Log;

/**
    operand0 ^ operand1. Registered under both "^" and "pow".
**/
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

            public Operator createInstance ()
            {
                return new Power ();
            }
        };
    }

    public Power ()
    {
    }

    public Power (Object operand0, Object operand1)
    {
        super (operand0, operand1);
    }

    public Kind kind ()
    {
        return Kind.POWER;
    }

    public Associativity associativity ()
    {
        return Associativity.RIGHT_TO_LEFT;
    }

    public int precedence ()
    {
        return 2;
    }

    /**
        Generalized power rule, for f^g:
        <ul>
        <li>only f depends on v: g f^(g-1) f'
        <li>only g depends on v: f^g ln(f) g'
        <li>both: f^g (g' ln(f) + g f'/f)
        </ul>
    **/
    protected Operator derivative (Variable v, Operator d0, Operator d1)
    {
        boolean baseDepends     = operand0.dependsOn (v);
        boolean exponentDepends = operand1.dependsOn (v);
        if (! exponentDepends)
        {
            return new Multiply
            (
                new Multiply (operand1.deepCopy (), new Power (operand0.deepCopy (), new Subtract (operand1.deepCopy (), Constant.ONE))),
                d0
            );
        }
        if (! baseDepends)
        {
            return new Multiply
            (
                new Multiply (deepCopy (), new Log (operand0.deepCopy ())),
                d1
            );
        }
        return new Multiply
        (
            deepCopy (),
            new Add
            (
                new Multiply (d1, new Log (operand0.deepCopy ())),
                new Divide (new Multiply (operand1.deepCopy (), d0), operand0.deepCopy ())
            )
        );
    }

    public double apply (double a, double b) throws DomainException
    {
        if (! canFold (a, b))
        {
            if (a == 0) throw new DomainException ("Zero raised to a negative power");
            throw new DomainException ("Negative base " + a + " raised to non-integer power " + b);
        }
        return Math.pow (a, b);
    }

    public boolean canFold (double a, double b)
    {
        if (a == 0  &&  b < 0) return false;
        if (a < 0  &&  Double.isFinite (b)  &&  b != Math.rint (b)) return false;
        return true;
    }

    public Operator simplify (Simplifier simplifier)
    {
        Operator result = super.simplify (simplifier);
        if (result != this) return result;

        // Cases we can simplify:
        // 1^b = 1
        // a^0 = 1
        // a^1 = a
        if (operand0.equals (Constant.ONE)  ||  operand1.equals (Constant.ZERO)) return Constant.ONE;
        if (operand1.equals (Constant.ONE)) return operand0;
        return this;
    }

    public String toString ()
    {
        return "^";
    }
}
