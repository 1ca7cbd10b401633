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

public class Divide extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "/";
            }

            public Operator createInstance ()
            {
                return new Divide ();
            }
        };
    }

    public Divide ()
    {
    }

    public Divide (Object operand0, Object operand1)
    {
        super (operand0, operand1);
    }

    public Kind kind ()
    {
        return Kind.DIVIDE;
    }

    public int precedence ()
    {
        return 4;
    }

    /// Quotient rule: (f/g)' = (f'g - fg') / g^2, or f'/g when g does not depend on v.
    protected Operator derivative (Variable v, Operator d0, Operator d1)
    {
        if (! operand1.dependsOn (v)) return new Divide (d0, operand1.deepCopy ());
        return new Divide
        (
            new Subtract
            (
                new Multiply (d0, operand1.deepCopy ()),
                new Multiply (operand0.deepCopy (), d1)
            ),
            new Power (operand1.deepCopy (), Constant.TWO)
        );
    }

    public double apply (double a, double b) throws DomainException
    {
        if (b == 0) throw new DomainException ("Division by zero");
        return a / b;
    }

    public boolean canFold (double a, double b)
    {
        return b != 0;
    }

    public Operator simplify (Simplifier simplifier)
    {
        Operator result = super.simplify (simplifier);
        if (result != this) return result;

        if (operand1.equals (Constant.ONE      )) return operand0;               // A/1 --> A
        if (operand1.equals (Constant.MINUS_ONE)) return new Negate (operand0);  // A/-1 --> -A
        if (operand0.equals (Constant.ZERO)  &&  ! operand1.equals (Constant.ZERO)) return Constant.ZERO;  // 0/B --> 0
        return this;
    }

    public String toString ()
    {
        return "/";
    }
}
