/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language.operator;

import gov.sandia.cas.language.Constant;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.OperatorBinary;
import gov.sandia.cas.language.Simplifier;
import gov.sandia.cas.language.Variable;

public class Add extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "+";
            }

            public Operator createInstance ()
            {
                return new Add ();
            }
        };
    }

    public Add ()
    {
    }

    public Add (Object operand0, Object operand1)
    {
        super (operand0, operand1);
    }

    public Kind kind ()
    {
        return Kind.ADD;
    }

    public int precedence ()
    {
        return 5;
    }

    protected Operator derivative (Variable v, Operator d0, Operator d1)
    {
        return new Add (d0, d1);
    }

    public double apply (double a, double b)
    {
        return a + b;
    }

    public Operator simplify (Simplifier simplifier)
    {
        Operator result = super.simplify (simplifier);
        if (result != this) return result;

        if (operand0.equals (Constant.ZERO)) return operand1;  // 0+B --> B
        if (operand1.equals (Constant.ZERO)) return operand0;  // A+0 --> A
        if (operand1 instanceof Negate)  // A+(-B) --> A-B
        {
            return new Subtract (operand0, ((Negate) operand1).operand);
        }
        if (operand0 instanceof Negate)  // (-A)+B --> B-A
        {
            return new Subtract (operand1, ((Negate) operand0).operand);
        }
        return this;
    }

    public String toString ()
    {
        return "+";
    }
}
