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

public class Multiply extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "*";
            }

            public Operator createInstance ()
            {
                return new Multiply ();
            }
        };
    }

    public Multiply ()
    {
    }

    public Multiply (Object operand0, Object operand1)
    {
        super (operand0, operand1);
    }

    public Kind kind ()
    {
        return Kind.MULTIPLY;
    }

    public int precedence ()
    {
        return 4;
    }

    /// Product rule: (fg)' = f'g + fg'
    protected Operator derivative (Variable v, Operator d0, Operator d1)
    {
        return new Add
        (
            new Multiply (d0, operand1.deepCopy ()),
            new Multiply (operand0.deepCopy (), d1)
        );
    }

    public double apply (double a, double b)
    {
        return a * b;
    }

    public Operator simplify (Simplifier simplifier)
    {
        Operator result = super.simplify (simplifier);
        if (result != this) return result;

        if (operand0.equals (Constant.ZERO)  ||  operand1.equals (Constant.ZERO)) return Constant.ZERO;
        if (operand0.equals (Constant.ONE      )) return operand1;
        if (operand1.equals (Constant.ONE      )) return operand0;
        if (operand0.equals (Constant.MINUS_ONE)) return new Negate (operand1);
        if (operand1.equals (Constant.MINUS_ONE)) return new Negate (operand0);
        return this;
    }

    public String toString ()
    {
        return "*";
    }
}
