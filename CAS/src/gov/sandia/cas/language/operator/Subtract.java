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

public class Subtract extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "-";
            }

            public Operator createInstance ()
            {
                return new Subtract ();
            }
        };
    }

    public Subtract ()
    {
    }

    public Subtract (Object operand0, Object operand1)
    {
        super (operand0, operand1);
    }

    public Kind kind ()
    {
        return Kind.SUBTRACT;
    }

    public int precedence ()
    {
        return 5;
    }

    protected Operator derivative (Variable v, Operator d0, Operator d1)
    {
        return new Subtract (d0, d1);
    }

    public double apply (double a, double b)
    {
        return a - b;
    }

    public Operator simplify (Simplifier simplifier)
    {
        Operator result = super.simplify (simplifier);
        if (result != this) return result;

        if (operand1.equals (Constant.ZERO)) return operand0;                  // A-0 --> A
        if (operand0.equals (Constant.ZERO)) return new Negate (operand1);     // 0-B --> -B
        if (operand0.equals (operand1)     ) return Constant.ZERO;             // A-A --> 0
        if (operand1 instanceof Negate)                                        // A-(-B) --> A+B
        {
            return new Add (operand0, ((Negate) operand1).operand);
        }
        return this;
    }

    public String toString ()
    {
        return "-";
    }
}
