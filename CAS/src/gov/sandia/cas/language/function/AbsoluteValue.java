/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language.function;

import gov.sandia.cas.language.Constant;
import gov.sandia.cas.language.Function;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.Simplifier;
import gov.sandia.cas.language.operator.Multiply;
import gov.sandia.cas.language.operator.Negate;

public class AbsoluteValue extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "abs";
            }

            public Operator createInstance ()
            {
                return new AbsoluteValue ();
            }
        };
    }

    public AbsoluteValue ()
    {
    }

    public AbsoluteValue (Object operand)
    {
        super (operand);
    }

    public Kind kind ()
    {
        return Kind.ABS;
    }

    public boolean canBeConstant ()
    {
        return true;
    }

    public Operator simplify (Simplifier simplifier)
    {
        Operator result = super.simplify (simplifier);
        if (result != this) return result;

        if (operand instanceof Constant) return Constant.of (Math.abs (operand.getDouble ()));  // includes symbolic constants, since |π|=π and |-∞|=∞
        if (operand instanceof AbsoluteValue) return operand;                                  // ||A|| --> |A|
        if (operand instanceof Negate) operand = ((Negate) operand).operand;                   // |-A| --> |A|
        return this;
    }

    /// Undefined at 0, where sgn() supplies 0.
    protected Operator derivative (Operator d)
    {
        return new Multiply (d, new Signum (operand.deepCopy ()));
    }

    public double apply (double a)
    {
        return Math.abs (a);
    }

    public String toString ()
    {
        return "abs";
    }
}
