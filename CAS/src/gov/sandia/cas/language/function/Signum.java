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
import gov.sandia.cas.language.Variable;

/**
    Sign of the operand: -1, 0 or 1.
**/
public class Signum extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "sgn";
            }

            public Operator createInstance ()
            {
                return new Signum ();
            }
        };
    }

    public Signum ()
    {
    }

    public Signum (Object operand)
    {
        super (operand);
    }

    public Kind kind ()
    {
        return Kind.SIGN;
    }

    public boolean canBeConstant ()
    {
        return true;
    }

    public Operator simplify (Simplifier simplifier)
    {
        Operator result = super.simplify (simplifier);
        if (result != this) return result;

        if (operand instanceof Constant) return Constant.of (Math.signum (operand.getDouble ()));
        if (operand instanceof Signum) return operand;
        return this;
    }

    /// Piecewise constant. The impulse at 0 is ignored.
    public Operator diff (Variable v)
    {
        return Constant.ZERO;
    }

    protected Operator derivative (Operator d)
    {
        return Constant.ZERO;
    }

    public double apply (double a)
    {
        return Math.signum (a);
    }

    public String toString ()
    {
        return "sgn";
    }
}
