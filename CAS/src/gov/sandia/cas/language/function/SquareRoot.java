/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language.function;

import gov.sandia.cas.language.Constant;
import gov.sandia.cas.language.DomainException;
import gov.sandia.cas.language.Function;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.operator.Divide;
import gov.sandia.cas.language.operator.Multiply;

public class SquareRoot extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "sqrt";
            }

            public Operator createInstance ()
            {
                return new SquareRoot ();
            }
        };
    }

    public SquareRoot ()
    {
    }

    public SquareRoot (Object operand)
    {
        super (operand);
    }

    public Kind kind ()
    {
        return Kind.SQRT;
    }

    protected Operator derivative (Operator d)
    {
        return new Divide (d, new Multiply (Constant.TWO, deepCopy ()));
    }

    public double apply (double a) throws DomainException
    {
        if (a < 0) throw new DomainException ("sqrt of negative number: " + a);
        return Math.sqrt (a);
    }

    public String toString ()
    {
        return "sqrt";
    }
}
