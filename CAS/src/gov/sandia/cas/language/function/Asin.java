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
import gov.sandia.cas.language.operator.Power;
import gov.sandia.cas.language.operator.Subtract;

/**
    Inverse sine, with range [-π/2, π/2].
**/
public class Asin extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "asin";
            }

            public Operator createInstance ()
            {
                return new Asin ();
            }
        };
    }

    public Asin ()
    {
    }

    public Asin (Object operand)
    {
        super (operand);
    }

    public Kind kind ()
    {
        return Kind.ASIN;
    }

    protected Operator derivative (Operator d)
    {
        return new Divide (d, new SquareRoot (new Subtract (Constant.ONE, new Power (operand.deepCopy (), Constant.TWO))));
    }

    public double apply (double a) throws DomainException
    {
        if (a < -1  ||  a > 1) throw new DomainException ("asin argument outside [-1,1]: " + a);
        return Math.asin (a);
    }

    public String toString ()
    {
        return "asin";
    }
}
