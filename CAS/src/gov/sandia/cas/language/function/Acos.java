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
import gov.sandia.cas.language.operator.Negate;
import gov.sandia.cas.language.operator.Power;
import gov.sandia.cas.language.operator.Subtract;

public class Acos extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "acos";
            }

            public Operator createInstance ()
            {
                return new Acos ();
            }
        };
    }

    public Acos ()
    {
    }

    public Acos (Object operand)
    {
        super (operand);
    }

    public Kind kind ()
    {
        return Kind.ACOS;
    }

    protected Operator derivative (Operator d)
    {
        return new Negate (new Divide (d, new SquareRoot (new Subtract (Constant.ONE, new Power (operand.deepCopy (), Constant.TWO)))));
    }

    public double apply (double a) throws DomainException
    {
        if (a < -1  ||  a > 1) throw new DomainException ("acos argument outside [-1,1]: " + a);
        return Math.acos (a);
    }

    public String toString ()
    {
        return "acos";
    }
}
