/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language.function;

import gov.sandia.cas.language.DomainException;
import gov.sandia.cas.language.Function;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.operator.Divide;

/**
    Natural logarithm.
**/
public class Log extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "log";
            }

            public Operator createInstance ()
            {
                return new Log ();
            }
        };
    }

    public Log ()
    {
    }

    public Log (Object operand)
    {
        super (operand);
    }

    public Kind kind ()
    {
        return Kind.LOG;
    }

    protected Operator derivative (Operator d)
    {
        return new Divide (d, operand.deepCopy ());
    }

    public double apply (double a) throws DomainException
    {
        if (a <= 0) throw new DomainException ("log of non-positive number: " + a);
        return Math.log (a);
    }

    public String toString ()
    {
        return "log";
    }
}
