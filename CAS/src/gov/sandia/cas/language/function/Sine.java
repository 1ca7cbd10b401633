/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language.function;

import gov.sandia.cas.language.Function;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.operator.Multiply;

public class Sine extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "sin";
            }

            public Operator createInstance ()
            {
                return new Sine ();
            }
        };
    }

    public Sine ()
    {
    }

    public Sine (Object operand)
    {
        super (operand);
    }

    public Kind kind ()
    {
        return Kind.SIN;
    }

    protected Operator derivative (Operator d)
    {
        return new Multiply (d, new Cosine (operand.deepCopy ()));
    }

    public double apply (double a)
    {
        return Math.sin (a);
    }

    public String toString ()
    {
        return "sin";
    }
}
