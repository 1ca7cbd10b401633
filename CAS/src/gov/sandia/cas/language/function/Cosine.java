/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language.function;

import gov.sandia.cas.language.Function;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.operator.Multiply;
import gov.sandia.cas.language.operator.Negate;

public class Cosine extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "cos";
            }

            public Operator createInstance ()
            {
                return new Cosine ();
            }
        };
    }

    public Cosine ()
    {
    }

    public Cosine (Object operand)
    {
        super (operand);
    }

    public Kind kind ()
    {
        return Kind.COS;
    }

    protected Operator derivative (Operator d)
    {
        return new Negate (new Multiply (d, new Sine (operand.deepCopy ())));
    }

    public double apply (double a)
    {
        return Math.cos (a);
    }

    public String toString ()
    {
        return "cos";
    }
}
