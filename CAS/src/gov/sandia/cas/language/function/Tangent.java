/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language.function;

import gov.sandia.cas.language.Constant;
import gov.sandia.cas.language.Function;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.operator.Divide;
import gov.sandia.cas.language.operator.Power;

public class Tangent extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "tan";
            }

            public Operator createInstance ()
            {
                return new Tangent ();
            }
        };
    }

    public Tangent ()
    {
    }

    public Tangent (Object operand)
    {
        super (operand);
    }

    public Kind kind ()
    {
        return Kind.TAN;
    }

    protected Operator derivative (Operator d)
    {
        return new Divide (d, new Power (new Cosine (operand.deepCopy ()), Constant.TWO));
    }

    public double apply (double a)
    {
        return Math.tan (a);
    }

    public String toString ()
    {
        return "tan";
    }
}
