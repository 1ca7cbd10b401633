/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language.function;

import gov.sandia.cas.language.Constant;
import gov.sandia.cas.language.Function;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.operator.Add;
import gov.sandia.cas.language.operator.Divide;
import gov.sandia.cas.language.operator.Power;

public class Atan extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "atan";
            }

            public Operator createInstance ()
            {
                return new Atan ();
            }
        };
    }

    public Atan ()
    {
    }

    public Atan (Object operand)
    {
        super (operand);
    }

    public Kind kind ()
    {
        return Kind.ATAN;
    }

    protected Operator derivative (Operator d)
    {
        return new Divide (d, new Add (new Power (operand.deepCopy (), Constant.TWO), Constant.ONE));
    }

    public double apply (double a)
    {
        return Math.atan (a);
    }

    public String toString ()
    {
        return "atan";
    }
}
