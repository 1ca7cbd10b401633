/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language.function;

import gov.sandia.cas.language.Constant;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.OperatorBinary;
import gov.sandia.cas.language.Renderer;
import gov.sandia.cas.language.Simplifier;
import gov.sandia.cas.language.Variable;
import gov.sandia.cas.language.operator.Add;
import gov.sandia.cas.language.operator.Divide;
import gov.sandia.cas.language.operator.Multiply;
import gov.sandia.cas.language.operator.Subtract;

public class Max extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "max";
            }

            public Operator createInstance ()
            {
                return new Max ();
            }
        };
    }

    public Max ()
    {
    }

    public Max (Object operand0, Object operand1)
    {
        super (operand0, operand1);
    }

    public Kind kind ()
    {
        return Kind.MAX;
    }

    /**
        max(f,g) = ((f+g) + |f-g|) / 2, so the derivative is (f'+g' + sgn(f-g) (f'-g')) / 2
    **/
    protected Operator derivative (Variable v, Operator d0, Operator d1)
    {
        Operator sign = new Signum (new Subtract (operand0.deepCopy (), operand1.deepCopy ()));
        Operator diff = new Multiply (sign, new Subtract (d0.deepCopy (), d1.deepCopy ()));
        return new Divide (new Add (new Add (d0, d1), diff), Constant.TWO);
    }

    public double apply (double a, double b)
    {
        return Math.max (a, b);
    }

    public Operator simplify (Simplifier simplifier)
    {
        Operator result = super.simplify (simplifier);
        if (result != this) return result;

        if (operand0.equals (operand1)) return operand0;
        return this;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append ("max(");
        operand0.render (renderer);
        renderer.result.append (", ");
        operand1.render (renderer);
        renderer.result.append (")");
    }

    public String toString ()
    {
        return "max";
    }
}
