/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.exporters;

import gov.sandia.cas.language.Constant;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.OperatorBinary;
import gov.sandia.cas.language.OperatorUnary;
import gov.sandia.cas.language.Renderer;
import gov.sandia.cas.language.Variable;

/**
    Emits an expression as a Java double-valued expression, with each variable written as its name.
    Numeric literals always carry a decimal point or exponent, so integer division never occurs.
    Note that the emitted code follows IEEE semantics, so it produces NaN or infinity where
    Operator.eval() would throw DomainException.
**/
public class RendererJava extends Renderer
{
    public RendererJava ()
    {
    }

    public RendererJava (StringBuilder result)
    {
        super (result);
    }

    public static String source (Operator op)
    {
        RendererJava renderer = new RendererJava ();
        op.render (renderer);
        return renderer.result.toString ();
    }

    public boolean render (Operator op)
    {
        switch (op.kind ())
        {
            case CONSTANT:
            {
                double value = ((Constant) op).value;
                if      (value == Math.PI                 ) result.append ("Math.PI");
                else if (value == Math.E                  ) result.append ("Math.E");
                else if (value == Double.POSITIVE_INFINITY) result.append ("Double.POSITIVE_INFINITY");
                else if (value == Double.NEGATIVE_INFINITY) result.append ("Double.NEGATIVE_INFINITY");
                else if (Double.isNaN (value)             ) result.append ("Double.NaN");
                else                                        result.append (String.valueOf (value));
                return true;
            }
            case VARIABLE:
                result.append (((Variable) op).name);
                return true;
            case NEGATE:
            {
                // Always grouped, because "--x" would be a decrement.
                result.append ("-(");
                ((OperatorUnary) op).operand.render (this);
                result.append (")");
                return true;
            }
            case ADD:
            case SUBTRACT:
            case MULTIPLY:
            case DIVIDE:
                ((OperatorBinary) op).render (this, " " + op + " ");
                return true;
            case POWER: call ("Math.pow",    op); return true;
            case SQRT:  call ("Math.sqrt",   op); return true;
            case EXP:   call ("Math.exp",    op); return true;
            case LOG:   call ("Math.log",    op); return true;
            case SIN:   call ("Math.sin",    op); return true;
            case COS:   call ("Math.cos",    op); return true;
            case TAN:   call ("Math.tan",    op); return true;
            case ASIN:  call ("Math.asin",   op); return true;
            case ACOS:  call ("Math.acos",   op); return true;
            case ATAN:  call ("Math.atan",   op); return true;
            case ABS:   call ("Math.abs",    op); return true;
            case SIGN:  call ("Math.signum", op); return true;
            case MIN:   call ("Math.min",    op); return true;
            case MAX:   call ("Math.max",    op); return true;
        }
        return false;
    }

    protected void call (String name, Operator op)
    {
        result.append (name);
        result.append ("(");
        if (op instanceof OperatorBinary)
        {
            OperatorBinary b = (OperatorBinary) op;
            b.operand0.render (this);
            result.append (", ");
            b.operand1.render (this);
        }
        else
        {
            ((OperatorUnary) op).operand.render (this);
        }
        result.append (")");
    }
}
