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
    Typesets an expression for LaTeX math mode.
**/
public class RendererLaTeX extends Renderer
{
    public RendererLaTeX ()
    {
    }

    public RendererLaTeX (StringBuilder result)
    {
        super (result);
    }

    public static String typeset (Operator op)
    {
        RendererLaTeX renderer = new RendererLaTeX ();
        op.render (renderer);
        return renderer.result.toString ();
    }

    public boolean render (Operator op)
    {
        switch (op.kind ())
        {
            case CONSTANT:
            {
                Constant c = (Constant) op;
                if      (c.equals (Constant.PI               )) result.append ("\\pi");
                else if (c.equals (Constant.E                )) result.append ("e");
                else if (c.equals (Constant.INFINITY         )) result.append ("\\infty");
                else if (c.equals (Constant.NEGATIVE_INFINITY)) result.append ("-\\infty");
                else                                            result.append (Constant.print (c.value));
                return true;
            }
            case VARIABLE:
                result.append (((Variable) op).name);
                return true;
            case ADD:
                ((OperatorBinary) op).render (this, " + ");
                return true;
            case SUBTRACT:
                ((OperatorBinary) op).render (this, " - ");
                return true;
            case MULTIPLY:
                ((OperatorBinary) op).render (this, " \\cdot ");
                return true;
            case DIVIDE:
            {
                OperatorBinary b = (OperatorBinary) op;
                result.append ("\\frac{");
                b.operand0.render (this);
                result.append ("}{");
                b.operand1.render (this);
                result.append ("}");
                return true;
            }
            case POWER:
            {
                OperatorBinary b = (OperatorBinary) op;
                result.append ("{");
                if (b.operand0.precedence () > 1) fenced (b.operand0);
                else                              b.operand0.render (this);
                result.append ("}^{");
                b.operand1.render (this);
                result.append ("}");
                return true;
            }
            case NEGATE:
            {
                OperatorUnary u = (OperatorUnary) op;
                result.append ("-");
                if (u.operand.precedence () >= op.precedence ()) fenced (u.operand);
                else                                             u.operand.render (this);
                return true;
            }
            case SQRT:
                result.append ("\\sqrt{");
                ((OperatorUnary) op).operand.render (this);
                result.append ("}");
                return true;
            case ABS:
                result.append ("\\left| ");
                ((OperatorUnary) op).operand.render (this);
                result.append (" \\right|");
                return true;
            case SIN:  function ("\\sin",              op); return true;
            case COS:  function ("\\cos",              op); return true;
            case TAN:  function ("\\tan",              op); return true;
            case ASIN: function ("\\arcsin",           op); return true;
            case ACOS: function ("\\arccos",           op); return true;
            case ATAN: function ("\\arctan",           op); return true;
            case EXP:  function ("\\exp",              op); return true;
            case LOG:  function ("\\log",              op); return true;
            case SIGN: function ("\\operatorname{sgn}", op); return true;
            case MIN:  function ("\\min",              op); return true;
            case MAX:  function ("\\max",              op); return true;
        }
        return false;
    }

    protected void function (String name, Operator op)
    {
        result.append (name);
        result.append ("\\left( ");
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
        result.append (" \\right)");
    }

    protected void fenced (Operator op)
    {
        result.append ("\\left( ");
        op.render (this);
        result.append (" \\right)");
    }
}
