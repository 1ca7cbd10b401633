/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

import java.util.Map;

public abstract class OperatorUnary extends Operator
{
    public Operator operand;

    public OperatorUnary ()
    {
    }

    public OperatorUnary (Object operand)
    {
        this.operand = coerce (operand);
    }

    public void setOperands (Object... operands)
    {
        if (operands.length != 1) throw new InvalidOperandException (this + " takes 1 operand, not " + operands.length);
        operand = coerce (operands[0]);
    }

    public Operator deepCopy ()
    {
        OperatorUnary result = (OperatorUnary) super.deepCopy ();
        result.operand = operand.deepCopy ();
        return result;
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        operand.visit (visitor);
    }

    public boolean dependsOn (Variable v)
    {
        return operand.dependsOn (v);
    }

    public Operator diff (Variable v)
    {
        if (! operand.dependsOn (v)) return Constant.ZERO;
        return derivative (operand.diff (v));
    }

    /**
        Chain rule for this operator.
        @param d Derivative of the operand. Owned by the caller, so it may be placed directly in the result.
        Any use of the operand itself must go through deepCopy().
    **/
    protected abstract Operator derivative (Operator d);

    /**
        Scalar form of this operator, shared by eval() and the compiled evaluator.
        @throws DomainException if a is outside the domain of this operator.
    **/
    public abstract double apply (double a) throws DomainException;

    public double eval (EvaluationContext context) throws EvaluationException
    {
        return apply (operand.eval (context));
    }

    public Operator substitute (Map<Operator,Operator> table)
    {
        operand = replace (operand, table);
        return this;
    }

    public Operator simplify (Simplifier simplifier)
    {
        operand = simplifier.simplify (operand);
        if (operand instanceof Constant  &&  canBeConstant ()  &&  ! ((Constant) operand).isSymbolic ())
        {
            return Constant.of (apply (operand.getDouble ()));
        }
        return this;
    }

    public boolean canBeConstant ()
    {
        return true;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (toString ());
        boolean needParens = operand.precedence () > precedence ();
        if (needParens) renderer.result.append ("(");
        operand.render (renderer);
        if (needParens) renderer.result.append (")");
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof OperatorUnary)) return false;
        OperatorUnary o = (OperatorUnary) that;
        return kind () == o.kind ()  &&  operand.equals (o.operand);
    }

    public int hashCode ()
    {
        return 31 * kind ().ordinal () + operand.hashCode ();
    }
}
