/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

import java.util.Map;

public abstract class OperatorBinary extends Operator
{
    public Operator operand0;
    public Operator operand1;

    public OperatorBinary ()
    {
    }

    /**
        Raw numbers are wrapped as Constants.
        @throws InvalidOperandException if either operand is neither an Operator nor a Number.
    **/
    public OperatorBinary (Object operand0, Object operand1)
    {
        this.operand0 = coerce (operand0);
        this.operand1 = coerce (operand1);
    }

    public void setOperands (Object... operands)
    {
        if (operands.length != 2) throw new InvalidOperandException (this + " takes 2 operands, not " + operands.length);
        operand0 = coerce (operands[0]);
        operand1 = coerce (operands[1]);
    }

    public Operator deepCopy ()
    {
        OperatorBinary result = (OperatorBinary) super.deepCopy ();
        result.operand0 = operand0.deepCopy ();
        result.operand1 = operand1.deepCopy ();
        return result;
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        operand0.visit (visitor);
        operand1.visit (visitor);
    }

    public boolean dependsOn (Variable v)
    {
        return operand0.dependsOn (v)  ||  operand1.dependsOn (v);
    }

    /**
        Supplies the partial derivative of each operand (or zero if that operand does not depend on v)
        and lets the concrete operator combine them.
    **/
    public Operator diff (Variable v)
    {
        if (! dependsOn (v)) return Constant.ZERO;
        Operator d0 = Constant.ZERO;
        Operator d1 = Constant.ZERO;
        if (operand0.dependsOn (v)) d0 = operand0.diff (v);
        if (operand1.dependsOn (v)) d1 = operand1.diff (v);
        return derivative (v, d0, d1);
    }

    /**
        Calculus rule for this operator.
        @param d0 Derivative of operand0. Owned by the caller, so it may be placed directly in the result, but only once.
        @param d1 Derivative of operand1. Same ownership as d0.
    **/
    protected abstract Operator derivative (Variable v, Operator d0, Operator d1);

    /**
        Scalar form of this operator, shared by eval() and the compiled evaluator.
        @throws DomainException if the operands are outside the domain of this operator.
    **/
    public abstract double apply (double a, double b) throws DomainException;

    /**
        Indicates that apply(a,b) is defined, so a constant expression may be folded.
    **/
    public boolean canFold (double a, double b)
    {
        return true;
    }

    public double eval (EvaluationContext context) throws EvaluationException
    {
        return apply (operand0.eval (context), operand1.eval (context));
    }

    public Operator substitute (Map<Operator,Operator> table)
    {
        operand0 = replace (operand0, table);
        operand1 = replace (operand1, table);
        return this;
    }

    public Operator simplify (Simplifier simplifier)
    {
        operand0 = simplifier.simplify (operand0);
        operand1 = simplifier.simplify (operand1);
        if (operand0 instanceof Constant  &&  operand1 instanceof Constant  &&  canBeConstant ())
        {
            Constant c0 = (Constant) operand0;
            Constant c1 = (Constant) operand1;
            if (! c0.isSymbolic ()  &&  ! c1.isSymbolic ()  &&  canFold (c0.value, c1.value))
            {
                return Constant.of (apply (c0.value, c1.value));
            }
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
        render (renderer, toString ());
    }

    public void render (Renderer renderer, String middle)
    {
        // Left-hand child
        boolean needParens =    precedence () < operand0.precedence ()   // read "<" as "comes before" rather than "less"
                             ||    precedence () == operand0.precedence ()
                                && associativity () == Associativity.RIGHT_TO_LEFT;
        if (needParens) renderer.result.append ("(");
        operand0.render (renderer);
        if (needParens) renderer.result.append (")");

        renderer.result.append (middle);

        // Right-hand child
        needParens =    precedence () < operand1.precedence ()
                     ||    precedence () == operand1.precedence ()
                        && associativity () == Associativity.LEFT_TO_RIGHT;
        if (needParens) renderer.result.append ("(");
        operand1.render (renderer);
        if (needParens) renderer.result.append (")");
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof OperatorBinary)) return false;
        OperatorBinary o = (OperatorBinary) that;

        // Order-sensitive, even for commutative operators.
        return kind () == o.kind ()  &&  operand0.equals (o.operand0)  &&  operand1.equals (o.operand1);
    }

    public int hashCode ()
    {
        int result = kind ().ordinal ();
        result = 31 * result + operand0.hashCode ();
        result = 31 * result + operand1.hashCode ();
        return result;
    }
}
