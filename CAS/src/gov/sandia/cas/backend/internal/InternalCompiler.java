/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.backend.internal;

import gov.sandia.cas.language.CompilationException;
import gov.sandia.cas.language.Constant;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.OperatorBinary;
import gov.sandia.cas.language.OperatorUnary;
import gov.sandia.cas.language.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
    Turns an expression tree into an Evaluator. The result is a graph of Code objects with the same
    shape as the tree. Each one holds its children directly, and variables become fixed slots
    in the argument frame. The tree itself is copied first, so later in-place rewriting of the source has no effect.
**/
public class InternalCompiler
{
    private static Logger logger = Logger.getLogger (InternalCompiler.class);

    /**
        Compiles with the free variables of tree as parameters, in first-seen order.
    **/
    public static Evaluator compile (Operator tree) throws CompilationException
    {
        return compile (tree, new ArrayList<Variable> (tree.freeVariables ()));
    }

    /**
        @param parameters Order of positional arguments to Evaluator.invoke(double...). May include
        variables that tree does not use.
        @throws CompilationException if tree references a variable not in parameters,
        or parameters lists some variable more than once.
    **/
    public static Evaluator compile (Operator tree, List<Variable> parameters) throws CompilationException
    {
        Map<Variable,Integer> slots = new HashMap<Variable,Integer> ();
        for (Variable v : parameters)
        {
            if (slots.containsKey (v)) throw new CompilationException ("Parameter " + v + " is listed more than once");
            slots.put (v, slots.size ());
        }
        for (Variable v : tree.freeVariables ())
        {
            if (! slots.containsKey (v)) throw new CompilationException ("Expression uses " + v + ", which is not among the parameters " + parameters);
        }

        boolean[] used = new boolean[parameters.size ()];
        Code code = generate (tree.deepCopy (), slots, used);
        if (logger.isDebugEnabled ()) logger.debug ("compiled " + tree.render () + " with parameters " + parameters);
        return new Evaluator (parameters, used, code);
    }

    protected static Code generate (Operator op, final Map<Variable,Integer> slots, boolean[] used) throws CompilationException
    {
        if (op instanceof Constant)
        {
            final double value = ((Constant) op).value;
            return new Code ()
            {
                public double eval (double[] frame)
                {
                    return value;
                }
            };
        }
        if (op instanceof Variable)
        {
            final int index = slots.get (op);
            used[index] = true;
            return new Code ()
            {
                public double eval (double[] frame)
                {
                    return frame[index];
                }
            };
        }
        if (op instanceof OperatorUnary)
        {
            final OperatorUnary u       = (OperatorUnary) op;
            final Code          operand = generate (u.operand, slots, used);
            return new Code ()
            {
                public double eval (double[] frame)
                {
                    return u.apply (operand.eval (frame));
                }
            };
        }
        if (op instanceof OperatorBinary)
        {
            final OperatorBinary b        = (OperatorBinary) op;
            final Code           operand0 = generate (b.operand0, slots, used);
            final Code           operand1 = generate (b.operand1, slots, used);
            return new Code ()
            {
                public double eval (double[] frame)
                {
                    return b.apply (operand0.eval (frame), operand1.eval (frame));
                }
            };
        }
        throw new CompilationException ("Don't know how to compile " + op.getClass ().getSimpleName ());
    }
}
