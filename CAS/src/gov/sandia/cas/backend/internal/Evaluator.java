/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.backend.internal;

import gov.sandia.cas.language.EvaluationContext;
import gov.sandia.cas.language.EvaluationException;
import gov.sandia.cas.language.MissingBindingException;
import gov.sandia.cas.language.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
    A compiled expression, ready to be invoked many times.
**/
public class Evaluator
{
    protected List<Variable> parameters;
    protected boolean[]      used;  // Parallel to parameters. True if the expression reads that slot.
    protected Code           code;

    public Evaluator (List<Variable> parameters, boolean[] used, Code code)
    {
        this.parameters = Collections.unmodifiableList (new ArrayList<Variable> (parameters));
        this.used       = used;
        this.code       = code;
    }

    public List<Variable> parameters ()
    {
        return parameters;
    }

    /**
        @param arguments One value per parameter, in parameter order.
    **/
    public double invoke (double... arguments) throws EvaluationException
    {
        if (arguments.length != parameters.size ()) throw new EvaluationException ("Expected " + parameters.size () + " arguments but received " + arguments.length);
        return code.eval (arguments.clone ());
    }

    /**
        @throws MissingBindingException if context lacks a value for a parameter the expression uses.
        Unused parameters may be left unbound.
    **/
    public double invoke (EvaluationContext context) throws EvaluationException
    {
        int count = parameters.size ();
        double[] frame = new double[count];
        for (int i = 0; i < count; i++)
        {
            Variable v = parameters.get (i);
            if      (context.has (v)) frame[i] = context.get (v);
            else if (used[i]        ) throw new MissingBindingException (v.name);
            else                      frame[i] = Double.NaN;
        }
        return code.eval (frame);
    }

    /**
        @param bindings Keyed by Variable or by variable name.
    **/
    public double invoke (Map<?,? extends Number> bindings) throws EvaluationException
    {
        return invoke (new EvaluationContext (bindings));
    }
}
