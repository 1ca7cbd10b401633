/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

import java.util.HashMap;
import java.util.Map;
import java.util.Map.Entry;

/**
    Variable bindings for numeric evaluation. A value may be bound either to a Variable instance
    or to a variable name. Binding by instance takes precedence.
**/
public class EvaluationContext
{
    public Map<Variable,Double> values = new HashMap<Variable,Double> ();
    public Map<String,Double>   named  = new HashMap<String,Double> ();

    public EvaluationContext ()
    {
    }

    /**
        @param bindings Keys must be Variable or String. Entries with null values are ignored.
        @throws EvaluationException for any other type of key.
    **/
    public EvaluationContext (Map<?,? extends Number> bindings)
    {
        for (Entry<?,? extends Number> e : bindings.entrySet ())
        {
            Object key   = e.getKey ();
            Number value = e.getValue ();
            if (value == null) continue;
            if      (key instanceof Variable) values.put ((Variable) key, value.doubleValue ());
            else if (key instanceof String  ) named .put ((String)   key, value.doubleValue ());
            else throw new EvaluationException ("Binding key must be a Variable or a variable name. Received " + Operator.describe (key));
        }
    }

    public EvaluationContext set (Variable v, double value)
    {
        values.put (v, value);
        return this;
    }

    public EvaluationContext set (String name, double value)
    {
        named.put (name, value);
        return this;
    }

    public boolean has (Variable v)
    {
        return values.containsKey (v)  ||  named.containsKey (v.name);
    }

    public double get (Variable v) throws MissingBindingException
    {
        Double result = values.get (v);
        if (result == null) result = named.get (v.name);
        if (result == null) throw new MissingBindingException (v.name);
        return result;
    }
}
