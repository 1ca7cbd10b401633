/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import org.apache.log4j.Logger;

/**
    A named symbol. Variables live in a process-wide registry: each name maps to exactly one
    instance, which persists for the life of the process. Registry insertion is synchronized,
    so concurrent creation under the same name still yields a single instance.
**/
public class Variable extends Operator
{
    public final String name;

    protected static final TreeMap<String,Variable> container = new TreeMap<String,Variable> ();

    private static Logger logger = Logger.getLogger (Variable.class);

    protected Variable (String name)
    {
        this.name = name;
    }

    /**
        Strict constructor.
        @throws DuplicateVariableException if the name is already registered.
    **/
    public static Variable define (String name) throws DuplicateVariableException
    {
        checkName (name);
        synchronized (container)
        {
            if (container.containsKey (name)) throw new DuplicateVariableException (name);
            return register (name);
        }
    }

    /**
        Returns the registered instance for name, creating it if necessary. Never fails on repeats.
    **/
    public static Variable lookupOrCreate (String name)
    {
        checkName (name);
        synchronized (container)
        {
            Variable result = container.get (name);
            if (result != null) return result;
            return register (name);
        }
    }

    /// Caller must hold the lock on container.
    protected static Variable register (String name)
    {
        Variable result = new Variable (name);
        container.put (name, result);
        logger.debug ("registered variable " + name);
        return result;
    }

    protected static void checkName (String name)
    {
        if (name == null  ||  name.isEmpty ()  ||  name.matches ("(?s).*\\s.*"))
        {
            throw new InvalidOperandException ("Variable name must be a non-empty string without whitespace. Received \"" + name + "\"");
        }
    }

    public static boolean exists (String name)
    {
        synchronized (container)
        {
            return container.containsKey (name);
        }
    }

    public static int size ()
    {
        synchronized (container)
        {
            return container.size ();
        }
    }

    /**
        @return Snapshot of all registered variables, in name order.
    **/
    public static List<Variable> list ()
    {
        synchronized (container)
        {
            return new ArrayList<Variable> (container.values ());
        }
    }

    public Kind kind ()
    {
        return Kind.VARIABLE;
    }

    public Operator deepCopy ()
    {
        return this;
    }

    public Operator diff (Variable v)
    {
        if (equals (v)) return Constant.ONE;
        return Constant.ZERO;
    }

    public boolean dependsOn (Variable v)
    {
        return equals (v);
    }

    /**
        Looks up this variable in the context, first by instance and then by name.
        @throws MissingBindingException if neither is present.
    **/
    public double eval (EvaluationContext context) throws MissingBindingException
    {
        return context.get (this);
    }

    public String toString ()
    {
        return name;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Variable)) return false;
        return name.equals (((Variable) that).name);
    }

    public int hashCode ()
    {
        return name.hashCode ();
    }
}
