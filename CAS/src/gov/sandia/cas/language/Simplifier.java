/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

import gov.sandia.cas.AppData;

import org.apache.log4j.Logger;

/**
    Fixed-point driver for simplification. Each outer pass brings the children of a node to their
    own fixed points and then applies the node's rewrite rules once. Passes repeat until the
    rendered text of the node stops changing. The rendered text, not object identity, decides
    convergence.

    Rewrite rules could in principle interact cyclically, so the number of outer passes for any
    single node is capped. The default cap comes from the setting simplify.maxIterations.
**/
public class Simplifier
{
    public static final int DEFAULT_MAX_ITERATIONS = 10000;

    public int maxIterations;

    private static Logger logger = Logger.getLogger (Simplifier.class);

    public Simplifier ()
    {
        this (AppData.getInt ("simplify.maxIterations", DEFAULT_MAX_ITERATIONS));
    }

    public Simplifier (int maxIterations)
    {
        if (maxIterations < 1) throw new IllegalArgumentException ("maxIterations must be at least 1");
        this.maxIterations = maxIterations;
    }

    /**
        @return The fixed point of op. Composite nodes along the way are rewritten in place.
        @throws SimplificationException if op has not converged within maxIterations passes.
    **/
    public Operator simplify (Operator op) throws SimplificationException
    {
        String before = op.render ();
        int pass = 0;
        while (true)
        {
            if (pass >= maxIterations)
            {
                logger.warn ("simplification guard tripped after " + pass + " passes");
                throw new SimplificationException (before, pass);
            }
            pass++;

            op = op.simplify (this);
            String after = op.render ();
            if (after.equals (before)) return op;
            if (logger.isDebugEnabled ()) logger.debug ("pass " + pass + ": " + before + " --> " + after);
            before = after;
        }
    }
}
