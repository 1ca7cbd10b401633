/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

@SuppressWarnings("serial")
public class SimplificationException extends EvaluationException
{
    public int iterations;

    public SimplificationException (String expression, int iterations)
    {
        super ("Simplification did not converge after " + iterations + " passes: " + expression);
        this.iterations = iterations;
    }
}
