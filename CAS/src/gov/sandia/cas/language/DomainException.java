/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

/**
    An arithmetic domain violation discovered while evaluating, such as division by zero
    or the square root of a negative number.
**/
@SuppressWarnings("serial")
public class DomainException extends EvaluationException
{
    public DomainException (String msg)
    {
        super (msg);
    }
}
