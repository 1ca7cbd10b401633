/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

/**
    An operator was given something other than an Operator or a Number, or the wrong number of operands.
**/
@SuppressWarnings("serial")
public class InvalidOperandException extends RuntimeException
{
    public InvalidOperandException (String msg)
    {
        super (msg);
    }
}
