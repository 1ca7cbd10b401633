/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

/**
    Checked failure in how the expression API was used. Subclasses name the specific misuse.
**/
@SuppressWarnings("serial")
public class LanguageException extends Exception
{
    public LanguageException (String msg)
    {
        super (msg);
    }

    public LanguageException (String msg, Throwable cause)
    {
        super (msg, cause);
    }
}
