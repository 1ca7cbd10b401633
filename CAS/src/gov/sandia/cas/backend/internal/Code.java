/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.backend.internal;

import gov.sandia.cas.language.EvaluationException;

/**
    One compiled node. Reads its variables from a frame of doubles laid out in parameter order.
**/
public interface Code
{
    public double eval (double[] frame) throws EvaluationException;
}
