/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.exporters;

import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.OperatorBinary;
import gov.sandia.cas.language.OperatorUnary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.log4j.Logger;

/**
    Writes an expression tree in the Graphviz dot language. Every tree node becomes one graph node,
    labeled with its operator label. Edges run from parent to child in operand order.
    Shared leaves (such as a variable used twice) appear once per use.
**/
public class ExportDot
{
    private static Logger logger = Logger.getLogger (ExportDot.class);

    protected StringBuilder result;
    protected int           count;

    public static String export (Operator op)
    {
        ExportDot e = new ExportDot ();
        e.result.append ("digraph Op {\n");
        e.process (op);
        e.result.append ("}\n");
        return e.result.toString ();
    }

    public static void export (Operator op, Path destination) throws IOException
    {
        String text = export (op);
        Files.write (destination, text.getBytes (StandardCharsets.UTF_8));
        if (logger.isDebugEnabled ()) logger.debug ("wrote " + destination);
    }

    protected ExportDot ()
    {
        result = new StringBuilder ();
    }

    /**
        @return The id of the graph node emitted for op.
    **/
    protected String process (Operator op)
    {
        String id = "n" + count++;
        result.append ("  " + id + " [label=\"" + escape (op.toString ()) + "\"];\n");
        if (op instanceof OperatorUnary)
        {
            edge (id, process (((OperatorUnary) op).operand));
        }
        else if (op instanceof OperatorBinary)
        {
            OperatorBinary b = (OperatorBinary) op;
            String child0 = process (b.operand0);
            String child1 = process (b.operand1);
            edge (id, child0);
            edge (id, child1);
        }
        return id;
    }

    protected void edge (String from, String to)
    {
        result.append ("  " + from + " -> " + to + ";\n");
    }

    public static String escape (String label)
    {
        return label.replace ("\\", "\\\\").replace ("\"", "\\\"");
    }
}
