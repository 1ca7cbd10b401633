/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.exporters;

import static gov.sandia.cas.language.Operator.abs;
import static gov.sandia.cas.language.Operator.add;
import static gov.sandia.cas.language.Operator.asin;
import static gov.sandia.cas.language.Operator.divide;
import static gov.sandia.cas.language.Operator.max;
import static gov.sandia.cas.language.Operator.multiply;
import static gov.sandia.cas.language.Operator.negate;
import static gov.sandia.cas.language.Operator.pow;
import static gov.sandia.cas.language.Operator.sin;
import static gov.sandia.cas.language.Operator.sqrt;
import static gov.sandia.cas.language.Operator.subtract;
import static org.junit.Assert.assertEquals;
import gov.sandia.cas.language.Constant;
import gov.sandia.cas.language.Operator;
import gov.sandia.cas.language.Variable;

import org.junit.Test;

public class RendererLaTeXTest {
    Variable x = Variable.lookupOrCreate("x");
    Variable y = Variable.lookupOrCreate("y");

    @Test
    public void testTypeset() {
        Object[] cases = {
            sin(x),                          "\\sin\\left( x \\right)",
            asin(x),                         "\\arcsin\\left( x \\right)",
            divide(x, add(y, 1)),            "\\frac{x}{y + 1}",
            pow(x, 2),                       "{x}^{2}",
            pow(add(x, 1), 2),               "{\\left( x + 1 \\right)}^{2}",
            sqrt(x),                         "\\sqrt{x}",
            multiply(x, y),                  "x \\cdot y",
            multiply(add(x, 1), y),          "(x + 1) \\cdot y",
            subtract(x, y),                  "x - y",
            negate(add(x, y)),               "-\\left( x + y \\right)",
            negate(x),                       "-x",
            abs(x),                          "\\left| x \\right|",
            max(x, 1),                       "\\max\\left( x, 1 \\right)",
            Constant.PI,                     "\\pi",
            Constant.INFINITY,               "\\infty",
            Constant.of(2.5),                "2.5"
        };
        for(int i = 0; i < cases.length; i += 2) {
            assertEquals(cases[i + 1], RendererLaTeX.typeset((Operator) cases[i]));
        }
    }

    @Test
    public void testNested() {
        Operator e = sin(divide(Constant.PI, pow(x, 2)));
        assertEquals("\\sin\\left( \\frac{\\pi}{{x}^{2}} \\right)", RendererLaTeX.typeset(e));
    }
}
