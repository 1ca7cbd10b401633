/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

import static gov.sandia.cas.language.Operator.add;
import static gov.sandia.cas.language.Operator.cos;
import static gov.sandia.cas.language.Operator.multiply;
import static gov.sandia.cas.language.Operator.pow;
import static gov.sandia.cas.language.Operator.sin;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import gov.sandia.cas.language.operator.Add;

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

public class SubstitutionTest {
    Variable x = Variable.lookupOrCreate("x");
    Variable y = Variable.lookupOrCreate("y");
    Variable z = Variable.lookupOrCreate("z");

    static Map<Object,Object> table(Object... pairs) {
        Map<Object,Object> result = new HashMap<Object,Object>();
        for(int i = 0; i < pairs.length; i += 2) result.put(pairs[i], pairs[i + 1]);
        return result;
    }

    @Test
    public void testConstantMatchesEval() {
        double[] values = {-2.5, 0, 0.3, 1, 4};
        for(double c : values) {
            Operator e = add(multiply(x, x), sin(multiply(x, 3)));
            Map<String,Double> binding = new HashMap<String,Double>();
            binding.put("x", c);
            double expected = e.eval(binding);
            Operator substituted = e.subs(table(x, c));
            assertEquals(expected, substituted.eval(new HashMap<String,Double>()), 0);
        }
    }

    @Test
    public void testNoMatch() {
        Operator e = add(sin(x), pow(y, 2));
        Operator copy = e.deepCopy();
        assertEquals(copy, e.subs(table(z, 1)));
        assertEquals(copy, e.subs(table()));
    }

    @Test
    public void testSubtree() {
        Operator e = add(sin(x), 1);
        assertEquals(add(cos(x), 1), e.subs(table(sin(x), cos(x))));

        // Matching is structural, not by identity.
        Operator f = multiply(add(x, y), add(x, y));
        assertEquals(multiply(z, z), f.subs(table(add(x, y), z)));

        // Order matters.
        Operator g = add(y, x);
        assertEquals(add(y, x), g.subs(table(add(x, y), z)));
    }

    @Test
    public void testRoot() {
        assertSame(y, x.subs(table(x, y)));
        assertSame(x, x.subs(table(y, z)));
        assertEquals(Constant.of(5), add(x, y).subs(table(add(x, y), 5)));
    }

    @Test
    public void testNumbers() {
        assertEquals(add(x, 3), add(x, 2).subs(table(2, 3)));
        assertEquals(add(x, 2.5), add(x, 2).subs(table(2.0, 2.5f)));
    }

    @Test
    public void testReplacementNotRevisited() {
        // The replacement contains the key, but substitution does not descend into it.
        Operator e = multiply(x, 2).subs(table(x, add(x, 1)));
        assertEquals(multiply(add(x, 1), 2), e);
    }

    @Test
    public void testReplacementCopied() {
        Operator r = add(y, 1);
        Add e = (Add) add(x, x).subs(table(x, r));
        assertEquals(r, e.operand0);
        assertEquals(r, e.operand1);
        assertNotSame(r, e.operand0);
        assertNotSame(e.operand0, e.operand1);
    }

    @Test
    public void testSharedSubtree() {
        // The same node object appears under both operands of the product.
        Operator u = add(x, 1);
        Operator f = multiply(u, u);
        Operator result = f.subs(table(x, add(x, 1)));
        assertEquals("(x+1+1)*(x+1+1)", result.render());
        assertEquals(multiply(add(add(x, 1), 1), add(add(x, 1), 1)), result);
    }

    @Test
    public void testReceiverUnchanged() {
        Operator e = add(sin(x), multiply(x, y));
        Operator before = e.deepCopy();
        Operator result = e.subs(table(x, z));
        assertEquals(before, e);
        assertEquals(add(sin(z), multiply(z, y)), result);
    }

    @Test
    public void testInvalid() {
        Object[][] bad = {
            {x, "y"},
            {"x", y},
            {x, null},
            {x, new Object()}
        };
        for(Object[] b : bad) {
            try {
                add(x, 1).subs(table(b[0], b[1]));
                fail("Accepted " + b[0] + " -> " + b[1]);
            } catch(InvalidSubstitutionException e) {
                // expected
            }
        }
    }
}
