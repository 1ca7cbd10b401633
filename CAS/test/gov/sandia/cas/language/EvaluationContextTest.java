/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

public class EvaluationContextTest {

    @Test
    public void testMapConstructor() {
        Variable x = Variable.lookupOrCreate("x");
        Variable y = Variable.lookupOrCreate("y");
        Variable z = Variable.lookupOrCreate("z");
        Map<Object,Number> bindings = new HashMap<Object,Number>();
        bindings.put(x, 1);
        bindings.put("y", 2.5f);
        bindings.put("z", null);
        EvaluationContext context = new EvaluationContext(bindings);
        assertTrue(context.has(x));
        assertTrue(context.has(y));
        assertFalse(context.has(z));
        assertEquals(1.0, context.get(x), 0);
        assertEquals(2.5, context.get(y), 0);
    }

    @Test(expected = EvaluationException.class)
    public void testBadKey() {
        Map<Object,Number> bindings = new HashMap<Object,Number>();
        bindings.put(42, 1.0);
        new EvaluationContext(bindings);
    }

    @Test(expected = MissingBindingException.class)
    public void testMissing() {
        new EvaluationContext().get(Variable.lookupOrCreate("x"));
    }
}
