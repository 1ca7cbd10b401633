/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

import static gov.sandia.cas.language.Operator.add;
import static gov.sandia.cas.language.Operator.divide;
import static gov.sandia.cas.language.Operator.max;
import static gov.sandia.cas.language.Operator.multiply;
import static gov.sandia.cas.language.Operator.negate;
import static gov.sandia.cas.language.Operator.pow;
import static gov.sandia.cas.language.Operator.sin;
import static gov.sandia.cas.language.Operator.subtract;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import gov.sandia.cas.language.function.Sine;
import gov.sandia.cas.language.operator.Add;
import gov.sandia.cas.language.operator.Power;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

public class OperatorTest {
    Variable x = Variable.lookupOrCreate("x");
    Variable y = Variable.lookupOrCreate("y");
    Variable z = Variable.lookupOrCreate("z");

    @Test
    public void testCreateByName() {
        assertTrue(Operator.create("sin", x) instanceof Sine);
        assertTrue(Operator.create("pow", x, 2) instanceof Power);
        assertEquals(pow(x, 2), Operator.create("^", x, 2));
        assertEquals(add(x, 1), Operator.create("+", x, 1));

        String[] names = {"+", "-", "*", "/", "^", "pow", "neg", "sin", "cos", "tan", "asin", "acos", "atan",
                          "exp", "log", "sqrt", "abs", "sgn", "min", "max"};
        for(String name : names) {
            assertTrue("missing " + name, Operator.names().contains(name));
        }
        assertEquals(names.length, Operator.names().size());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testRegistryReadOnly() {
        Operator.names().remove("sin");
    }

    @Test
    public void testCreateErrors() {
        Object[][] bad = {
            {"nosuch", new Object[] {x}},
            {"sin",    new Object[] {x, y}},
            {"+",      new Object[] {x}},
            {"+",      new Object[] {x, "y"}},
            {"neg",    new Object[] {}}
        };
        for(Object[] b : bad) {
            try {
                Operator.create((String) b[0], (Object[]) b[1]);
                fail("Accepted " + b[0] + " " + Arrays.toString((Object[]) b[1]));
            } catch(InvalidOperandException e) {
                // expected
            }
        }
        try {
            add(x, "one");
            fail("Accepted a String operand");
        } catch(InvalidOperandException e) {
            // expected
        }
    }

    @Test
    public void testStructuralEquality() {
        Operator a = add(x, multiply(y, 2));
        Operator b = add(x, multiply(y, 2));
        assertEquals(a, a);
        assertEquals(a, b);
        assertEquals(b, a);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotSame(a, b);

        // Not commutative, even though both evaluate the same.
        Operator xy = add(x, y);
        Operator yx = add(y, x);
        assertFalse(xy.equals(yx));
        assertFalse(yx.equals(xy));
        Map<String,Double> same = new HashMap<String,Double>();
        same.put("x", 2.0);
        same.put("y", 2.0);
        assertEquals(xy.eval(same), yx.eval(same), 0);

        // Same children, different operator.
        assertFalse(add(x, y).equals(subtract(x, y)));
        assertFalse(sin(x).equals(negate(x)));
    }

    @Test
    public void testFreeVariables() {
        Operator e = add(multiply(y, x), sin(add(x, z)));
        assertEquals(Arrays.asList(y, x, z), new ArrayList<Variable>(e.freeVariables()));
        assertTrue(add(1, 2).freeVariables().isEmpty());
    }

    @Test
    public void testDependsOn() {
        Operator e = add(multiply(y, 2), sin(z));
        assertTrue(e.dependsOn(y));
        assertTrue(e.dependsOn(z));
        assertFalse(e.dependsOn(x));
    }

    @Test
    public void testEval() {
        Operator e = add(multiply(x, 2), sin(y));
        Map<String,Double> values = new HashMap<String,Double>();
        values.put("x", 3.0);
        values.put("y", 0.5);
        assertEquals(6 + Math.sin(0.5), e.eval(values), 1e-15);

        values.remove("y");
        try {
            e.eval(values);
            fail("Evaluated without y");
        } catch(MissingBindingException ex) {
            assertEquals("y", ex.name);
        }
    }

    @Test
    public void testRender() {
        Object[] cases = {
            add(x, multiply(y, 2)),           "x+y*2",
            multiply(add(x, y), 2),           "(x+y)*2",
            subtract(x, subtract(y, z)),      "x-(y-z)",
            subtract(subtract(x, y), z),      "x-y-z",
            pow(x, pow(y, 2)),                "x^y^2",
            pow(pow(x, y), 2),                "(x^y)^2",
            divide(x, multiply(y, z)),        "x/(y*z)",
            sin(add(x, 1)),                   "sin(x+1)",
            negate(add(x, y)),                "-(x+y)",
            negate(x),                        "-x",
            max(x, 2.5),                      "max(x, 2.5)",
            multiply(Constant.PI, x),         "π*x"
        };
        for(int i = 0; i < cases.length; i += 2) {
            assertEquals(cases[i + 1], ((Operator) cases[i]).render());
        }
    }

    @Test
    public void testLabels() {
        assertEquals("+",   add(x, y).toString());
        assertEquals("sin", sin(x).toString());
        assertEquals("x",   x.toString());
    }

    @Test
    public void testDeepCopy() {
        Add original = (Add) add(sin(x), y);
        Add copy = (Add) original.deepCopy();
        assertEquals(original, copy);
        assertNotSame(original, copy);
        assertNotSame(original.operand0, copy.operand0);
        assertTrue(original.operand1 == copy.operand1);  // leaves are shared

        Map<Object,Object> table = new HashMap<Object,Object>();
        table.put(x, z);
        Operator changed = copy.subs(table);
        assertEquals("sin(x)+y", original.render());
        assertEquals("sin(x)+y", copy.render());
        assertEquals("sin(z)+y", changed.render());
    }

    @Test
    public void testVisitOrder() {
        final StringBuilder order = new StringBuilder();
        add(sin(x), multiply(y, 2)).visit(new Visitor() {
            public boolean visit(Operator op) {
                order.append(op.toString()).append(' ');
                return true;
            }
        });
        assertEquals("+ sin x * y 2 ", order.toString());
    }
}
