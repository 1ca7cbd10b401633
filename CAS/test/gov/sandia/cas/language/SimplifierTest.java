/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

import static gov.sandia.cas.language.Operator.abs;
import static gov.sandia.cas.language.Operator.acos;
import static gov.sandia.cas.language.Operator.add;
import static gov.sandia.cas.language.Operator.asin;
import static gov.sandia.cas.language.Operator.atan;
import static gov.sandia.cas.language.Operator.cos;
import static gov.sandia.cas.language.Operator.divide;
import static gov.sandia.cas.language.Operator.exp;
import static gov.sandia.cas.language.Operator.log;
import static gov.sandia.cas.language.Operator.max;
import static gov.sandia.cas.language.Operator.min;
import static gov.sandia.cas.language.Operator.multiply;
import static gov.sandia.cas.language.Operator.negate;
import static gov.sandia.cas.language.Operator.pow;
import static gov.sandia.cas.language.Operator.sgn;
import static gov.sandia.cas.language.Operator.sin;
import static gov.sandia.cas.language.Operator.sqrt;
import static gov.sandia.cas.language.Operator.subtract;
import static gov.sandia.cas.language.Operator.tan;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

public class SimplifierTest {
    Variable x = Variable.lookupOrCreate("x");
    Variable y = Variable.lookupOrCreate("y");

    @Test
    public void testRules() {
        Object[] cases = {
            add(x, 0),                                  x,
            add(0, x),                                  x,
            add(x, negate(y)),                          subtract(x, y),
            subtract(x, 0),                             x,
            subtract(0, x),                             negate(x),
            subtract(multiply(x, y), multiply(x, y)),   Constant.ZERO,
            subtract(x, negate(y)),                     add(x, y),
            multiply(x, 0),                             Constant.ZERO,
            multiply(0, x),                             Constant.ZERO,
            multiply(x, 1),                             x,
            multiply(1, x),                             x,
            multiply(-1, x),                            negate(x),
            divide(x, 1),                               x,
            divide(x, -1),                              negate(x),
            divide(0, x),                               Constant.ZERO,
            pow(x, 0),                                  Constant.ONE,
            pow(x, 1),                                  x,
            pow(1, x),                                  Constant.ONE,
            negate(negate(x)),                          x,
            negate(Constant.INFINITY),                  Constant.NEGATIVE_INFINITY,
            max(x, x),                                  x,
            min(sin(x), sin(x)),                        sin(x),
            abs(negate(x)),                             abs(x),
            abs(abs(x)),                                abs(x),
            sgn(sgn(x)),                                sgn(x)
        };
        checkAll(cases);
    }

    @Test
    public void testFolding() {
        Object[] cases = {
            add(2, 3),                                  Constant.of(5),
            subtract(2, 3),                             Constant.MINUS_ONE,
            multiply(4, 0.5),                           Constant.TWO,
            divide(1, 4),                               Constant.of(0.25),
            pow(2, 10),                                 Constant.of(1024),
            pow(-8, 2),                                 Constant.of(64),
            negate(3),                                  Constant.of(-3),
            min(2, 3),                                  Constant.TWO,
            max(2, 3),                                  Constant.of(3),
            abs(-3),                                    Constant.of(3),
            abs(Constant.NEGATIVE_INFINITY),            Constant.INFINITY,
            sgn(-2),                                    Constant.MINUS_ONE,
            sgn(Constant.PI),                           Constant.ONE,
            add(multiply(2, 3), pow(x, subtract(2, 1))), add(Constant.of(6), x),

            // Left alone: symbolic constants, domain violations and transcendental functions.
            add(Constant.PI, 1),                        add(Constant.PI, 1),
            multiply(2, Constant.E),                    multiply(2, Constant.E),
            divide(1, 0),                               divide(1, 0),
            pow(0, -1),                                 pow(0, -1),
            pow(-8, 0.5),                               pow(-8, 0.5),
            sin(1),                                     sin(1),
            sqrt(2),                                    sqrt(2),
            log(2),                                     log(2)
        };
        checkAll(cases);
    }

    @Test
    public void testIdentities() {
        Object[] cases = {
            sin(0),                                     Constant.ZERO,
            sin(Constant.PI),                           Constant.ZERO,
            cos(0),                                     Constant.ONE,
            cos(Constant.PI),                           Constant.MINUS_ONE,
            tan(0),                                     Constant.ZERO,
            asin(0),                                    Constant.ZERO,
            asin(1),                                    divide(Constant.PI, 2),
            asin(-1),                                   negate(divide(Constant.PI, 2)),
            acos(1),                                    Constant.ZERO,
            acos(-1),                                   Constant.PI,
            atan(1),                                    divide(Constant.PI, 4),
            atan(Constant.INFINITY),                    divide(Constant.PI, 2),
            exp(0),                                     Constant.ONE,
            exp(1),                                     Constant.E,
            exp(Constant.NEGATIVE_INFINITY),            Constant.ZERO,
            log(1),                                     Constant.ZERO,
            log(Constant.E),                            Constant.ONE,
            sqrt(1),                                    Constant.ONE,
            sin(multiply(0, x)),                        Constant.ZERO,
            cos(subtract(x, x)),                        Constant.ONE,
            exp(log(subtract(Constant.E, 1))),          subtract(Constant.E, 1)
        };
        checkAll(cases);
    }

    @Test
    public void testInverseCancellation() {
        Object[] cases = {
            sin(asin(x)),                               x,
            asin(sin(x)),                               x,
            cos(acos(x)),                               x,
            acos(cos(x)),                               x,
            tan(atan(x)),                               x,
            atan(tan(x)),                               x,
            exp(log(x)),                                x,
            log(exp(x)),                                x,
            sin(asin(add(x, 0))),                       x,
            sin(acos(x)),                               sin(acos(x))
        };
        checkAll(cases);
    }

    void checkAll(Object[] cases) {
        for(int i = 0; i < cases.length; i += 2) {
            Operator e = (Operator) cases[i];
            String before = e.render();
            assertEquals(before, cases[i + 1], e.simplify());
        }
    }

    @Test
    public void testIdempotence() {
        Operator f = sqrt(add(add(pow(x, 2), multiply(sin(x), 2)), multiply(exp(x), 3)));
        Operator[] expressions = {
            f,
            f.diff(x),
            f.diff(x).diff(x),
            add(multiply(x, 1), multiply(0, y)),
            divide(subtract(multiply(y, 1), 0), pow(x, 1)),
            max(sin(x), cos(y)).diff(x),
            pow(x, y).diff(x)
        };
        for(Operator e : expressions) {
            Operator once  = e.simplify();
            Operator twice = once.deepCopy().simplify();
            assertEquals(once.render(), once, twice);
        }
    }

    @Test
    public void testValuePreserved() {
        Operator f = pow(add(x, 1), sin(multiply(x, y)));
        Operator d = f.diff(x);
        EvaluationContext context = new EvaluationContext().set(x, 0.8).set(y, 1.3);
        double expected = d.eval(context);
        assertEquals(expected, d.deepCopy().simplify().eval(context), 1e-12);
    }

    @Test
    public void testGuard() {
        try {
            new Simplifier(1).simplify(add(x, 0));
            fail("Guard did not trip");
        } catch(SimplificationException e) {
            assertEquals(1, e.iterations);
        }

        // Already at its fixed point, so one pass is enough.
        assertEquals(add(x, y), new Simplifier(1).simplify(add(x, y)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadCap() {
        new Simplifier(0);
    }

    @Test
    public void testDefaultCap() {
        assertEquals(Simplifier.DEFAULT_MAX_ITERATIONS, new Simplifier().maxIterations);
    }
}
