/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

import gov.sandia.cas.language.operator.Divide;
import gov.sandia.cas.language.operator.Negate;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
    A named function of one argument, rendered as name(arg). Besides constant folding, simplification
    uses two tables keyed by operator kind: exact values at canonical constants (such as cos(0)=1),
    and structural inverse pairs (such as sin(asin(x))=x).
**/
public abstract class Function extends OperatorUnary
{
    public Function ()
    {
    }

    public Function (Object operand)
    {
        super (operand);
    }

    public boolean canBeConstant ()
    {
        return false;
    }

    public Operator simplify (Simplifier simplifier)
    {
        Operator result = super.simplify (simplifier);
        if (result != this) return result;

        // f(g(x)) --> x, where g is the inverse of f
        if (operand instanceof Function  &&  Identities.inverse.get (kind ()) == operand.kind ())
        {
            return ((Function) operand).operand;
        }

        if (operand instanceof Constant)
        {
            Map<Constant,Operator> table = Identities.values.get (kind ());
            if (table != null)
            {
                Operator value = table.get (operand);
                if (value != null) return value.deepCopy ();
            }
        }
        return this;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (toString ());
        renderer.result.append ("(");
        operand.render (renderer);
        renderer.result.append (")");
    }

    /**
        Rule tables, built once on first use. Kept in a holder class so that they are not
        constructed while Operator and Constant are still being initialized.
    **/
    protected static class Identities
    {
        public static final Map<Kind,Kind>                   inverse;
        public static final Map<Kind,Map<Constant,Operator>> values;

        static
        {
            EnumMap<Kind,Kind> inv = new EnumMap<Kind,Kind> (Kind.class);
            pair (inv, Kind.SIN, Kind.ASIN);
            pair (inv, Kind.COS, Kind.ACOS);
            pair (inv, Kind.TAN, Kind.ATAN);
            pair (inv, Kind.EXP, Kind.LOG);
            inverse = Collections.unmodifiableMap (inv);

            Operator halfPi    = new Divide (Constant.PI, Constant.TWO);
            Operator quarterPi = new Divide (Constant.PI, Constant.of (4));

            EnumMap<Kind,Map<Constant,Operator>> v = new EnumMap<Kind,Map<Constant,Operator>> (Kind.class);
            put (v, Kind.SIN,  Constant.ZERO,              Constant.ZERO);
            put (v, Kind.SIN,  Constant.PI,                Constant.ZERO);
            put (v, Kind.COS,  Constant.ZERO,              Constant.ONE);
            put (v, Kind.COS,  Constant.PI,                Constant.MINUS_ONE);
            put (v, Kind.TAN,  Constant.ZERO,              Constant.ZERO);
            put (v, Kind.TAN,  Constant.PI,                Constant.ZERO);
            put (v, Kind.ASIN, Constant.ZERO,              Constant.ZERO);
            put (v, Kind.ASIN, Constant.ONE,               halfPi);
            put (v, Kind.ASIN, Constant.MINUS_ONE,         new Negate (halfPi));
            put (v, Kind.ACOS, Constant.ONE,               Constant.ZERO);
            put (v, Kind.ACOS, Constant.ZERO,              halfPi);
            put (v, Kind.ACOS, Constant.MINUS_ONE,         Constant.PI);
            put (v, Kind.ATAN, Constant.ZERO,              Constant.ZERO);
            put (v, Kind.ATAN, Constant.ONE,               quarterPi);
            put (v, Kind.ATAN, Constant.MINUS_ONE,         new Negate (quarterPi));
            put (v, Kind.ATAN, Constant.INFINITY,          halfPi);
            put (v, Kind.ATAN, Constant.NEGATIVE_INFINITY, new Negate (halfPi));
            put (v, Kind.EXP,  Constant.ZERO,              Constant.ONE);
            put (v, Kind.EXP,  Constant.ONE,               Constant.E);
            put (v, Kind.EXP,  Constant.INFINITY,          Constant.INFINITY);
            put (v, Kind.EXP,  Constant.NEGATIVE_INFINITY, Constant.ZERO);
            put (v, Kind.LOG,  Constant.ONE,               Constant.ZERO);
            put (v, Kind.LOG,  Constant.E,                 Constant.ONE);
            put (v, Kind.LOG,  Constant.INFINITY,          Constant.INFINITY);
            put (v, Kind.SQRT, Constant.ZERO,              Constant.ZERO);
            put (v, Kind.SQRT, Constant.ONE,               Constant.ONE);
            put (v, Kind.SQRT, Constant.INFINITY,          Constant.INFINITY);
            for (Kind k : v.keySet ()) v.put (k, Collections.unmodifiableMap (v.get (k)));
            values = Collections.unmodifiableMap (v);
        }

        protected static void pair (Map<Kind,Kind> map, Kind a, Kind b)
        {
            map.put (a, b);
            map.put (b, a);
        }

        /// Entries are prototypes. Users of the table must deepCopy() the value.
        protected static void put (Map<Kind,Map<Constant,Operator>> map, Kind kind, Constant argument, Operator value)
        {
            Map<Constant,Operator> table = map.get (kind);
            if (table == null)
            {
                table = new HashMap<Constant,Operator> ();
                map.put (kind, table);
            }
            table.put (argument, value);
        }
    }
}
