/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

/**
    A real number leaf. Immutable, so instances are freely shared between trees.
    A handful of frequently used values have canonical singletons; of(double) returns them
    in preference to a new object. Simplification rules match against these singletons
    by structural equality, which keeps identities such as sin(0)=0 exact.
**/
public class Constant extends Operator
{
    public final double value;
    public final String name;  // Display form for the symbolic constants (π, e, ∞). null for plain numbers.

    public static final Constant ZERO              = new Constant (0.0);
    public static final Constant ONE               = new Constant (1.0);
    public static final Constant TWO               = new Constant (2.0);
    public static final Constant MINUS_ONE         = new Constant (-1.0);
    public static final Constant PI                = new Constant (Math.PI,                  "π");
    public static final Constant E                 = new Constant (Math.E,                   "e");
    public static final Constant INFINITY          = new Constant (Double.POSITIVE_INFINITY, "∞");
    public static final Constant NEGATIVE_INFINITY = new Constant (Double.NEGATIVE_INFINITY, "-∞");

    public Constant (double value)
    {
        this (value, null);
    }

    protected Constant (double value, String name)
    {
        this.value = value;
        this.name  = name;
    }

    /**
        Canonicalization table. Returns the shared instance for 0, 1, 2, -1, π, e, +∞ and -∞,
        otherwise a new Constant. Note that -0.0 maps to ZERO.
    **/
    public static Constant of (double value)
    {
        if (value == 0                       ) return ZERO;
        if (value == 1                       ) return ONE;
        if (value == 2                       ) return TWO;
        if (value == -1                      ) return MINUS_ONE;
        if (value == Math.PI                 ) return PI;
        if (value == Math.E                  ) return E;
        if (value == Double.POSITIVE_INFINITY) return INFINITY;
        if (value == Double.NEGATIVE_INFINITY) return NEGATIVE_INFINITY;
        return new Constant (value);
    }

    /**
        Indicates one of the constants that are better left in symbolic form, such as π.
        Simplification does not fold arithmetic on these.
    **/
    public boolean isSymbolic ()
    {
        return Double.isInfinite (value)  ||  value == Math.PI  ||  value == Math.E;
    }

    public Kind kind ()
    {
        return Kind.CONSTANT;
    }

    public Operator deepCopy ()
    {
        return this;
    }

    public int precedence ()
    {
        if (value < 0) return 2;  // Same as unary minus, so that (-1)^x gets its parentheses.
        return 1;
    }

    public Associativity associativity ()
    {
        if (value < 0) return Associativity.RIGHT_TO_LEFT;
        return Associativity.LEFT_TO_RIGHT;
    }

    public Operator diff (Variable v)
    {
        return ZERO;
    }

    public double eval (EvaluationContext context)
    {
        return value;
    }

    public boolean isScalar ()
    {
        return true;
    }

    public double getDouble ()
    {
        return value;
    }

    public String toString ()
    {
        if (name != null) return name;
        return print (value);
    }

    /**
        Integers print without a fractional part. Everything else uses the shortest round-trip form.
    **/
    public static String print (double d)
    {
        if (d == Math.rint (d)  &&  Math.abs (d) < 1e15) return String.valueOf ((long) d);
        return String.valueOf (d);
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Constant)) return false;
        double v = ((Constant) that).value;
        return value == v  ||  Double.isNaN (value)  &&  Double.isNaN (v);
    }

    public int hashCode ()
    {
        if (value == 0) return 0;  // Folds -0.0 onto 0.0, consistent with equals().
        return Double.hashCode (value);
    }
}
