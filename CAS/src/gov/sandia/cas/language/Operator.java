/*
Copyright 2013-2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.cas.language;

import gov.sandia.cas.language.function.AbsoluteValue;
import gov.sandia.cas.language.function.Acos;
import gov.sandia.cas.language.function.Asin;
import gov.sandia.cas.language.function.Atan;
import gov.sandia.cas.language.function.Cosine;
import gov.sandia.cas.language.function.Exp;
import gov.sandia.cas.language.function.Log;
import gov.sandia.cas.language.function.Max;
import gov.sandia.cas.language.function.Min;
import gov.sandia.cas.language.function.Signum;
import gov.sandia.cas.language.function.Sine;
import gov.sandia.cas.language.function.SquareRoot;
import gov.sandia.cas.language.function.Tangent;
import gov.sandia.cas.language.operator.Add;
import gov.sandia.cas.language.operator.Divide;
import gov.sandia.cas.language.operator.Multiply;
import gov.sandia.cas.language.operator.Negate;
import gov.sandia.cas.language.operator.Power;
import gov.sandia.cas.language.operator.Subtract;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;

/**
    Base class of the expression tree. Every node, leaf or composite, can differentiate itself,
    evaluate itself against a set of variable bindings, substitute subtrees, simplify itself
    and render itself as text.

    Equality is structural: two trees are equal when they have the same operator kinds and
    equal children in the same positions. Commutativity is never taken into account, so a+b
    and b+a are different trees.
**/
public abstract class Operator implements Cloneable
{
    /**
        Tag for each concrete node type. Rule tables (such as inverse-function cancellation)
        are keyed on this rather than on the Java class.
    **/
    public enum Kind
    {
        CONSTANT,
        VARIABLE,
        ADD,
        SUBTRACT,
        MULTIPLY,
        DIVIDE,
        POWER,
        NEGATE,
        SQRT,
        EXP,
        LOG,
        SIN,
        COS,
        TAN,
        ASIN,
        ACOS,
        ATAN,
        ABS,
        SIGN,
        MIN,
        MAX
    }

    public interface Factory
    {
        public String   name ();  ///< Unique string for searching in the table of registered operators.
        public Operator createInstance ();
    }

    public enum Associativity
    {
        LEFT_TO_RIGHT,
        RIGHT_TO_LEFT
    }

    public abstract Kind kind ();

    /**
        Composites return a copy of their whole subtree. Leaves are immutable, so they return themselves.
    **/
    public Operator deepCopy ()
    {
        try
        {
            return (Operator) clone ();
        }
        catch (CloneNotSupportedException e)
        {
            throw new IllegalStateException (e);
        }
    }

    /**
        Assigns the children of a node produced by a Factory.
        @throws InvalidOperandException if the count is wrong for this operator or an operand can't be coerced.
    **/
    public void setOperands (Object... operands)
    {
        if (operands.length != 0) throw new InvalidOperandException (this + " takes no operands");
    }

    public Associativity associativity ()
    {
        return Associativity.LEFT_TO_RIGHT;
    }

    public int precedence ()
    {
        return 1;
    }

    public void visit (Visitor visitor)
    {
        visitor.visit (this);
    }

    /**
        Symbolic derivative with respect to v. The result is a new tree that shares no composite
        nodes with this one.
    **/
    public abstract Operator diff (Variable v);

    /**
        @return true if v occurs anywhere in this subtree.
    **/
    public boolean dependsOn (Variable v)
    {
        return false;
    }

    public abstract double eval (EvaluationContext context) throws EvaluationException;

    /**
        Convenience form of eval(EvaluationContext).
        @param values Keyed by Variable or by variable name.
    **/
    public double eval (Map<?,? extends Number> values) throws EvaluationException
    {
        return eval (new EvaluationContext (values));
    }

    /**
        Replaces every subtree that is structurally equal to a key in the table with the corresponding value.
        Matching is exact: no pattern variables or unification. When a node matches, it is replaced wholesale
        and substitution does not look inside the replacement. Otherwise substitution recurses into the children.
        Works on a copy of this tree, so the receiver is left unchanged, and a subtree that appears
        at several places is substituted once at each place.
        @param table Keys and values are each either an Operator or a Number. Numbers become Constants.
        @return The rewritten tree.
        @throws InvalidSubstitutionException if a key or value is neither an Operator nor a Number.
    **/
    public Operator subs (Map<?,?> table)
    {
        Map<Operator,Operator> normalized = new HashMap<Operator,Operator> ();
        for (Entry<?,?> e : table.entrySet ())
        {
            Object key   = e.getKey ();
            Object value = e.getValue ();
            if (! (key instanceof Operator  ||  key instanceof Number))
            {
                throw new InvalidSubstitutionException ("Impossible substitution. Key is " + describe (key));
            }
            if (! (value instanceof Operator  ||  value instanceof Number))
            {
                throw new InvalidSubstitutionException ("Impossible substitution. Received " + describe (value) + " for " + key);
            }
            normalized.put (coerce (key), coerce (value));
        }
        return replace (deepCopy (), normalized);
    }

    /**
        Recursive step of subs(Map). Composite nodes are rebound in place.
        Leaves have no children, so there is nothing to do.
    **/
    public Operator substitute (Map<Operator,Operator> table)
    {
        return this;
    }

    /**
        Utility routine for substitute(Map). Returns a copy of the replacement if child matches a key,
        or else the result of substituting within child.
    **/
    protected static Operator replace (Operator child, Map<Operator,Operator> table)
    {
        Operator replacement = table.get (child);
        if (replacement != null) return replacement.deepCopy ();
        return child.substitute (table);
    }

    /**
        Reduces this tree to a fixed point, using the process-wide default iteration cap.
        Composite nodes are rewritten in place, so the caller should use the returned tree
        and not assume the receiver is still meaningful.
    **/
    public Operator simplify ()
    {
        return new Simplifier ().simplify (this);
    }

    /**
        One outer pass of simplification: bring each child to its own fixed point, then apply
        the rewrite rules of this operator once.
        @return Either this node (possibly with rebound children) or a replacement for it.
    **/
    public Operator simplify (Simplifier simplifier)
    {
        return this;
    }

    /**
        Indicates that when all operands are constant, this node may be replaced by a constant
        during simplification. Transcendental functions say no, so that exact forms like sin(1) are kept.
    **/
    public boolean canBeConstant ()
    {
        return false;
    }

    /**
        @return The variables that occur in this tree, in the order they are first reached
        by a depth-first walk, without duplicates.
    **/
    public Set<Variable> freeVariables ()
    {
        final Set<Variable> result = new LinkedHashSet<Variable> ();
        visit (new Visitor ()
        {
            public boolean visit (Operator op)
            {
                if (op instanceof Variable) result.add ((Variable) op);
                return true;
            }
        });
        return result;
    }

    /**
        Text form of the whole tree. Also serves as the canonical key that tells the Simplifier
        when a rewrite has stopped changing anything.
    **/
    public String render ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (toString ());
    }

    /**
        Determines if this is a constant without evaluating.
    **/
    public boolean isScalar ()
    {
        return false;
    }

    /**
        Extracts the value of a constant without using eval().
        If this is not a constant, then return 0.
    **/
    public double getDouble ()
    {
        return 0;
    }

    /**
        The label of this node alone, not including its operands. Use render() for the whole tree.
    **/
    public String toString ()
    {
        return "unknown";
    }

    protected static String describe (Object o)
    {
        if (o == null) return "null";
        return o.getClass ().getSimpleName () + " = " + o;
    }


    // Static interface ------------------------------------------------------

    protected static TreeMap<String,Factory> operators = new TreeMap<String,Factory> ();

    protected static void register (Factory f)
    {
        operators.put (f.name (), f);
    }

    /**
        @return Read-only view of the names accepted by create(), in sorted order.
    **/
    public static SortedSet<String> names ()
    {
        return Collections.unmodifiableSortedSet (operators.navigableKeySet ());
    }

    static
    {
        // Functions
        register (AbsoluteValue.factory ());
        register (Acos         .factory ());
        register (Asin         .factory ());
        register (Atan         .factory ());
        register (Cosine       .factory ());
        register (Exp          .factory ());
        register (Log          .factory ());
        register (Max          .factory ());
        register (Min          .factory ());
        register (Signum       .factory ());
        register (Sine         .factory ());
        register (SquareRoot   .factory ());
        register (Tangent      .factory ());
        operators.put ("pow", Power.factory ());  // pow(a,b) is the same node as a^b

        // Operators
        register (Add     .factory ());
        register (Divide  .factory ());
        register (Multiply.factory ());
        register (Negate  .factory ());
        register (Power   .factory ());
        register (Subtract.factory ());
    }

    /**
        Builds a node from its registered name, for example create ("sin", x) or create ("+", x, 1).
        @throws InvalidOperandException if the name is unknown, the operand count is wrong,
        or an operand is neither an Operator nor a Number.
    **/
    public static Operator create (String name, Object... operands)
    {
        Factory f = operators.get (name);
        if (f == null) throw new InvalidOperandException ("Unknown operator: " + name);
        Operator result = f.createInstance ();
        result.setOperands (operands);
        return result;
    }

    /**
        Wraps a raw number as a (canonical) Constant. Operators pass through unchanged.
        @throws InvalidOperandException for anything else.
    **/
    public static Operator coerce (Object operand)
    {
        if (operand instanceof Operator) return (Operator) operand;
        if (operand instanceof Number  ) return Constant.of (((Number) operand).doubleValue ());
        throw new InvalidOperandException ("Operand must be an Operator or a Number. Received " + describe (operand));
    }

    // Combinators. Each operand may be an Operator or a Number.

    public static Variable variable (String name)
    {
        return Variable.lookupOrCreate (name);
    }

    public static Constant constant (double value)
    {
        return Constant.of (value);
    }

    public static Operator add      (Object a, Object b) {return new Add      (a, b);}
    public static Operator subtract (Object a, Object b) {return new Subtract (a, b);}
    public static Operator multiply (Object a, Object b) {return new Multiply (a, b);}
    public static Operator divide   (Object a, Object b) {return new Divide   (a, b);}
    public static Operator pow      (Object a, Object b) {return new Power    (a, b);}
    public static Operator min      (Object a, Object b) {return new Min      (a, b);}
    public static Operator max      (Object a, Object b) {return new Max      (a, b);}
    public static Operator negate   (Object a)           {return new Negate        (a);}
    public static Operator sqrt     (Object a)           {return new SquareRoot    (a);}
    public static Operator exp      (Object a)           {return new Exp           (a);}
    public static Operator log      (Object a)           {return new Log           (a);}
    public static Operator sin      (Object a)           {return new Sine          (a);}
    public static Operator cos      (Object a)           {return new Cosine        (a);}
    public static Operator tan      (Object a)           {return new Tangent       (a);}
    public static Operator asin     (Object a)           {return new Asin          (a);}
    public static Operator acos     (Object a)           {return new Acos          (a);}
    public static Operator atan     (Object a)           {return new Atan          (a);}
    public static Operator abs      (Object a)           {return new AbsoluteValue (a);}
    public static Operator sgn      (Object a)           {return new Signum        (a);}
}
