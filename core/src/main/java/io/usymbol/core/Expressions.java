package io.usymbol.core;

import io.usymbol.core.engine.ExpressionContext;
import io.usymbol.core.model.Expression;
import io.usymbol.core.model.Int;
import io.usymbol.core.model.Numeric;
import io.usymbol.core.model.Symbol;
import java.math.BigInteger;
import java.util.Map;
import java.util.SortedSet;

/**
 * Static shortcuts over a process-wide default {@link ExpressionContext}.
 *
 * <p>
 * Convenient for scripts and tests; code that needs bounded memory or isolation
 * should create its own context instead.
 */
public final class Expressions {

    private static final ExpressionContext DEFAULT = new ExpressionContext();

    private Expressions() {}

    /** The process-wide context backing these shortcuts. */
    public static ExpressionContext context() {
        return DEFAULT;
    }

    public static Symbol symbol(String name) {
        return DEFAULT.symbol(name);
    }

    public static Int integer(long value) {
        return DEFAULT.integer(value);
    }

    public static Int integer(BigInteger value) {
        return DEFAULT.integer(value);
    }

    public static Numeric rational(long numerator, long denominator) {
        return DEFAULT.rational(numerator, denominator);
    }

    public static Numeric rational(BigInteger numerator, BigInteger denominator) {
        return DEFAULT.rational(numerator, denominator);
    }

    public static Expression add(Expression... terms) {
        return DEFAULT.add(terms);
    }

    public static Expression mul(Expression... factors) {
        return DEFAULT.mul(factors);
    }

    public static Expression pow(Expression base, Expression exponent) {
        return DEFAULT.pow(base, exponent);
    }

    public static Expression apply(String name, Expression... arguments) {
        return DEFAULT.apply(name, arguments);
    }

    public static int compare(Expression a, Expression b) {
        return DEFAULT.compare(a, b);
    }

    public static Expression substitute(Expression expression, Map<Symbol, ? extends Expression> mapping) {
        return DEFAULT.substitute(expression, mapping);
    }

    public static SortedSet<Symbol> freeSymbols(Expression expression) {
        return DEFAULT.freeSymbols(expression);
    }

    public static Iterable<Expression> visit(Expression expression) {
        return DEFAULT.visit(expression);
    }
}
