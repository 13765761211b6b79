package io.usymbol.core.model;

import java.util.List;

/** {@code base ^ exponent}. The exponent is never the integer zero or one. */
public final class Pow extends Node {

    private final Expression base;
    private final Expression exponent;
    private final List<Expression> children;

    Pow(InternStore store, int hash, Expression base, Expression exponent) {
        super(store, hash);
        this.base = base;
        this.exponent = exponent;
        this.children = List.of(base, exponent);
    }

    public Expression base() {
        return base;
    }

    public Expression exponent() {
        return exponent;
    }

    @Override
    public Kind kind() {
        return Kind.POW;
    }

    @Override
    public List<Expression> children() {
        return children;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPow(this);
    }

    @Override
    public String toString() {
        return "Pow[" + base + ", " + exponent + "]";
    }
}
