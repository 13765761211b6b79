package io.usymbol.core.model;

import java.util.List;

/**
 * A flat product of at least two factors, sorted by {@link ExpressionOrder}. A
 * numeric coefficient, when present, is the first factor. No factor is zero or
 * one, and no two factors share a base.
 */
public final class Mul extends Node {

    private final List<Expression> factors;

    Mul(InternStore store, int hash, List<Expression> factors) {
        super(store, hash);
        this.factors = factors;
    }

    public List<Expression> factors() {
        return factors;
    }

    @Override
    public Kind kind() {
        return Kind.MUL;
    }

    @Override
    public List<Expression> children() {
        return factors;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitMul(this);
    }

    @Override
    public String toString() {
        return "Mul" + factors;
    }
}
