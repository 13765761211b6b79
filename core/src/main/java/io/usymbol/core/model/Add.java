package io.usymbol.core.model;

import java.util.List;

/**
 * A flat sum of at least two terms, sorted by {@link ExpressionOrder}, with like
 * terms already combined and no zero term.
 */
public final class Add extends Node {

    private final List<Expression> terms;

    Add(InternStore store, int hash, List<Expression> terms) {
        super(store, hash);
        this.terms = terms;
    }

    public List<Expression> terms() {
        return terms;
    }

    @Override
    public Kind kind() {
        return Kind.ADD;
    }

    @Override
    public List<Expression> children() {
        return terms;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAdd(this);
    }

    @Override
    public String toString() {
        return "Add" + terms;
    }
}
