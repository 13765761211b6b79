package io.usymbol.core.model;

import java.util.List;

/** An opaque atomic identifier. Two symbols of one context are the same instance iff their names are equal. */
public final class Symbol extends Node {

    private final String name;

    Symbol(InternStore store, int hash, String name) {
        super(store, hash);
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public Kind kind() {
        return Kind.SYMBOL;
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSymbol(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
