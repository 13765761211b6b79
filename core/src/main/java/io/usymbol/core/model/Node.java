package io.usymbol.core.model;

/**
 * Shared state of every interned expression: the owning store and the cached
 * structural hash.
 */
abstract sealed class Node implements Expression permits Symbol, Int, Rational, Add, Mul, Pow, Call {

    final InternStore store;
    private final int hash;

    Node(InternStore store, int hash) {
        this.store = store;
        this.hash = hash;
    }

    @Override
    public final boolean equals(Object obj) {
        return this == obj;
    }

    @Override
    public final int hashCode() {
        return hash;
    }
}
