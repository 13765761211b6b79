package io.usymbol.core.model;

/**
 * Variant discriminator of an {@link Expression}.
 *
 * <p>
 * The declaration order fixes the canonical ordering between kinds used by
 * {@link ExpressionOrder}: numbers sort first, then symbols, powers, products,
 * sums and function calls. {@link #INTEGER} and {@link #RATIONAL} share one rank
 * so all numeric constants are ordered by value alone.
 */
public enum Kind {
    INTEGER(0),
    RATIONAL(0),
    SYMBOL(1),
    POW(2),
    MUL(3),
    ADD(4),
    CALL(5);

    private final int rank;

    Kind(int rank) {
        this.rank = rank;
    }

    /** Position of this kind in the canonical order; lower sorts first. */
    public int rank() {
        return rank;
    }

    /** Returns {@code true} for {@link #INTEGER} and {@link #RATIONAL}. */
    public boolean isNumeric() {
        return rank == 0;
    }
}
