package io.usymbol.core.model;

import java.util.List;

/**
 * An immutable, canonical symbolic expression.
 *
 * <p>
 * The variant set is closed: {@link Symbol}, {@link Int}, {@link Rational},
 * {@link Add}, {@link Mul}, {@link Pow} and {@link Call}. Instances are only
 * created by an {@link InternStore}, which hands out one shared instance per
 * distinct structure. {@link #equals(Object)} is therefore identity and
 * {@link #hashCode()} a structural hash cached at construction.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Expression permits Node, Numeric {

    /** The variant discriminator. */
    Kind kind();

    /**
     * Direct sub-expressions, in canonical order for {@link Add}/{@link Mul},
     * {@code [base, exponent]} for {@link Pow}, argument order for {@link Call},
     * and empty for atoms.
     *
     * @return an unmodifiable list
     */
    List<Expression> children();

    /** Exhaustive dispatch over the variants. */
    <R> R accept(ExpressionVisitor<R> visitor);
}
