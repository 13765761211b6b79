package io.usymbol.core.model;

import io.usymbol.core.number.BigRational;

/** An exact numeric constant: either an {@link Int} or a non-integral {@link Rational}. */
public sealed interface Numeric extends Expression permits Int, Rational {

    /** The exact value of this constant. */
    BigRational toRational();

    default int signum() {
        return toRational().signum();
    }
}
