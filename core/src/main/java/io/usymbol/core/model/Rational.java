package io.usymbol.core.model;

import io.usymbol.core.number.BigRational;
import java.math.BigInteger;
import java.util.List;

/**
 * An exact non-integral rational constant. The denominator is always greater than
 * one; integral values are represented by {@link Int}.
 */
public final class Rational extends Node implements Numeric {

    private final BigRational value;

    Rational(InternStore store, int hash, BigRational value) {
        super(store, hash);
        this.value = value;
    }

    public BigInteger numerator() {
        return value.numerator();
    }

    public BigInteger denominator() {
        return value.denominator();
    }

    @Override
    public BigRational toRational() {
        return value;
    }

    @Override
    public Kind kind() {
        return Kind.RATIONAL;
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitRational(this);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
