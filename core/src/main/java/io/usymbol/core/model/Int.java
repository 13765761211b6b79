package io.usymbol.core.model;

import io.usymbol.core.number.BigRational;
import java.math.BigInteger;
import java.util.List;

/** An exact integer constant. */
public final class Int extends Node implements Numeric {

    private final BigInteger value;
    private final BigRational rational;

    Int(InternStore store, int hash, BigInteger value) {
        super(store, hash);
        this.value = value;
        this.rational = BigRational.of(value);
    }

    public BigInteger value() {
        return value;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isOne() {
        return value.equals(BigInteger.ONE);
    }

    @Override
    public BigRational toRational() {
        return rational;
    }

    @Override
    public Kind kind() {
        return Kind.INTEGER;
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitInteger(this);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
