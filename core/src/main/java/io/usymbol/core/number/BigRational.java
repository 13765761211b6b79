package io.usymbol.core.number;

import io.usymbol.core.error.InvalidRationalException;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Exact rational number over {@link BigInteger}.
 *
 * <p>
 * Always stored reduced: {@code gcd(numerator, denominator) == 1} and
 * {@code denominator > 0}. Zero is {@code 0/1}.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class BigRational implements Comparable<BigRational> {

    public static final BigRational ZERO = new BigRational(BigInteger.ZERO, BigInteger.ONE);
    public static final BigRational ONE = new BigRational(BigInteger.ONE, BigInteger.ONE);
    public static final BigRational MINUS_ONE = new BigRational(BigInteger.ONE.negate(), BigInteger.ONE);

    private final BigInteger numerator;
    private final BigInteger denominator;

    private BigRational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ── Factory methods ──

    /** Returns the integer {@code value} as a rational. */
    public static BigRational of(BigInteger value) {
        Objects.requireNonNull(value, "value must not be null");
        return new BigRational(value, BigInteger.ONE);
    }

    /** Returns the integer {@code value} as a rational. */
    public static BigRational of(long value) {
        return of(BigInteger.valueOf(value));
    }

    /**
     * Returns {@code numerator / denominator} in lowest terms.
     *
     * @throws InvalidRationalException if {@code denominator} is zero
     */
    public static BigRational of(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "numerator must not be null");
        Objects.requireNonNull(denominator, "denominator must not be null");
        if (denominator.signum() == 0) {
            throw new InvalidRationalException("Denominator must not be zero: " + numerator + "/0");
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
        return new BigRational(numerator, denominator);
    }

    /** Returns {@code numerator / denominator} in lowest terms. */
    public static BigRational of(long numerator, long denominator) {
        return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    // ── Accessors ──

    public BigInteger numerator() {
        return numerator;
    }

    public BigInteger denominator() {
        return denominator;
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isOne() {
        return isInteger() && numerator.equals(BigInteger.ONE);
    }

    public int signum() {
        return numerator.signum();
    }

    // ── Arithmetic ──

    public BigRational add(BigRational other) {
        if (isZero()) return other;
        if (other.isZero()) return this;
        if (isInteger() && other.isInteger()) {
            return of(numerator.add(other.numerator));
        }
        return of(
                numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    public BigRational multiply(BigRational other) {
        if (isOne()) return other;
        if (other.isOne()) return this;
        if (isInteger() && other.isInteger()) {
            return of(numerator.multiply(other.numerator));
        }
        return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public BigRational negate() {
        return new BigRational(numerator.negate(), denominator);
    }

    /**
     * Returns {@code 1 / this}.
     *
     * @throws ArithmeticException if this is zero
     */
    public BigRational reciprocal() {
        if (isZero()) {
            throw new ArithmeticException("Reciprocal of zero");
        }
        return of(denominator, numerator);
    }

    /**
     * Raises this to an integer power. Negative exponents take the reciprocal first.
     *
     * @throws ArithmeticException if this is zero and {@code exponent} is negative
     */
    public BigRational pow(int exponent) {
        if (exponent == 0) {
            return ONE;
        }
        BigRational base = exponent < 0 ? reciprocal() : this;
        int magnitude = Math.abs(exponent);
        return new BigRational(base.numerator.pow(magnitude), base.denominator.pow(magnitude));
    }

    @Override
    public int compareTo(BigRational other) {
        if (denominator.equals(other.denominator)) {
            return numerator.compareTo(other.numerator);
        }
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BigRational that)) return false;
        return numerator.equals(that.numerator) && denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        return 31 * numerator.hashCode() + denominator.hashCode();
    }

    @Override
    public String toString() {
        return isInteger() ? numerator.toString() : numerator + "/" + denominator;
    }
}
