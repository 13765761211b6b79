package io.usymbol.core.engine;

import io.usymbol.core.config.ContextOptions;
import io.usymbol.core.error.UndefinedExpressionException;
import io.usymbol.core.model.Add;
import io.usymbol.core.model.Expression;
import io.usymbol.core.model.ExpressionOrder;
import io.usymbol.core.model.Int;
import io.usymbol.core.model.InternStore;
import io.usymbol.core.model.Mul;
import io.usymbol.core.model.Numeric;
import io.usymbol.core.model.Pow;
import io.usymbol.core.model.Symbol;
import io.usymbol.core.number.BigRational;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonicalizing constructors. Every expression handed out by an
 * {@link ExpressionContext} is built here and interned in the context's
 * {@link InternStore}.
 *
 * <p>
 * Inputs must be canonical expressions of the same store; the rules are
 * compositional, so building bottom-up through these methods is enough to keep
 * every node canonical:
 * <ul>
 * <li><b>add</b>: flatten, combine like terms by summing numeric coefficients,
 * fold constants, drop zeros, sort</li>
 * <li><b>mul</b>: flatten, fold numeric factors into one coefficient,
 * short-circuit on zero, combine like bases by summing exponents, drop ones,
 * sort</li>
 * <li><b>pow</b>: {@code x^0 = 1}, {@code x^1 = x}, {@code 0^n = 0} for
 * positive {@code n}, {@code 1^x = 1}, exact folding of
 * {@code number^integer}, {@code (b^e)^n = b^(e*n)} and
 * {@code (a*b)^n = a^n * b^n} for integer {@code n}</li>
 * <li><b>call</b>: interned as is</li>
 * </ul>
 * The result never depends on operand order.
 *
 * <p>
 * Thread-safe: stateless apart from the concurrent store.
 */
public final class Canonicalizer {

    private final InternStore store;
    private final int maxFoldedExponent;
    private final Int zero;
    private final Int one;

    public Canonicalizer(InternStore store, ContextOptions options) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.maxFoldedExponent = Objects.requireNonNull(options, "options must not be null").maxFoldedExponent();
        this.zero = store.integer(BigInteger.ZERO);
        this.one = store.integer(BigInteger.ONE);
    }

    InternStore store() {
        return store;
    }

    // ── Atoms ──

    public Symbol symbol(String name) {
        return store.symbol(name);
    }

    public Int integer(BigInteger value) {
        return store.integer(value);
    }

    public Numeric number(BigRational value) {
        return store.number(value);
    }

    // ── Sums ──

    public Expression add(List<? extends Expression> terms) {
        Objects.requireNonNull(terms, "terms must not be null");
        BigRational[] constant = {BigRational.ZERO};
        Map<Expression, BigRational> coefficients = new LinkedHashMap<>();
        for (Expression term : terms) {
            collectTerm(store.requireOwned(term), constant, coefficients);
        }

        List<Expression> result = new ArrayList<>(coefficients.size() + 1);
        if (!constant[0].isZero()) {
            result.add(store.number(constant[0]));
        }
        for (Map.Entry<Expression, BigRational> entry : coefficients.entrySet()) {
            BigRational coefficient = entry.getValue();
            if (coefficient.isZero()) {
                continue;
            }
            result.add(
                    coefficient.isOne() ? entry.getKey() : mul(List.of(store.number(coefficient), entry.getKey())));
        }
        return finish(result, zero, true);
    }

    private void collectTerm(Expression term, BigRational[] constant, Map<Expression, BigRational> coefficients) {
        if (term instanceof Add sum) {
            for (Expression nested : sum.terms()) {
                collectTerm(nested, constant, coefficients);
            }
        } else if (term instanceof Numeric number) {
            constant[0] = constant[0].add(number.toRational());
        } else if (term instanceof Mul product && product.factors().get(0) instanceof Numeric coefficient) {
            coefficients.merge(restOf(product), coefficient.toRational(), BigRational::add);
        } else {
            coefficients.merge(term, BigRational.ONE, BigRational::add);
        }
    }

    /** The product without its leading numeric coefficient. */
    private Expression restOf(Mul product) {
        List<Expression> factors = product.factors();
        if (factors.size() == 2) {
            return factors.get(1);
        }
        return store.mul(factors.subList(1, factors.size()));
    }

    // ── Products ──

    public Expression mul(List<? extends Expression> factors) {
        Objects.requireNonNull(factors, "factors must not be null");
        List<Expression> flat = new ArrayList<>(factors.size());
        for (Expression factor : factors) {
            flattenFactor(store.requireOwned(factor), flat);
        }

        List<BigRational> numbers = new ArrayList<>();
        Map<Expression, List<Expression>> exponentsByBase = new LinkedHashMap<>();
        for (Expression factor : flat) {
            if (factor instanceof Numeric number) {
                if (number.signum() == 0) {
                    return zero;
                }
                numbers.add(number.toRational());
            } else if (factor instanceof Pow power) {
                exponentsByBase.computeIfAbsent(power.base(), k -> new ArrayList<>()).add(power.exponent());
            } else {
                exponentsByBase.computeIfAbsent(factor, k -> new ArrayList<>()).add(one);
            }
        }

        BigRational coefficient = BigRational.ONE;
        for (BigRational number : numbers) {
            if (!mergeIntoIntegerPower(number, exponentsByBase)) {
                coefficient = coefficient.multiply(number);
            }
        }

        List<Expression> rebuilt = new ArrayList<>(exponentsByBase.size() + 1);
        boolean regroup = false;
        for (Map.Entry<Expression, List<Expression>> entry : exponentsByBase.entrySet()) {
            Expression base = entry.getKey();
            List<Expression> exponents = entry.getValue();
            Expression factor = exponents.size() == 1 && exponents.get(0) == one
                    ? base
                    : pow(base, exponents.size() == 1 ? exponents.get(0) : add(exponents));
            if (factor instanceof Numeric number) {
                coefficient = coefficient.multiply(number.toRational());
            } else {
                rebuilt.add(factor);
                // A combined power can expose a product or a different base that must merge with the others.
                regroup |= factor instanceof Mul || baseOf(factor) != base;
            }
        }
        if (coefficient.isZero()) {
            return zero;
        }

        if (regroup) {
            rebuilt.add(store.number(coefficient));
            return mul(rebuilt);
        }
        if (!coefficient.isOne()) {
            rebuilt.add(store.number(coefficient));
        }
        return finish(rebuilt, one, false);
    }

    /**
     * Adds {@code number} as {@code base^1} or {@code base^-1} to the group of a
     * numeric base left unfolded above {@code maxFoldedExponent}, so that
     * {@code 2^9 * 2} and {@code 2^10} meet in the same power.
     */
    private boolean mergeIntoIntegerPower(BigRational number, Map<Expression, List<Expression>> exponentsByBase) {
        for (Map.Entry<Expression, List<Expression>> entry : exponentsByBase.entrySet()) {
            if (!(entry.getKey() instanceof Numeric base) || !hasIntegerExponent(entry.getValue())) {
                continue;
            }
            BigRational value = base.toRational();
            if (value.equals(number)) {
                entry.getValue().add(one);
                return true;
            }
            if (value.multiply(number).isOne()) {
                entry.getValue().add(store.integer(BigInteger.ONE.negate()));
                return true;
            }
        }
        return false;
    }

    private static boolean hasIntegerExponent(List<Expression> exponents) {
        for (Expression exponent : exponents) {
            if (exponent instanceof Int) {
                return true;
            }
        }
        return false;
    }

    private static void flattenFactor(Expression factor, List<Expression> out) {
        if (factor instanceof Mul product) {
            out.addAll(product.factors());
        } else {
            out.add(factor);
        }
    }

    private static Expression baseOf(Expression factor) {
        return factor instanceof Pow power ? power.base() : factor;
    }

    // ── Powers ──

    /**
     * Canonical {@code base ^ exponent}.
     *
     * @throws UndefinedExpressionException for {@code 0^0} and {@code 0^n} with negative {@code n}
     */
    public Expression pow(Expression base, Expression exponent) {
        store.requireOwned(base);
        store.requireOwned(exponent);

        if (exponent instanceof Numeric power) {
            BigRational value = power.toRational();
            if (value.isZero()) {
                if (isZero(base)) {
                    throw new UndefinedExpressionException("0^0 is undefined");
                }
                return one;
            }
            if (value.isOne()) {
                return base;
            }
            if (isZero(base)) {
                if (value.signum() > 0) {
                    return zero;
                }
                throw new UndefinedExpressionException("0^" + value + " is undefined");
            }
        }
        if (base == one) {
            return one;
        }
        if (exponent instanceof Int integer) {
            if (base instanceof Numeric number && isFoldable(integer)) {
                return store.number(number.toRational().pow(integer.value().intValueExact()));
            }
            if (base instanceof Pow inner) {
                return pow(inner.base(), mul(List.of(inner.exponent(), integer)));
            }
            if (base instanceof Mul product) {
                List<Expression> distributed = new ArrayList<>(product.factors().size());
                for (Expression factor : product.factors()) {
                    distributed.add(pow(factor, integer));
                }
                return mul(distributed);
            }
        }
        return store.pow(base, exponent);
    }

    private boolean isFoldable(Int exponent) {
        return exponent.value().abs().compareTo(BigInteger.valueOf(maxFoldedExponent)) <= 0;
    }

    private boolean isZero(Expression expression) {
        return expression == zero;
    }

    // ── Calls ──

    public Expression call(String name, List<? extends Expression> arguments) {
        Objects.requireNonNull(arguments, "arguments must not be null");
        return store.call(name, List.copyOf(arguments));
    }

    // ── Shared ──

    private Expression finish(List<Expression> operands, Int identity, boolean sum) {
        if (operands.isEmpty()) {
            return identity;
        }
        if (operands.size() == 1) {
            return operands.get(0);
        }
        operands.sort(ExpressionOrder.INSTANCE);
        return sum ? store.add(operands) : store.mul(operands);
    }
}
