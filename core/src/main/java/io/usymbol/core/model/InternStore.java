package io.usymbol.core.model;

import io.usymbol.core.error.ForeignExpressionException;
import io.usymbol.core.number.BigRational;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntFunction;

/**
 * Hash-consing store: maps a structural key to the single shared instance of
 * that structure.
 *
 * <p>
 * A key is the variant tag, an optional atom (name or numeric value) and the
 * identities of the children. Children are interned before their parents, so
 * composing a key costs O(children) and never descends the tree.
 *
 * <p>
 * The store does not canonicalize. Callers hand it operands that already satisfy
 * the variant's invariants; the canonicalizer in
 * {@code io.usymbol.core.engine} is the only intended caller.
 *
 * <p>
 * Thread-safe: interning is atomic per key ({@link ConcurrentHashMap#computeIfAbsent}),
 * so concurrent construction of one structure yields one live instance. The
 * store never evicts.
 */
public final class InternStore {

    private final Map<Key, Node> nodes;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public InternStore(int initialCapacity) {
        this.nodes = new ConcurrentHashMap<>(initialCapacity);
    }

    // ── Atoms ──

    public Symbol symbol(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("symbol name must not be blank");
        }
        return intern(Kind.SYMBOL, name, List.of(), Symbol.class, hash -> new Symbol(this, hash, name));
    }

    /** Interns an integer or a non-integral rational, whichever {@code value} is. */
    public Numeric number(BigRational value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isInteger()) {
            return integer(value.numerator());
        }
        return intern(Kind.RATIONAL, value, List.of(), Rational.class, hash -> new Rational(this, hash, value));
    }

    public Int integer(BigInteger value) {
        Objects.requireNonNull(value, "value must not be null");
        return intern(Kind.INTEGER, value, List.of(), Int.class, hash -> new Int(this, hash, value));
    }

    // ── Composites ──

    /**
     * Interns a sum.
     *
     * @param terms at least two sorted, combined, non-zero terms owned by this store
     */
    public Add add(List<Expression> terms) {
        List<Expression> copy = ownedCopy(terms, 2, "Add");
        return intern(Kind.ADD, null, copy, Add.class, hash -> new Add(this, hash, copy));
    }

    /**
     * Interns a product.
     *
     * @param factors at least two sorted, combined factors owned by this store
     */
    public Mul mul(List<Expression> factors) {
        List<Expression> copy = ownedCopy(factors, 2, "Mul");
        return intern(Kind.MUL, null, copy, Mul.class, hash -> new Mul(this, hash, copy));
    }

    public Pow pow(Expression base, Expression exponent) {
        List<Expression> children = ownedCopy(List.of(base, exponent), 2, "Pow");
        return intern(Kind.POW, null, children, Pow.class, hash -> new Pow(this, hash, base, exponent));
    }

    public Call call(String name, List<Expression> arguments) {
        Objects.requireNonNull(name, "function name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("function name must not be blank");
        }
        List<Expression> copy = ownedCopy(arguments, 0, "Call");
        return intern(Kind.CALL, name, copy, Call.class, hash -> new Call(this, hash, name, copy));
    }

    // ── Ownership ──

    /** Returns {@code true} if {@code expression} was interned by this store. */
    public boolean owns(Expression expression) {
        return expression instanceof Node node && node.store == this;
    }

    /**
     * Returns {@code expression} if it was interned by this store.
     *
     * @throws ForeignExpressionException otherwise
     */
    public <T extends Expression> T requireOwned(T expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        if (!owns(expression)) {
            throw new ForeignExpressionException(
                    "Expression " + expression + " belongs to a different context and cannot be combined here");
        }
        return expression;
    }

    // ── Statistics ──

    /** Number of distinct nodes held. */
    public int size() {
        return nodes.size();
    }

    public InternStats stats() {
        return new InternStats(nodes.size(), hits.sum(), misses.sum());
    }

    private List<Expression> ownedCopy(List<Expression> children, int minSize, String variant) {
        Objects.requireNonNull(children, variant + " operands must not be null");
        if (children.size() < minSize) {
            throw new IllegalArgumentException(
                    variant + " requires at least " + minSize + " operands, got: " + children.size());
        }
        for (Expression child : children) {
            requireOwned(child);
        }
        return List.copyOf(children);
    }

    private <T extends Node> T intern(
            Kind kind, Object atom, List<Expression> children, Class<T> type, IntFunction<T> factory) {
        Key key = Key.of(kind, atom, children);
        Node existing = nodes.get(key);
        if (existing != null) {
            hits.increment();
            return type.cast(existing);
        }
        return type.cast(nodes.computeIfAbsent(key, k -> {
            misses.increment();
            return factory.apply(k.hash());
        }));
    }

    /**
     * Structural key. Children compare by identity through {@link Node#equals}; the
     * hash is derived from stable values only so it is reproducible across runs.
     */
    private record Key(Kind kind, Object atom, List<Expression> children, int hash) {

        static Key of(Kind kind, Object atom, List<Expression> children) {
            int h = kind.ordinal() + 1;
            h = 31 * h + (atom != null ? atom.hashCode() : 0);
            for (Expression child : children) {
                h = 31 * h + child.hashCode();
            }
            return new Key(kind, atom, children, h);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
