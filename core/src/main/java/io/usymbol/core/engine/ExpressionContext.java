package io.usymbol.core.engine;

import io.usymbol.core.config.ContextOptions;
import io.usymbol.core.config.OptionsLoader;
import io.usymbol.core.model.Expression;
import io.usymbol.core.model.ExpressionOrder;
import io.usymbol.core.model.Int;
import io.usymbol.core.model.InternStats;
import io.usymbol.core.model.InternStore;
import io.usymbol.core.model.Numeric;
import io.usymbol.core.model.Symbol;
import io.usymbol.core.number.BigRational;
import io.usymbol.core.spi.CompiledExpression;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped expression factory: the public entry point for building, comparing and
 * rewriting expressions.
 *
 * <p>
 * Each context owns one {@link InternStore}. Within a context, expressions that
 * are equal under the canonicalization rules are the same instance, so
 * {@code a.equals(b)} is {@code a == b}. Expressions of different contexts never
 * mix: combining them raises
 * {@link io.usymbol.core.error.ForeignExpressionException}.
 *
 * <p>
 * Thread-safe: the store is swapped atomically by {@link #clear()}; in-flight
 * constructions finish against the generation they started with.
 */
public final class ExpressionContext {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionContext.class);

    private final ContextOptions options;
    private final AtomicReference<Generation> generation;

    /** Store and canonicalizer of one lifetime of this context. */
    private record Generation(InternStore store, Canonicalizer canonicalizer) {

        static Generation create(ContextOptions options) {
            InternStore store = new InternStore(options.initialCapacity());
            return new Generation(store, new Canonicalizer(store, options));
        }
    }

    /** Creates a context with {@link ContextOptions#DEFAULT}. */
    public ExpressionContext() {
        this(ContextOptions.DEFAULT);
    }

    public ExpressionContext(ContextOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.generation = new AtomicReference<>(Generation.create(options));
        LOG.debug("Expression context created: {}", options);
    }

    /**
     * Creates a context from a YAML options file (see {@link OptionsLoader}).
     *
     * @throws io.usymbol.core.config.OptionsLoadException if the file cannot be loaded
     */
    public static ExpressionContext fromOptionsFile(Path path) {
        return new ExpressionContext(OptionsLoader.load(path));
    }

    public ContextOptions options() {
        return options;
    }

    private Canonicalizer canonicalizer() {
        return generation.get().canonicalizer();
    }

    // ── Construction ──

    public Symbol symbol(String name) {
        return canonicalizer().symbol(name);
    }

    /** Creates one symbol per name, in order. */
    public List<Symbol> symbols(String... names) {
        List<Symbol> result = new ArrayList<>(names.length);
        for (String name : names) {
            result.add(symbol(name));
        }
        return result;
    }

    public Int integer(long value) {
        return integer(BigInteger.valueOf(value));
    }

    public Int integer(BigInteger value) {
        return canonicalizer().integer(value);
    }

    /**
     * Exact rational {@code numerator / denominator}; an {@code Int} when the
     * quotient is integral.
     *
     * @throws io.usymbol.core.error.InvalidRationalException if {@code denominator} is zero
     */
    public Numeric rational(long numerator, long denominator) {
        return number(BigRational.of(numerator, denominator));
    }

    /**
     * @throws io.usymbol.core.error.InvalidRationalException if {@code denominator} is zero
     */
    public Numeric rational(BigInteger numerator, BigInteger denominator) {
        return number(BigRational.of(numerator, denominator));
    }

    public Numeric number(BigRational value) {
        return canonicalizer().number(value);
    }

    public Expression add(Expression... terms) {
        return add(List.of(terms));
    }

    public Expression add(List<? extends Expression> terms) {
        return canonicalizer().add(terms);
    }

    public Expression mul(Expression... factors) {
        return mul(List.of(factors));
    }

    public Expression mul(List<? extends Expression> factors) {
        return canonicalizer().mul(factors);
    }

    /**
     * @throws io.usymbol.core.error.UndefinedExpressionException for {@code 0^0} and
     *     {@code 0^n} with negative {@code n}
     */
    public Expression pow(Expression base, Expression exponent) {
        return canonicalizer().pow(base, exponent);
    }

    /** Application of the uninterpreted function {@code name}. */
    public Expression apply(String name, Expression... arguments) {
        return apply(name, List.of(arguments));
    }

    public Expression apply(String name, List<? extends Expression> arguments) {
        return canonicalizer().call(name, arguments);
    }

    /** {@code -1 * expression}. */
    public Expression neg(Expression expression) {
        return mul(integer(-1), expression);
    }

    /** {@code minuend + (-1 * subtrahend)}. */
    public Expression sub(Expression minuend, Expression subtrahend) {
        return add(minuend, neg(subtrahend));
    }

    /**
     * {@code dividend * divisor^-1}.
     *
     * @throws io.usymbol.core.error.UndefinedExpressionException if {@code divisor} is zero
     */
    public Expression div(Expression dividend, Expression divisor) {
        return mul(dividend, pow(divisor, integer(-1)));
    }

    // ── Structural operations ──

    /** Canonical total order; {@code 0} iff {@code a == b}. */
    public int compare(Expression a, Expression b) {
        return ExpressionOrder.INSTANCE.compare(requireOwned(a), requireOwned(b));
    }

    /** Returns {@code true} if {@code expression} belongs to the current generation of this context. */
    public boolean owns(Expression expression) {
        return generation.get().store().owns(expression);
    }

    /**
     * Returns {@code expression} if it belongs to this context.
     *
     * @throws io.usymbol.core.error.ForeignExpressionException otherwise
     */
    public <T extends Expression> T requireOwned(T expression) {
        return generation.get().store().requireOwned(expression);
    }

    // ── Rewrite ──

    /** Simultaneous substitution of symbols; the result is canonical. */
    public Expression substitute(Expression expression, Map<Symbol, ? extends Expression> mapping) {
        return Substitution.substitute(canonicalizer(), expression, mapping);
    }

    /** Post-order rewrite of every node through {@code rewrite}; the result is canonical. */
    public Expression transform(Expression expression, UnaryOperator<Expression> rewrite) {
        return Substitution.transform(canonicalizer(), expression, rewrite);
    }

    /** {@link #transform} variant whose rewrite also receives the node before rebuilding. */
    Expression rewrite(Expression expression, BinaryOperator<Expression> rewrite) {
        return Substitution.rewrite(canonicalizer(), expression, rewrite);
    }

    /** Distinct symbols of {@code expression}, in canonical order. */
    public SortedSet<Symbol> freeSymbols(Expression expression) {
        return Traversal.freeSymbols(requireOwned(expression));
    }

    /** Lazy, restartable pre-order walk. */
    public Iterable<Expression> visit(Expression expression) {
        return Traversal.preorder(requireOwned(expression));
    }

    public Stream<Expression> stream(Expression expression) {
        return Traversal.stream(requireOwned(expression));
    }

    /** Occurrences of every sub-expression, in pre-order of first appearance. */
    public Map<Expression, Long> count(Expression expression) {
        return Traversal.count(requireOwned(expression));
    }

    // ── Evaluation ──

    public Evaluator evaluator(FunctionRegistry registry) {
        return new Evaluator(this, registry);
    }

    /**
     * Binds {@code expression} to an ordered parameter list.
     *
     * @param parameters distinct symbols of this context
     * @param registry   functions used to evaluate calls; may be empty
     * @throws IllegalArgumentException if a parameter repeats
     */
    public CompiledExpression compile(Expression expression, List<Symbol> parameters, FunctionRegistry registry) {
        requireOwned(expression);
        Objects.requireNonNull(parameters, "parameters must not be null");
        Set<Symbol> distinct = new HashSet<>();
        for (Symbol parameter : parameters) {
            if (!distinct.add(requireOwned(parameter))) {
                throw new IllegalArgumentException("Duplicate parameter: " + parameter.name());
            }
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Compiled expression with parameters [{}]",
                    parameters.stream().map(Symbol::name).collect(Collectors.joining(", ")));
        }
        return new CompiledFunction(expression, parameters, evaluator(registry));
    }

    // ── Lifecycle ──

    public InternStats stats() {
        return generation.get().store().stats();
    }

    /**
     * Drops every interned node by starting a new store generation. Expressions
     * built before the call become foreign to this context.
     */
    public void clear() {
        Generation previous = generation.getAndSet(Generation.create(options));
        LOG.debug("Expression context cleared: dropped {} nodes", previous.store().size());
    }
}
