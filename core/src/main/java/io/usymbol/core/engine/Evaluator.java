package io.usymbol.core.engine;

import io.usymbol.core.error.ExpressionEvalException;
import io.usymbol.core.error.SymbolicException;
import io.usymbol.core.error.UnboundSymbolException;
import io.usymbol.core.model.Call;
import io.usymbol.core.model.Expression;
import io.usymbol.core.model.Numeric;
import io.usymbol.core.model.Symbol;
import io.usymbol.core.spi.ExactFunction;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exact evaluation: binds symbols and folds every {@link Call} that has a
 * registered {@link ExactFunction}, in a single bottom-up pass. Binding is
 * simultaneous: only symbols of the input are bound. Bound values have their
 * calls folded before binding, and a call returned by a function is not
 * invoked again.
 *
 * <p>
 * Calls without a registered function, or whose function declines, stay
 * symbolic. The result is always canonical.
 *
 * <p>
 * Thread-safe as long as the registered functions are.
 */
public final class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final ExpressionContext context;
    private final FunctionRegistry registry;

    public Evaluator(ExpressionContext context, FunctionRegistry registry) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Substitutes {@code bindings} and evaluates every call.
     *
     * @throws ExpressionEvalException if a registered function throws
     */
    public Expression evaluate(Expression expression, Map<Symbol, ? extends Expression> bindings) {
        Objects.requireNonNull(bindings, "bindings must not be null");
        Map<Symbol, Expression> values = new HashMap<>();
        for (Map.Entry<Symbol, ? extends Expression> entry : bindings.entrySet()) {
            context.requireOwned(entry.getKey());
            values.put(entry.getKey(), evaluateCalls(context.requireOwned(entry.getValue())));
        }
        return context.rewrite(expression, (original, rebuilt) -> {
            if (original instanceof Symbol symbol) {
                return values.getOrDefault(symbol, rebuilt);
            }
            return foldCall(original, rebuilt);
        });
    }

    /** Folds registered calls without touching symbols. */
    private Expression evaluateCalls(Expression expression) {
        return context.rewrite(expression, this::foldCall);
    }

    private Expression foldCall(Expression original, Expression rebuilt) {
        return original instanceof Call && rebuilt instanceof Call call ? invoke(call) : rebuilt;
    }

    /** Evaluates every call without binding any symbol. */
    public Expression evaluate(Expression expression) {
        return evaluate(expression, Map.of());
    }

    /**
     * Evaluates to an exact number.
     *
     * @throws UnboundSymbolException if symbols remain after binding
     * @throws ExpressionEvalException if the result is not a number or a function fails
     */
    public Numeric evaluateToNumber(Expression expression, Map<Symbol, ? extends Expression> bindings) {
        Expression result = evaluate(expression, bindings);
        if (result instanceof Numeric number) {
            return number;
        }
        Set<Symbol> unbound = Traversal.freeSymbols(result);
        if (!unbound.isEmpty()) {
            List<String> names = new ArrayList<>(unbound.size());
            unbound.forEach(symbol -> names.add(symbol.name()));
            throw new UnboundSymbolException(names);
        }
        throw new ExpressionEvalException("Expression does not reduce to an exact number: " + result);
    }

    private Expression invoke(Call call) {
        Optional<ExactFunction> function = registry.find(call.name());
        if (function.isEmpty()) {
            return call;
        }
        Optional<Expression> value;
        try {
            value = function.get().apply(call.arguments(), context);
        } catch (SymbolicException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Exact function '{}' failed on {}: {}", call.name(), call.arguments(), e.getMessage());
            throw new ExpressionEvalException("Function '" + call.name() + "' failed: " + e.getMessage(), e);
        }
        if (value == null || value.isEmpty()) {
            return call;
        }
        return context.requireOwned(value.get());
    }
}
