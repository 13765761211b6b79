package io.usymbol.core.spi;

import io.usymbol.core.model.Expression;
import io.usymbol.core.model.Symbol;
import java.util.List;

/**
 * An expression bound to an ordered parameter list, callable like a function.
 * Produced by {@link io.usymbol.core.engine.ExpressionContext#compile}.
 *
 * <p>
 * Implementations MUST be immutable and thread-safe.
 */
public interface CompiledExpression {

    /** The parameters in call order. */
    List<Symbol> parameters();

    /**
     * Binds {@code arguments} to {@link #parameters()} simultaneously and
     * evaluates the result.
     *
     * @param arguments one canonical expression per parameter
     * @return the canonical result
     * @throws IllegalArgumentException if the argument count does not match
     * @throws io.usymbol.core.error.ExpressionEvalException if a registered function fails
     */
    Expression evaluate(List<? extends Expression> arguments);

    /** Varargs form of {@link #evaluate(List)}. */
    default Expression evaluate(Expression... arguments) {
        return evaluate(List.of(arguments));
    }
}
