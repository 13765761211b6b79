package io.usymbol.core.spi;

import io.usymbol.core.engine.ExpressionContext;
import io.usymbol.core.model.Expression;
import java.util.List;
import java.util.Optional;

/**
 * An exact interpretation of an otherwise uninterpreted function, used when
 * evaluating {@link io.usymbol.core.model.Call} nodes. Registered with a
 * {@link io.usymbol.core.engine.FunctionRegistry} under {@link #name()}.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe.
 */
public interface ExactFunction {

    /**
     * The function name matched against {@link io.usymbol.core.model.Call#name()}.
     *
     * @return a non-null, non-empty name
     */
    String name();

    /**
     * Evaluates the function on already evaluated, canonical arguments.
     *
     * @param arguments the call's arguments, in order
     * @param context   the context that owns the arguments; results must be built with it
     * @return the value, or empty to leave the call symbolic (e.g. for symbolic arguments)
     */
    Optional<Expression> apply(List<Expression> arguments, ExpressionContext context);
}
