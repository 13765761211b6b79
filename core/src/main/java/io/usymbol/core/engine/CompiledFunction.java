package io.usymbol.core.engine;

import io.usymbol.core.model.Expression;
import io.usymbol.core.model.Symbol;
import io.usymbol.core.spi.CompiledExpression;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** {@link CompiledExpression} backed by an {@link Evaluator}. */
final class CompiledFunction implements CompiledExpression {

    private final Expression body;
    private final List<Symbol> parameters;
    private final Evaluator evaluator;

    CompiledFunction(Expression body, List<Symbol> parameters, Evaluator evaluator) {
        this.body = body;
        this.parameters = List.copyOf(parameters);
        this.evaluator = evaluator;
    }

    @Override
    public List<Symbol> parameters() {
        return parameters;
    }

    @Override
    public Expression evaluate(List<? extends Expression> arguments) {
        if (arguments.size() != parameters.size()) {
            throw new IllegalArgumentException(
                    "Expected " + parameters.size() + " arguments, got: " + arguments.size());
        }
        Map<Symbol, Expression> bindings = new HashMap<>();
        for (int i = 0; i < parameters.size(); i++) {
            bindings.put(parameters.get(i), arguments.get(i));
        }
        return evaluator.evaluate(body, bindings);
    }

    @Override
    public String toString() {
        return "CompiledExpression" + parameters + " -> " + body;
    }
}
