package io.usymbol.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.usymbol.core.error.ForeignExpressionException;
import io.usymbol.core.model.Expression;
import io.usymbol.core.model.Symbol;
import io.usymbol.core.spi.CompiledExpression;
import io.usymbol.core.spi.ExactFunction;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link CompiledFunction} as produced by {@link ExpressionContext#compile}. */
class CompiledFunctionTest {

    private ExpressionContext ctx;
    private FunctionRegistry registry;
    private Symbol x;
    private Symbol y;

    @BeforeEach
    void setUp() {
        ctx = new ExpressionContext();
        registry = new FunctionRegistry();
        x = ctx.symbol("x");
        y = ctx.symbol("y");
    }

    @Test
    void bindsArgumentsInParameterOrder() {
        CompiledExpression f = ctx.compile(ctx.add(x, ctx.mul(ctx.integer(2), y)), List.of(x, y), registry);

        assertThat(f.parameters()).containsExactly(x, y);
        assertThat(f.evaluate(ctx.integer(1), ctx.integer(2))).isSameAs(ctx.integer(5));
        assertThat(f.evaluate(ctx.integer(2), ctx.integer(1))).isSameAs(ctx.integer(4));
    }

    @Test
    void bindsSimultaneously() {
        CompiledExpression f = ctx.compile(ctx.sub(x, y), List.of(x, y), registry);

        assertThat(f.evaluate(y, x)).isSameAs(ctx.sub(y, x));
    }

    @Test
    void keepsSymbolicArguments() {
        Symbol t = ctx.symbol("t");
        CompiledExpression f = ctx.compile(ctx.pow(x, ctx.integer(2)), List.of(x), registry);

        assertThat(f.evaluate(ctx.add(t, ctx.integer(1)))).isSameAs(ctx.pow(ctx.add(t, ctx.integer(1)), ctx.integer(2)));
    }

    @Test
    void usesRegisteredFunctions() {
        registry.register(new ExactFunction() {
            @Override
            public String name() {
                return "double";
            }

            @Override
            public Optional<Expression> apply(List<Expression> arguments, ExpressionContext context) {
                return Optional.of(context.mul(context.integer(2), arguments.get(0)));
            }
        });
        CompiledExpression f = ctx.compile(ctx.apply("double", x), List.of(x), registry);

        assertThat(f.evaluate(ctx.integer(21))).isSameAs(ctx.integer(42));
    }

    @Test
    void rejectsWrongArity() {
        CompiledExpression f = ctx.compile(ctx.add(x, y), List.of(x, y), registry);

        assertThatThrownBy(() -> f.evaluate(ctx.integer(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 2 arguments, got: 1");
    }

    @Test
    void rejectsDuplicateParameters() {
        assertThatThrownBy(() -> ctx.compile(x, List.of(x, x), registry))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate parameter: x");
    }

    @Test
    void rejectsForeignArguments() {
        CompiledExpression f = ctx.compile(x, List.of(x), registry);

        assertThatThrownBy(() -> f.evaluate(new ExpressionContext().integer(1)))
                .isInstanceOf(ForeignExpressionException.class);
    }
}
