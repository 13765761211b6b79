package io.usymbol.core.engine;

import io.usymbol.core.model.Add;
import io.usymbol.core.model.Call;
import io.usymbol.core.model.Expression;
import io.usymbol.core.model.ExpressionVisitor;
import io.usymbol.core.model.Int;
import io.usymbol.core.model.Mul;
import io.usymbol.core.model.Pow;
import io.usymbol.core.model.Rational;
import io.usymbol.core.model.Symbol;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

/**
 * Bottom-up tree rewrites that keep results canonical.
 *
 * <p>
 * Every rebuilt node goes back through the {@link Canonicalizer}, so a rewrite
 * never splices a raw node into a tree. Nodes whose children are unchanged are
 * reused as is, and a sub-tree shared by several parents is rewritten once per
 * call.
 *
 * <p>
 * The rewrite receives both the original node and its rebuilt form. A composite
 * can collapse into one of its new children while being rebuilt (e.g.
 * {@code 0 + x}); the original tells such a result apart from a node that was
 * there before the rewrite.
 */
final class Substitution {

    private final Canonicalizer canonicalizer;
    private final BinaryOperator<Expression> rewrite;
    private final Map<Expression, Expression> memo = new IdentityHashMap<>();

    private Substitution(Canonicalizer canonicalizer, BinaryOperator<Expression> rewrite) {
        this.canonicalizer = canonicalizer;
        this.rewrite = rewrite;
    }

    /**
     * Replaces every key symbol with its mapped expression. Replacement is
     * simultaneous: only symbols of the input are replaced, never symbols that
     * a mapped value brings in.
     */
    static Expression substitute(
            Canonicalizer canonicalizer, Expression expression, Map<Symbol, ? extends Expression> mapping) {
        Objects.requireNonNull(mapping, "mapping must not be null");
        for (Map.Entry<Symbol, ? extends Expression> entry : mapping.entrySet()) {
            canonicalizer.store().requireOwned(entry.getKey());
            canonicalizer.store().requireOwned(entry.getValue());
        }
        if (mapping.isEmpty()) {
            return canonicalizer.store().requireOwned(expression);
        }
        return rewrite(canonicalizer, expression, (original, rebuilt) -> {
            if (original instanceof Symbol symbol) {
                Expression replacement = mapping.get(symbol);
                return replacement != null ? replacement : rebuilt;
            }
            return rebuilt;
        });
    }

    /**
     * Post-order rewrite: {@code rewrite} sees each node after its children have
     * been rebuilt, and its result replaces the node.
     */
    static Expression transform(Canonicalizer canonicalizer, Expression expression, UnaryOperator<Expression> rewrite) {
        Objects.requireNonNull(rewrite, "rewrite must not be null");
        return rewrite(canonicalizer, expression, (original, rebuilt) -> rewrite.apply(rebuilt));
    }

    /**
     * Post-order rewrite over {@code (original, rebuilt)} pairs: {@code rebuilt} is
     * {@code original} with rewritten children, re-canonicalized.
     */
    static Expression rewrite(
            Canonicalizer canonicalizer, Expression expression, BinaryOperator<Expression> rewrite) {
        canonicalizer.store().requireOwned(expression);
        return new Substitution(canonicalizer, rewrite).apply(expression);
    }

    private Expression apply(Expression node) {
        Expression done = memo.get(node);
        if (done != null) {
            return done;
        }
        Expression rebuilt = rebuild(node);
        Expression result = canonicalizer.store().requireOwned(
                Objects.requireNonNull(rewrite.apply(node, rebuilt), "rewrite returned null"));
        memo.put(node, result);
        return result;
    }

    private Expression rebuild(Expression node) {
        List<Expression> children = node.children();
        if (children.isEmpty()) {
            return node;
        }
        List<Expression> rewritten = new ArrayList<>(children.size());
        boolean changed = false;
        for (Expression child : children) {
            Expression next = apply(child);
            changed |= next != child;
            rewritten.add(next);
        }
        return changed ? node.accept(new Rebuilder(rewritten)) : node;
    }

    /** Re-canonicalizes a composite node over new children. */
    private final class Rebuilder implements ExpressionVisitor<Expression> {

        private final List<Expression> children;

        Rebuilder(List<Expression> children) {
            this.children = children;
        }

        @Override
        public Expression visitSymbol(Symbol symbol) {
            return symbol;
        }

        @Override
        public Expression visitInteger(Int integer) {
            return integer;
        }

        @Override
        public Expression visitRational(Rational rational) {
            return rational;
        }

        @Override
        public Expression visitAdd(Add add) {
            return canonicalizer.add(children);
        }

        @Override
        public Expression visitMul(Mul mul) {
            return canonicalizer.mul(children);
        }

        @Override
        public Expression visitPow(Pow pow) {
            return canonicalizer.pow(children.get(0), children.get(1));
        }

        @Override
        public Expression visitCall(Call call) {
            return canonicalizer.call(call.name(), children);
        }
    }
}
