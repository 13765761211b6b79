package io.usymbol.core.engine;

import io.usymbol.core.model.Expression;
import io.usymbol.core.model.ExpressionOrder;
import io.usymbol.core.model.Symbol;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/** Read-only traversals. None of them mutate or intern anything. */
public final class Traversal {

    private Traversal() {}

    /**
     * Depth-first pre-order view of the tree rooted at {@code root}. A shared
     * sub-tree is visited once per occurrence. The view is lazy and restartable:
     * every {@link Iterable#iterator()} call starts a fresh walk.
     */
    public static Iterable<Expression> preorder(Expression root) {
        Objects.requireNonNull(root, "root must not be null");
        return () -> new PreorderIterator(root);
    }

    /** {@link #preorder(Expression)} as a sequential stream. */
    public static Stream<Expression> stream(Expression root) {
        return StreamSupport.stream(preorder(root).spliterator(), false);
    }

    /**
     * Distinct symbols reachable from {@code root}, in canonical order.
     *
     * @return an unmodifiable sorted set
     */
    public static SortedSet<Symbol> freeSymbols(Expression root) {
        Objects.requireNonNull(root, "root must not be null");
        TreeSet<Symbol> symbols = new TreeSet<>(ExpressionOrder.INSTANCE);
        Set<Expression> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Expression> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Expression node = pending.pop();
            if (!seen.add(node)) {
                continue;
            }
            if (node instanceof Symbol symbol) {
                symbols.add(symbol);
            }
            for (Expression child : node.children()) {
                pending.push(child);
            }
        }
        return Collections.unmodifiableSortedSet(symbols);
    }

    /**
     * Occurrence count of every sub-expression in the tree, keyed in pre-order of
     * first appearance.
     *
     * @return an unmodifiable map
     */
    public static Map<Expression, Long> count(Expression root) {
        Map<Expression, Long> counts = new LinkedHashMap<>();
        for (Expression node : preorder(root)) {
            counts.merge(node, 1L, Long::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    private static final class PreorderIterator implements Iterator<Expression> {

        private final Deque<Expression> pending = new ArrayDeque<>();

        PreorderIterator(Expression root) {
            pending.push(root);
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty();
        }

        @Override
        public Expression next() {
            if (pending.isEmpty()) {
                throw new NoSuchElementException();
            }
            Expression node = pending.pop();
            List<Expression> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
            return node;
        }
    }
}
