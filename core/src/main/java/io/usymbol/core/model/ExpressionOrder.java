package io.usymbol.core.model;

import java.util.Comparator;
import java.util.List;

/**
 * The canonical strict total order over expressions.
 *
 * <p>
 * Expressions are ordered by {@link Kind#rank()} first. Within a kind:
 * <ul>
 * <li>numbers by value</li>
 * <li>symbols by name</li>
 * <li>powers by base, then exponent</li>
 * <li>sums and products pairwise over their operands, the shorter sequence first
 * on an equal prefix</li>
 * <li>calls by name, then pairwise over their arguments</li>
 * </ul>
 *
 * <p>
 * For canonical expressions of one context {@code compare(a, b) == 0} iff
 * {@code a == b}. Stateless and thread-safe.
 */
public final class ExpressionOrder implements Comparator<Expression> {

    public static final ExpressionOrder INSTANCE = new ExpressionOrder();

    private ExpressionOrder() {}

    @Override
    public int compare(Expression a, Expression b) {
        if (a == b) {
            return 0;
        }
        int byKind = Integer.compare(a.kind().rank(), b.kind().rank());
        if (byKind != 0) {
            return byKind;
        }
        return switch (a.kind()) {
            case INTEGER, RATIONAL -> ((Numeric) a).toRational().compareTo(((Numeric) b).toRational());
            case SYMBOL -> ((Symbol) a).name().compareTo(((Symbol) b).name());
            case CALL -> compareCalls((Call) a, (Call) b);
            case POW, MUL, ADD -> compareSequences(a.children(), b.children());
        };
    }

    private int compareCalls(Call a, Call b) {
        int byName = a.name().compareTo(b.name());
        return byName != 0 ? byName : compareSequences(a.arguments(), b.arguments());
    }

    private int compareSequences(List<Expression> left, List<Expression> right) {
        int common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            int c = compare(left.get(i), right.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(left.size(), right.size());
    }
}
