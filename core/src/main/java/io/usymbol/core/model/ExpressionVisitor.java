package io.usymbol.core.model;

/**
 * Visitor over the closed set of {@link Expression} variants. Adding a variant
 * breaks every implementation at compile time, which is what keeps dispatch
 * exhaustive.
 *
 * @param <R> result type
 */
public interface ExpressionVisitor<R> {

    R visitSymbol(Symbol symbol);

    R visitInteger(Int integer);

    R visitRational(Rational rational);

    R visitAdd(Add add);

    R visitMul(Mul mul);

    R visitPow(Pow pow);

    R visitCall(Call call);
}
