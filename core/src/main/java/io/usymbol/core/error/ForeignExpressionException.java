package io.usymbol.core.error;

/**
 * Thrown when an operand interned by one {@code ExpressionContext} is combined with expressions of
 * another. Identity equality only holds inside a single context. URN: {@code
 * urn:usymbol:error:foreign-expression}
 */
public final class ForeignExpressionException extends SymbolicException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:usymbol:error:foreign-expression";

    public ForeignExpressionException(String message) {
        super(message, Phase.CONSTRUCTION);
    }

    @Override
    public String urn() {
        return URN;
    }
}
