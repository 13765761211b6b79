package io.usymbol.core.error;

/**
 * Thrown when a power is constructed with base zero and a non-positive numeric exponent ({@code
 * 0^0}, {@code 0^-n}). URN: {@code urn:usymbol:error:undefined-expression}
 */
public final class UndefinedExpressionException extends SymbolicException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:usymbol:error:undefined-expression";

    public UndefinedExpressionException(String message) {
        super(message, Phase.CONSTRUCTION);
    }

    @Override
    public String urn() {
        return URN;
    }
}
