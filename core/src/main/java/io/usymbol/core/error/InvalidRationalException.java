package io.usymbol.core.error;

/**
 * Thrown when a rational constant is constructed with a zero denominator. URN: {@code
 * urn:usymbol:error:invalid-rational}
 */
public final class InvalidRationalException extends SymbolicException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:usymbol:error:invalid-rational";

    public InvalidRationalException(String message) {
        super(message, Phase.CONSTRUCTION);
    }

    @Override
    public String urn() {
        return URN;
    }
}
