package io.usymbol.core.error;

/**
 * Thrown when exact evaluation fails: the result is not a number, or a registered function threw.
 * URN: {@code urn:usymbol:error:expression-eval-failed}
 */
public class ExpressionEvalException extends SymbolicException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:usymbol:error:expression-eval-failed";

    public ExpressionEvalException(String message) {
        super(message, Phase.EVALUATION);
    }

    public ExpressionEvalException(String message, Throwable cause) {
        super(message, cause, Phase.EVALUATION);
    }

    @Override
    public String urn() {
        return URN;
    }
}
