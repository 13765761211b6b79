package io.usymbol.core.error;

/**
 * Abstract base for all usymbol exceptions. Never thrown directly, use the concrete subclasses.
 * Construction-time errors are raised synchronously by the canonicalizing constructors, so no
 * partially built expression is ever returned or interned.
 */
public abstract class SymbolicException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        CONSTRUCTION,
        EVALUATION
    }

    private final Phase phase;

    protected SymbolicException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected SymbolicException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /** Stable identifier of the error type. */
    public abstract String urn();
}
