package io.usymbol.core.config;

/**
 * Thrown when {@link ContextOptions} cannot be loaded: missing file, invalid YAML,
 * or a value that fails validation.
 */
public class OptionsLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public OptionsLoadException(String message) {
        super(message);
    }

    public OptionsLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
