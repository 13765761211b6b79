package io.usymbol.core.error;

import java.util.List;

/**
 * Thrown by numeric evaluation when symbols without a binding remain in the expression. The
 * canonicalizing core itself never requires symbols to be bound. URN: {@code
 * urn:usymbol:error:unbound-symbol}
 */
public final class UnboundSymbolException extends ExpressionEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:usymbol:error:unbound-symbol";

    private final List<String> symbols;

    public UnboundSymbolException(List<String> symbols) {
        super("Unbound symbols: " + symbols);
        this.symbols = List.copyOf(symbols);
    }

    /** Names of the symbols left unbound, in canonical order. */
    public List<String> symbols() {
        return symbols;
    }

    @Override
    public String urn() {
        return URN;
    }
}
