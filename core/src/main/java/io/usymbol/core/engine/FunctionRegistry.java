package io.usymbol.core.engine;

import io.usymbol.core.spi.ExactFunction;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of {@link ExactFunction}s by name. Thread-safe: registration and
 * lookup can happen concurrently.
 */
public final class FunctionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, ExactFunction> functions = new ConcurrentHashMap<>();

    /**
     * Registers a function. If a function with the same name is already
     * registered, it is replaced (last-write-wins semantics).
     *
     * @param function the function to register
     * @return this registry (fluent)
     * @throws NullPointerException if function is null
     * @throws IllegalArgumentException if function.name() is null or blank
     */
    public FunctionRegistry register(ExactFunction function) {
        if (function == null) {
            throw new NullPointerException("function must not be null");
        }
        String name = function.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("function name must not be null or blank");
        }
        ExactFunction previous = functions.put(name, function);
        if (previous != null && previous != function) {
            LOG.info("Replaced exact function '{}'", name);
        } else {
            LOG.debug("Registered exact function '{}'", name);
        }
        return this;
    }

    /**
     * Looks up a function by name.
     *
     * @return the function, or empty if not registered
     */
    public Optional<ExactFunction> find(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    /** Returns {@code true} if a function with the given name is registered. */
    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    /** Returns the number of registered functions. */
    public int size() {
        return functions.size();
    }
}
