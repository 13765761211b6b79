package io.usymbol.core.config;

/**
 * Tuning options of an {@code ExpressionContext}.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param initialCapacity   initial size of the intern map (default: 1024)
 * @param maxFoldedExponent largest {@code |n|} for which {@code number ^ n} is
 *                          folded to a constant; larger powers stay symbolic
 *                          (default: 4096)
 */
public record ContextOptions(int initialCapacity, int maxFoldedExponent) {

    /** Default options: 1024 initial slots, exponents folded up to 4096. */
    public static final ContextOptions DEFAULT = new ContextOptions(1024, 4096);

    public ContextOptions {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive, got: " + initialCapacity);
        }
        if (maxFoldedExponent < 0) {
            throw new IllegalArgumentException("maxFoldedExponent must not be negative, got: " + maxFoldedExponent);
        }
    }

    /**
     * Returns a new {@link Builder} seeded with {@link #DEFAULT}.
     *
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ContextOptions}. Validation happens in {@link #build()}. */
    public static final class Builder {

        private int initialCapacity = DEFAULT.initialCapacity;
        private int maxFoldedExponent = DEFAULT.maxFoldedExponent;

        Builder() {}

        public Builder initialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        public Builder maxFoldedExponent(int maxFoldedExponent) {
            this.maxFoldedExponent = maxFoldedExponent;
            return this;
        }

        public ContextOptions build() {
            return new ContextOptions(initialCapacity, maxFoldedExponent);
        }
    }
}
