package io.usymbol.core.model;

/**
 * Point-in-time counters of an {@link InternStore}.
 *
 * @param size   distinct nodes held
 * @param hits   lookups answered by an existing node
 * @param misses lookups that created a node
 */
public record InternStats(int size, long hits, long misses) {}
