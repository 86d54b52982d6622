package com.entity.blocking.core.model;

import java.util.Objects;

/**
 * A raw predicate key tagged with the ordinal of the predicate that produced it.
 * Rendered as {@code rawKey:ordinal}. Parsing splits at the last colon, so raw keys
 * may themselves contain colons.
 *
 * @param rawKey  the key produced by the predicate
 * @param ordinal the position of the predicate in the blocker's predicate list
 */
public record BlockKey(String rawKey, int ordinal) {

    static final char SEPARATOR = ':';

    public BlockKey {
        Objects.requireNonNull(rawKey, "rawKey is required");
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be >= 0");
        }
    }

    /**
     * Parses a rendered tagged key.
     *
     * @throws IllegalArgumentException if the key carries no ordinal tag
     */
    public static BlockKey parse(String tagged) {
        int idx = tagged.lastIndexOf(SEPARATOR);
        if (idx < 0) {
            throw new IllegalArgumentException("Not a tagged block key: " + tagged);
        }
        try {
            return new BlockKey(tagged.substring(0, idx), Integer.parseInt(tagged.substring(idx + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a tagged block key: " + tagged, e);
        }
    }

    @Override
    public String toString() {
        return rawKey + SEPARATOR + ordinal;
    }
}
