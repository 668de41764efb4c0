package com.phillippitts.bes3t.domain;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable key/value view of one BES3T descriptor file.
 *
 * <p>Keys are stored upper-cased; lookups upper-case the requested key as well, so
 * {@code getString("xpts", ...)} and {@code getString("XPTS", ...)} are equivalent.
 * Typed accessors never throw on absent or unparseable values; they return the supplied
 * fallback instead. Descriptor dialects vary too much for strict parsing to be useful.
 */
public final class Metadata {

    private static final Metadata EMPTY = new Metadata(Map.of());

    private final Map<String, String> entries;

    private Metadata(Map<String, String> entries) {
        this.entries = entries;
    }

    /**
     * Creates metadata from a raw map. Keys are upper-cased and trimmed; on key collision
     * after normalization the later entry in iteration order wins.
     *
     * @param raw key/value pairs (must not be null)
     * @return immutable metadata
     */
    public static Metadata of(Map<String, String> raw) {
        Objects.requireNonNull(raw, "raw metadata must not be null");
        Map<String, String> normalized = new HashMap<>();
        raw.forEach((k, v) -> normalized.put(normalizeKey(k), v == null ? "" : v.trim()));
        return new Metadata(Map.copyOf(normalized));
    }

    public static Metadata empty() {
        return EMPTY;
    }

    public boolean contains(String key) {
        return entries.containsKey(normalizeKey(key));
    }

    public String getString(String key, String fallback) {
        String value = entries.get(normalizeKey(key));
        return value == null ? fallback : value;
    }

    /**
     * Returns the value as an integer. Values are parsed as floating point and truncated,
     * so {@code "1024.0"} yields 1024.
     */
    public int getInt(String key, int fallback) {
        OptionalDouble parsed = findDouble(key);
        if (parsed.isEmpty() || !Double.isFinite(parsed.getAsDouble())) {
            return fallback;
        }
        return (int) parsed.getAsDouble();
    }

    public double getDouble(String key, double fallback) {
        OptionalDouble parsed = findDouble(key);
        return parsed.isPresent() ? parsed.getAsDouble() : fallback;
    }

    /**
     * Returns the parsed value, or empty when the key is absent or not numeric.
     */
    public OptionalDouble findDouble(String key) {
        String value = entries.get(normalizeKey(key));
        if (value == null || value.isBlank()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    public int size() {
        return entries.size();
    }

    /** Unmodifiable view of all entries. */
    public Map<String, String> asMap() {
        return entries;
    }

    private static String normalizeKey(String key) {
        return key == null ? "" : key.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Metadata other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Metadata" + entries;
    }
}
