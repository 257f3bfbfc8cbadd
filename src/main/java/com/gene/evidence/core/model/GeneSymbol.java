package com.gene.evidence.core.model;

import java.util.Locale;

/**
 * Canonical gene identifier (HGNC symbol).
 * Input is case-insensitive; the stored value is always trimmed and upper-cased,
 * so every join and lookup goes through {@link #normalize(String)}.
 */
public record GeneSymbol(String value) implements Comparable<GeneSymbol> {

    public GeneSymbol {
        value = normalize(value);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Gene symbol must not be blank");
        }
    }

    public static GeneSymbol of(String raw) {
        return new GeneSymbol(raw);
    }

    /**
     * Trims and upper-cases a raw symbol. Returns {@code null} for {@code null} input.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        return raw.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public int compareTo(GeneSymbol other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
