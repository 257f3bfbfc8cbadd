package com.gene.evidence.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Independently snapshotted data granularities exposed by the serving layer.
 */
public enum Tier {
    CURATED("curated", true),
    EXPANDED("expanded", true),
    GENOME("genome", true),
    DERIVED("derived", false);

    private final String paramName;
    private final boolean listable;

    Tier(String paramName, boolean listable) {
        this.paramName = paramName;
        this.listable = listable;
    }

    public String getParamName() {
        return paramName;
    }

    /**
     * Whether the tier can be requested through the gene listing operation.
     */
    public boolean isListable() {
        return listable;
    }

    public static Optional<Tier> fromParam(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.paramName.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    public static List<String> listableNames() {
        return Arrays.stream(values())
                .filter(Tier::isListable)
                .map(Tier::getParamName)
                .toList();
    }
}
