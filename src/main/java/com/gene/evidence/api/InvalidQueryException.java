package com.gene.evidence.api;

import java.util.List;

/**
 * A query parameter that is unknown or malformed. Raised before any data is read.
 */
public class InvalidQueryException extends IllegalArgumentException {

    private final List<String> validValues;

    public InvalidQueryException(String message) {
        this(message, List.of());
    }

    public InvalidQueryException(String message, List<String> validValues) {
        super(message);
        this.validValues = validValues != null ? List.copyOf(validValues) : List.of();
    }

    /**
     * Accepted values for the offending parameter, empty when the parameter is free-form.
     */
    public List<String> getValidValues() {
        return validValues;
    }
}
