package com.gene.evidence.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Standardized error response DTO.
 * {@code details} carries {@code valid} (accepted values) for 400s and {@code hint}
 * (the batch step to run) for 503s.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp,
        Map<String, Object> details
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public ErrorResponse(int status, String error, String message, String path,
                         Map<String, Object> details) {
        this(status, error, message, path, Instant.now(), details);
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static ErrorResponse badRequest(String message, String path, List<String> validValues) {
        if (validValues == null || validValues.isEmpty()) {
            return badRequest(message, path);
        }
        return new ErrorResponse(400, "Bad Request", message, path, Map.of("valid", validValues));
    }

    public static ErrorResponse notFound(String message, String path) {
        return new ErrorResponse(404, "Not Found", message, path);
    }

    public static ErrorResponse serviceUnavailable(String message, String path, String hint) {
        return new ErrorResponse(503, "Service Unavailable", message, path,
                hint != null ? Map.of("hint", hint) : null);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }
}
