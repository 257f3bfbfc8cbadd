package com.gene.evidence.enrich;

/**
 * An external annotation service could not be reached or answered with an error,
 * after all retry attempts.
 */
public class UpstreamFetchException extends RuntimeException {

    private final String service;

    public UpstreamFetchException(String service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
