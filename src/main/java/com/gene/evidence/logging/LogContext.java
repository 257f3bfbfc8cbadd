package com.gene.evidence.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBatch(runId, "derivation")) {
 *     log.info("derivation.completed candidates={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one phase of a batch run.
     */
    public static LogContext forBatch(String runId, String phase) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("phase", phase);
        ctx.put("operation", "batch");
        return ctx;
    }

    /**
     * Creates a log context for a read-only query.
     */
    public static LogContext forQuery(String correlationId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Creates a log context for enriching a single candidate.
     */
    public static LogContext forEnrichment(String runId, String symbol) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("symbol", symbol);
        ctx.put("operation", "enrich");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
