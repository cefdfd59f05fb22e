package com.document.merge.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and, on close, restores the values they
 * replaced so nested contexts (a merge inside a source scope) unwind cleanly.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forMerge(correlationId, "EthDp.arxml", "Com.arxml", "/Communication/Pdu")) {
 *     log.info("merge.extend.completed attached={} clashes={}", attached, clashes);
 * } // MDC entries are cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole merge run.
     */
    public static LogContext forRun(String runId, String destinationDocument) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("destinationDocument", destinationDocument);
        ctx.put("operation", "run");
        return ctx;
    }

    /**
     * Creates a log context for the work done on behalf of one source document.
     */
    public static LogContext forSource(String sourceDocument) {
        LogContext ctx = new LogContext();
        ctx.put("sourceDocument", sourceDocument);
        return ctx;
    }

    /**
     * Creates a log context for one extend call.
     */
    public static LogContext forMerge(String correlationId, String sourceDocument,
                                      String destinationDocument, String container) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("sourceDocument", sourceDocument);
        ctx.put("destinationDocument", destinationDocument);
        ctx.put("container", container);
        ctx.put("operation", "extend");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
