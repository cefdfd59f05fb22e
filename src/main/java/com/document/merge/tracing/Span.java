package com.document.merge.tracing;

import java.util.Map;

/**
 * A traced unit of merge work: one source scope, or one extend, package copy
 * or identity pass. Ends when closed.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("merge.extend", Map.of("document", "Com.arxml"))) {
 *     span.addEvent("merge.step", Map.of("step", "I-PDU"));
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    /**
     * Marks a point inside the span, e.g. the start of a named merge step.
     */
    void addEvent(String name, Map<String, String> attributes);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
