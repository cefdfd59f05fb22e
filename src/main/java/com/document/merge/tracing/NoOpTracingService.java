package com.document.merge.tracing;

import java.util.Map;

/**
 * Tracing disabled. Every call returns the same inert span.
 */
public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void addEvent(String name, Map<String, String> attributes) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return NO_OP_SPAN;
    }
}
