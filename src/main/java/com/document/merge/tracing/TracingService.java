package com.document.merge.tracing;

import java.util.Map;

/**
 * Opens spans for merge sessions. {@link NoOpTracingService} is used when
 * the session is built without one.
 */
public interface TracingService {

    /**
     * @param attributes start attributes, typically the document or source name
     */
    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
