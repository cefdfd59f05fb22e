package com.document.merge.tracing;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.Objects;

/**
 * Maps merge spans onto OpenTelemetry spans. Source scopes, extend calls and
 * package copies become OTel spans; merge steps become span events.
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OTelSpanAdapter(builder.startSpan());
    }

    private static Attributes toAttributes(Map<String, String> attributes) {
        AttributesBuilder builder = Attributes.builder();
        if (attributes != null) {
            attributes.forEach(builder::put);
        }
        return builder.build();
    }

    private static class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void setAttribute(String key, String value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void addEvent(String name, Map<String, String> attributes) {
            otelSpan.addEvent(name, toAttributes(attributes));
        }

        @Override
        public void setStatus(SpanStatus status) {
            otelSpan.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            otelSpan.recordException(t);
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
