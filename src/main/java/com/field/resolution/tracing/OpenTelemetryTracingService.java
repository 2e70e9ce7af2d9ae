package com.field.resolution.tracing;

import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Objects;

/**
 * OpenTelemetry-based implementation of {@link TracingService}.
 * Wraps OpenTelemetry spans so the pipeline does not depend on the OTel API directly.
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    @Override
    public Span startDocument(String documentId, int fieldCount) {
        io.opentelemetry.api.trace.Span otelSpan = tracer.spanBuilder(DOCUMENT_SPAN)
                .setAttribute("documentId", documentId)
                .setAttribute("fieldCount", (long) fieldCount)
                .startSpan();
        return new OTelSpanAdapter(otelSpan);
    }

    @Override
    public Span startEscalation(String documentId, String validatorName, int fieldCount) {
        io.opentelemetry.api.trace.Span otelSpan = tracer.spanBuilder(ESCALATION_SPAN)
                .setAttribute("documentId", documentId)
                .setAttribute("validator", validatorName)
                .setAttribute("fieldCount", (long) fieldCount)
                .startSpan();
        return new OTelSpanAdapter(otelSpan);
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
        public void fail(Throwable cause) {
            otelSpan.recordException(cause);
            otelSpan.setStatus(StatusCode.ERROR, cause.getMessage() != null ? cause.getMessage() : "");
        }

        @Override
        public void succeed() {
            otelSpan.setStatus(StatusCode.OK);
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
