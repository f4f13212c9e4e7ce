package com.name.resolution.tracing;

import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * OpenTelemetry-backed {@link TracingService}. Every span carries the
 * identifier under the {@code name.id} attribute.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String NAME_ID_ATTRIBUTE = "name.id";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName, String nameId) {
        io.opentelemetry.api.trace.Span otelSpan = tracer.spanBuilder(operationName)
                .setAttribute(NAME_ID_ATTRIBUTE, nameId)
                .startSpan();
        return new OTelSpan(otelSpan);
    }

    private record OTelSpan(io.opentelemetry.api.trace.Span delegate) implements Span {

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, boolean value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void markSucceeded() {
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void markFailed(Throwable cause) {
            delegate.recordException(cause);
            delegate.setStatus(StatusCode.ERROR, cause.getMessage() != null ? cause.getMessage() : "");
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
