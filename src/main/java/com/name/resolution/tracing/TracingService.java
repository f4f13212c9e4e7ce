package com.name.resolution.tracing;

/**
 * Starts spans around backend lookups made during name resolution.
 * {@link NoOpTracingService} is used when no tracer is configured.
 */
public interface TracingService {

    /**
     * Starts a span tagged with the identifier being resolved.
     *
     * @param operationName span name, e.g. {@code name.resolve}
     * @param nameId        the identifier
     */
    Span startSpan(String operationName, String nameId);
}
