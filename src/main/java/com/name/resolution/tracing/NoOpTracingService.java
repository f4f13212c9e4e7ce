package com.name.resolution.tracing;

/**
 * No-op implementation of {@link TracingService}.
 */
public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, boolean value) {
        }

        @Override
        public void markSucceeded() {
        }

        @Override
        public void markFailed(Throwable cause) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public Span startSpan(String operationName, String nameId) {
        return NO_OP_SPAN;
    }
}
