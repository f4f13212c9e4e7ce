package com.name.resolution.tracing;

/**
 * A traced unit of work: a whole resolution or a single lookup source query.
 * Ends when closed, so use it in try-with-resources:
 *
 * <pre>
 * try (Span span = tracingService.startSpan("name.resolve", id)) {
 *     span.setAttribute("name.source", "cluster");
 *     span.markSucceeded();
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, boolean value);

    void markSucceeded();

    void markFailed(Throwable cause);

    @Override
    void close();
}
