package com.name.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Keys added through a context are removed when it closes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(id)) {
 *     log.info("name.resolved kind={}", kind);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a backend resolution of one identifier, with a fresh correlation id.
     */
    public static LogContext forResolution(String nameId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", UUID.randomUUID().toString());
        ctx.put("nameId", nameId);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Context for cache maintenance such as clear or sweep.
     */
    public static LogContext forHousekeeping(String operation) {
        LogContext ctx = new LogContext();
        ctx.put("operation", operation);
        return ctx;
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
