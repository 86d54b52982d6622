package com.entity.blocking.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forIndexBuild(runId, "name")) {
 *     log.info("index.built field={} documents={}", field, size);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for building the indices of one field.
     */
    public static LogContext forIndexBuild(String runId, String field) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("field", field);
        ctx.put("phase", "index");
        return ctx;
    }

    /**
     * Creates a log context for a diagnostics report.
     */
    public static LogContext forDiagnostics(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("phase", "diagnostics");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
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
