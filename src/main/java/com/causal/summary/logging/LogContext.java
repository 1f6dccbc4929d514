package com.causal.summary.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forReduction(correlationId, targetSize)) {
 *     log.info("reduce.completed nodes={} status={}", nodes, status);
 * } // MDC entries are cleared here
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a reduction run.
     */
    public static LogContext forReduction(String correlationId, int targetSize) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("targetSize", String.valueOf(targetSize));
        ctx.put("operation", "reduce");
        return ctx;
    }

    /**
     * Creates a log context for grounding a summary graph.
     */
    public static LogContext forGrounding(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "ground");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
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
