package com.airwave.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forMatchBatch(batchId, pairs.size())) {
 *     log.info("match.batch.completed matched={} unmatched={}", matched, unmatched);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forMatchBatch(String batchId, int size) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("batchSize", String.valueOf(size));
        ctx.put("operation", "match");
        return ctx;
    }

    public static LogContext forResolveBatch(String batchId, int size) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("batchSize", String.valueOf(size));
        ctx.put("operation", "resolve-artists");
        return ctx;
    }

    public static LogContext forPromotion(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "promote");
        return ctx;
    }

    public static LogContext forOrphanLinking(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "link-orphans");
        return ctx;
    }

    /**
     * Generates a unique batch ID.
     */
    public static String generateBatchId() {
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
