package com.contact.dedup.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) scope for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forDuplicateCheck(correlationId, fingerprint)) {
 *     log.info("dedup.check.completed duplicate={} confidence={}", duplicate, confidence);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a duplicate check.
     */
    public static LogContext forDuplicateCheck(String correlationId, String fingerprint) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("fingerprint", fingerprint);
        ctx.put("operation", "checkDuplicates");
        return ctx;
    }

    /**
     * Creates a log context for a merge.
     */
    public static LogContext forMerge(String correlationId, String existingId, String incomingId, String strategy) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("existingRecordId", existingId);
        ctx.put("incomingRecordId", incomingId);
        ctx.put("mergeStrategy", strategy);
        ctx.put("operation", "mergeRecords");
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
        if (value == null) {
            return;
        }
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
