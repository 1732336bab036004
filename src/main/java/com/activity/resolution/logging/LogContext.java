package com.activity.resolution.logging;

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
 * try (LogContext ctx = LogContext.forRun(runId, "ingest-gps")) {
 *     log.info("ingest.completed processed={} created={}", processed, created);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a batch run such as an ingest or a backfill.
     */
    public static LogContext forRun(String runId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Creates a log context for one native source row.
     */
    public static LogContext forRow(String source, String nativeId) {
        LogContext ctx = new LogContext();
        ctx.put("source", source);
        ctx.put("nativeId", nativeId);
        return ctx;
    }

    /**
     * Creates a log context for one canonical activity.
     */
    public static LogContext forActivity(long activityId) {
        LogContext ctx = new LogContext();
        ctx.put("activityId", String.valueOf(activityId));
        return ctx;
    }

    /**
     * Creates a log context for merge operations.
     */
    public static LogContext forMerge(String runId, long keepId, long dropId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("keepId", String.valueOf(keepId));
        ctx.put("dropId", String.valueOf(dropId));
        ctx.put("operation", "merge");
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
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
