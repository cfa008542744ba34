package com.property.distress.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC scope for structured logging.
 * Keys added through this context are removed from the SLF4J MDC on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forIngestion(runId, "violations")) {
 *     log.info("ingest.completed result={}", result);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forIngestion(String runId, String source) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("source", source);
        ctx.put("operation", "ingest");
        return ctx;
    }

    public static LogContext forScoring(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "score");
        return ctx;
    }

    public static LogContext forArchive(String directory) {
        LogContext ctx = new LogContext();
        ctx.put("archiveDir", directory);
        ctx.put("operation", "archive");
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
