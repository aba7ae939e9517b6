package com.speaker.identity.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and restores the previous values on close, so a
 * replay nested inside an assignment leaves the outer channel keys in place.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forReplay("mic-1", 12)) {
 *     log.info("replay.completed reassigned={}", diff.size());
 * } // MDC entries are restored
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for per-utterance speaker assignment.
     */
    public static LogContext forAssignment(String channelId) {
        LogContext ctx = new LogContext();
        ctx.put("channelId", channelId);
        ctx.put("operation", "assign");
        return ctx;
    }

    /**
     * Creates a log context for correction replays.
     */
    public static LogContext forReplay(String channelId, int fromIndex) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("channelId", channelId);
        ctx.put("fromIndex", Integer.toString(fromIndex));
        ctx.put("operation", "replay");
        return ctx;
    }

    /**
     * Creates a log context for enrolled-speaker imports and propagation.
     */
    public static LogContext forEnrollment(String channelId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("channelId", channelId);
        ctx.put("operation", "enrollment");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
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
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
