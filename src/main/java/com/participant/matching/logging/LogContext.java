package com.participant.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and, on close, restores whatever each key held
 * before, so a nested context does not strip keys its enclosing context set.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId)) {
 *     log.info("run.started participants={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole matching run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "match-run");
        return ctx;
    }

    /**
     * Creates a log context for resolving one participant.
     */
    public static LogContext forParticipant(String participantId) {
        LogContext ctx = new LogContext();
        ctx.put("participantId", participantId);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Installs a captured MDC map on the current thread, typically a worker of a
     * parallel stream. A null map installs nothing.
     */
    public static LogContext fromMap(Map<String, String> contextMap) {
        LogContext ctx = new LogContext();
        if (contextMap != null) {
            contextMap.forEach(ctx::put);
        }
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

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
        List<Map.Entry<String, String>> entries = new ArrayList<>(previous.entrySet());
        Collections.reverse(entries);
        for (Map.Entry<String, String> entry : entries) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
