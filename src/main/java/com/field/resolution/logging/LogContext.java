package com.field.resolution.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and, on close, puts back whatever those keys held before,
 * so contexts can nest.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forDocument(documentId)) {
 *     log.info("document.resolved documentId={} accepted={}", documentId, accepted);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for resolving one document.
     */
    public static LogContext forDocument(String documentId) {
        LogContext ctx = new LogContext();
        ctx.put("documentId", documentId);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Creates a log context for the external validation call of a document.
     */
    public static LogContext forEscalation(String documentId, int fieldCount) {
        LogContext ctx = new LogContext();
        ctx.put("documentId", documentId);
        ctx.put("escalatedFields", String.valueOf(fieldCount));
        ctx.put("operation", "escalate");
        return ctx;
    }

    /**
     * Generates a unique document id.
     */
    public static String generateDocumentId() {
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
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
