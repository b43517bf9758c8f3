package com.winevt.resources.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forLookup("message", providerIdentifier, logSource, messageIdentifier)) {
 *     log.warn("No message string for identifier: 0x{}", ...);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a message or parameter string lookup.
     */
    public static LogContext forLookup(String operation, String providerIdentifier, String logSource,
                                       long messageIdentifier) {
        LogContext ctx = new LogContext();
        ctx.put("operation", operation);
        if (providerIdentifier != null) {
            ctx.put("providerIdentifier", providerIdentifier);
        }
        if (logSource != null) {
            ctx.put("logSource", logSource);
        }
        ctx.put("messageIdentifier", String.format("0x%08x", messageIdentifier));
        return ctx;
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
