package com.field.resolution.tracing;

/**
 * A traced unit of work: one document resolution or one escalation call.
 * Closing the span ends it, so spans fit try-with-resources blocks.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    /**
     * Marks the span as failed and attaches the cause.
     */
    void fail(Throwable cause);

    /**
     * Marks the span as completed normally.
     */
    void succeed();

    @Override
    void close();
}
