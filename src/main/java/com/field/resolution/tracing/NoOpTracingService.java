package com.field.resolution.tracing;

/**
 * No-op implementation of {@link TracingService}.
 */
public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new NoOpSpan();

    @Override
    public Span startDocument(String documentId, int fieldCount) {
        return NO_OP_SPAN;
    }

    @Override
    public Span startEscalation(String documentId, String validatorName, int fieldCount) {
        return NO_OP_SPAN;
    }

    private static class NoOpSpan implements Span {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void fail(Throwable cause) {
        }

        @Override
        public void succeed() {
        }

        @Override
        public void close() {
        }
    }
}
