package com.field.resolution.metrics;

import com.field.resolution.core.model.ResolutionMethod;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordFieldResolved(ResolutionMethod method, double confidence) {
    }

    @Override
    public void recordEscalationBatchSize(int size) {
    }

    @Override
    public void recordEscalation(EscalationOutcome outcome, Duration duration) {
    }

    @Override
    public void recordDocumentDuration(Duration duration) {
    }
}
