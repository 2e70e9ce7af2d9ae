package com.field.resolution.metrics;

import com.field.resolution.core.model.ResolutionMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code field.resolution.method} Counter (tag: method)</li>
 *   <li>{@code field.resolution.confidence} DistributionSummary</li>
 *   <li>{@code field.escalation.batch.size} DistributionSummary</li>
 *   <li>{@code field.escalation.duration} Timer (tag: outcome)</li>
 *   <li>{@code field.document.duration} Timer</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Map<ResolutionMethod, Counter> methodCounters = new EnumMap<>(ResolutionMethod.class);
    private final Map<EscalationOutcome, Timer> escalationTimers = new EnumMap<>(EscalationOutcome.class);
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary batchSizeSummary;
    private final Timer documentTimer;

    public MicrometerMetricsService(MeterRegistry registry) {
        for (ResolutionMethod method : ResolutionMethod.values()) {
            methodCounters.put(method, Counter.builder("field.resolution.method")
                    .description("Number of fields decided by each method")
                    .tag("method", method.name().toLowerCase(Locale.ROOT))
                    .register(registry));
        }
        for (EscalationOutcome outcome : EscalationOutcome.values()) {
            escalationTimers.put(outcome, Timer.builder("field.escalation.duration")
                    .description("Duration of external validation calls")
                    .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                    .register(registry));
        }
        this.confidenceSummary = DistributionSummary.builder("field.resolution.confidence")
                .description("Distribution of final field confidence")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("field.escalation.batch.size")
                .description("Number of fields sent per escalation call")
                .register(registry);
        this.documentTimer = Timer.builder("field.document.duration")
                .description("Duration of whole-document resolution")
                .register(registry);
    }

    @Override
    public void recordFieldResolved(ResolutionMethod method, double confidence) {
        methodCounters.get(method).increment();
        confidenceSummary.record(confidence);
    }

    @Override
    public void recordEscalationBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordEscalation(EscalationOutcome outcome, Duration duration) {
        escalationTimers.get(outcome).record(duration);
    }

    @Override
    public void recordDocumentDuration(Duration duration) {
        documentTimer.record(duration);
    }
}
