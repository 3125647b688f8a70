package com.airwave.resolution.metrics;

import com.airwave.resolution.core.model.MatchReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code airwave.match.batch.duration}: Timer</li>
 *   <li>{@code airwave.match.outcome}: Counter (tag: reason)</li>
 *   <li>{@code airwave.batch.size}: DistributionSummary</li>
 *   <li>{@code airwave.bridge.cache.hit} / {@code airwave.bridge.cache.miss}: Counter</li>
 *   <li>{@code airwave.bridge.created}: Counter</li>
 *   <li>{@code airwave.index.degraded}: Counter</li>
 *   <li>{@code airwave.works.promoted}: Counter</li>
 *   <li>{@code airwave.logs.linked}: Counter</li>
 *   <li>{@code airwave.split.proposed}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer batchDurationTimer;
    private final Map<MatchReason, Counter> outcomeCounters = new EnumMap<>(MatchReason.class);
    private final DistributionSummary batchSizeSummary;
    private final Counter bridgeCacheHitCounter;
    private final Counter bridgeCacheMissCounter;
    private final Counter bridgeCreatedCounter;
    private final Counter indexDegradedCounter;
    private final Counter worksPromotedCounter;
    private final Counter logsLinkedCounter;
    private final Counter splitProposedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.batchDurationTimer = Timer.builder("airwave.match.batch.duration")
                .description("Duration of match batch operations")
                .register(registry);
        for (MatchReason reason : MatchReason.values()) {
            outcomeCounters.put(reason, Counter.builder("airwave.match.outcome")
                    .description("Number of match outcomes by reason")
                    .tag("reason", reason.name())
                    .register(registry));
        }
        this.batchSizeSummary = DistributionSummary.builder("airwave.batch.size")
                .description("Distribution of distinct pairs per match batch")
                .register(registry);
        this.bridgeCacheHitCounter = Counter.builder("airwave.bridge.cache.hit")
                .description("Identity bridge lookups served from the in-process cache")
                .register(registry);
        this.bridgeCacheMissCounter = Counter.builder("airwave.bridge.cache.miss")
                .description("Identity bridge lookups that went to storage")
                .register(registry);
        this.bridgeCreatedCounter = Counter.builder("airwave.bridge.created")
                .description("Number of identity bridge entries created")
                .register(registry);
        this.indexDegradedCounter = Counter.builder("airwave.index.degraded")
                .description("Similarity index calls that failed or returned malformed results")
                .register(registry);
        this.worksPromotedCounter = Counter.builder("airwave.works.promoted")
                .description("Number of works promoted from recurring unmatched logs")
                .register(registry);
        this.logsLinkedCounter = Counter.builder("airwave.logs.linked")
                .description("Number of broadcast logs linked to a work")
                .register(registry);
        this.splitProposedCounter = Counter.builder("airwave.split.proposed")
                .description("Number of collaboration splits proposed for review")
                .register(registry);
    }

    @Override
    public void recordMatchBatchDuration(Duration duration) {
        batchDurationTimer.record(duration);
    }

    @Override
    public void incrementMatchOutcome(MatchReason reason) {
        outcomeCounters.get(reason).increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordBridgeCacheHit() {
        bridgeCacheHitCounter.increment();
    }

    @Override
    public void recordBridgeCacheMiss() {
        bridgeCacheMissCounter.increment();
    }

    @Override
    public void incrementBridgeCreated() {
        bridgeCreatedCounter.increment();
    }

    @Override
    public void incrementIndexDegraded() {
        indexDegradedCounter.increment();
    }

    @Override
    public void incrementWorksPromoted(int count) {
        worksPromotedCounter.increment(count);
    }

    @Override
    public void incrementLogsLinked(int count) {
        logsLinkedCounter.increment(count);
    }

    @Override
    public void incrementSplitProposed() {
        splitProposedCounter.increment();
    }
}
