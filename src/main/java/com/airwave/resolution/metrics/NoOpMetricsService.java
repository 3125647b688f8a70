package com.airwave.resolution.metrics;

import com.airwave.resolution.core.model.MatchReason;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchBatchDuration(Duration duration) {
    }

    @Override
    public void incrementMatchOutcome(MatchReason reason) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordBridgeCacheHit() {
    }

    @Override
    public void recordBridgeCacheMiss() {
    }

    @Override
    public void incrementBridgeCreated() {
    }

    @Override
    public void incrementIndexDegraded() {
    }

    @Override
    public void incrementWorksPromoted(int count) {
    }

    @Override
    public void incrementLogsLinked(int count) {
    }

    @Override
    public void incrementSplitProposed() {
    }
}
