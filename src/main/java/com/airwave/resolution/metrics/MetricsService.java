package com.airwave.resolution.metrics;

import com.airwave.resolution.core.model.MatchReason;

import java.time.Duration;

/**
 * Interface for recording matching and resolution metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordMatchBatchDuration(Duration duration);

    void incrementMatchOutcome(MatchReason reason);

    void recordBatchSize(int size);

    void recordBridgeCacheHit();

    void recordBridgeCacheMiss();

    void incrementBridgeCreated();

    void incrementIndexDegraded();

    void incrementWorksPromoted(int count);

    void incrementLogsLinked(int count);

    void incrementSplitProposed();
}
