package com.airwave.resolution.metrics;

import com.airwave.resolution.core.model.MatchReason;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsService metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerMetricsService(registry);
    }

    @Test
    void matchOutcomesAreTaggedByReason() {
        metrics.incrementMatchOutcome(MatchReason.EXACT_MATCH);
        metrics.incrementMatchOutcome(MatchReason.EXACT_MATCH);
        metrics.incrementMatchOutcome(MatchReason.NO_MATCH);

        assertEquals(2.0, registry.get("airwave.match.outcome").tag("reason", MatchReason.EXACT_MATCH.name()).counter().count());
        assertEquals(1.0, registry.get("airwave.match.outcome").tag("reason", MatchReason.NO_MATCH.name()).counter().count());
    }

    @Test
    void countersAndTimers() {
        metrics.recordBridgeCacheHit();
        metrics.recordBridgeCacheMiss();
        metrics.incrementBridgeCreated();
        metrics.incrementIndexDegraded();
        metrics.incrementWorksPromoted(3);
        metrics.incrementLogsLinked(5);
        metrics.incrementSplitProposed();
        metrics.recordMatchBatchDuration(Duration.ofMillis(20));

        assertEquals(1.0, registry.get("airwave.bridge.cache.hit").counter().count());
        assertEquals(1.0, registry.get("airwave.bridge.cache.miss").counter().count());
        assertEquals(1.0, registry.get("airwave.bridge.created").counter().count());
        assertEquals(1.0, registry.get("airwave.index.degraded").counter().count());
        assertEquals(3.0, registry.get("airwave.works.promoted").counter().count());
        assertEquals(5.0, registry.get("airwave.logs.linked").counter().count());
        assertEquals(1.0, registry.get("airwave.split.proposed").counter().count());
        assertEquals(1, registry.get("airwave.match.batch.duration").timer().count());
    }

    @Test
    void noOpAcceptsEverything() {
        MetricsService noOp = new NoOpMetricsService();
        assertDoesNotThrow(() -> {
            noOp.incrementMatchOutcome(MatchReason.VECTOR_MATCH);
            noOp.recordBatchSize(10);
            noOp.incrementLogsLinked(2);
        });
    }
}
