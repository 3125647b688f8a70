package com.airwave.resolution.matching;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder for the thresholds in effect, swappable while the engine runs.
 * Each batch reads one snapshot, so a batch never sees a mix of old and new values.
 */
public class ThresholdSettings {
    private static final Logger log = LoggerFactory.getLogger(ThresholdSettings.class);

    private final AtomicReference<MatchThresholds> current;

    public ThresholdSettings() {
        this(MatchThresholds.defaults());
    }

    public ThresholdSettings(MatchThresholds initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial thresholds are required"));
    }

    public MatchThresholds current() {
        return current.get();
    }

    public MatchThresholds update(MatchThresholds thresholds) {
        Objects.requireNonNull(thresholds, "thresholds are required");
        MatchThresholds previous = current.getAndSet(thresholds);
        log.info("thresholds.updated previous={} current={}", previous, thresholds);
        return previous;
    }
}
