package com.airwave.resolution.cdi;

import com.airwave.resolution.api.MatchingOptions;
import com.airwave.resolution.api.ResolutionEngine;
import com.airwave.resolution.cache.CacheConfig;
import com.airwave.resolution.identity.SplitReviewService;
import com.airwave.resolution.matching.MatchThresholds;
import com.airwave.resolution.matching.ThresholdSettings;
import com.airwave.resolution.metrics.MicrometerMetricsService;
import com.airwave.resolution.review.MatchReviewService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the matching engine from MicroProfile Config properties.
 *
 * <p>All keys are optional and live under {@code airwave.matching}:</p>
 * <pre>
 * airwave:
 *   matching:
 *     thresholds:
 *       variant-artist-score: 0.85
 *       variant-title-score: 0.80
 *       vector-strong-distance: 0.15
 *     candidate-limit: 10
 *     bridge-cache:
 *       max-size: 50000
 * </pre>
 *
 * <p>If the container provides a Micrometer {@link MeterRegistry}, engine metrics are published to it.</p>
 */
@ApplicationScoped
public class ResolutionEngineProducer {

    private static final Logger log = LoggerFactory.getLogger(ResolutionEngineProducer.class);

    // ── Thresholds ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "airwave.matching.thresholds.variant-artist-score", defaultValue = "0.85")
    double variantArtistScore;

    @Inject
    @ConfigProperty(name = "airwave.matching.thresholds.variant-title-score", defaultValue = "0.80")
    double variantTitleScore;

    @Inject
    @ConfigProperty(name = "airwave.matching.thresholds.alias-artist-score", defaultValue = "0.70")
    double aliasArtistScore;

    @Inject
    @ConfigProperty(name = "airwave.matching.thresholds.alias-title-score", defaultValue = "0.70")
    double aliasTitleScore;

    @Inject
    @ConfigProperty(name = "airwave.matching.thresholds.vector-strong-distance", defaultValue = "0.15")
    double vectorStrongDistance;

    @Inject
    @ConfigProperty(name = "airwave.matching.thresholds.vector-title-guard", defaultValue = "0.5")
    double vectorTitleGuard;

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "airwave.matching.candidate-limit", defaultValue = "10")
    int candidateLimit;

    @Inject
    @ConfigProperty(name = "airwave.matching.source-system", defaultValue = "SYSTEM")
    String sourceSystem;

    // ── Promotion and orphan linking ──────────────────────────

    @Inject
    @ConfigProperty(name = "airwave.matching.promotion.min-occurrences", defaultValue = "2")
    int promotionMinOccurrences;

    @Inject
    @ConfigProperty(name = "airwave.matching.promotion.confidence", defaultValue = "0.8")
    double promotionConfidence;

    @Inject
    @ConfigProperty(name = "airwave.matching.orphans.chunk-size", defaultValue = "500")
    int orphanChunkSize;

    // ── Bridge cache ──────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "airwave.matching.bridge-cache.enabled", defaultValue = "true")
    boolean bridgeCacheEnabled;

    @Inject
    @ConfigProperty(name = "airwave.matching.bridge-cache.max-size", defaultValue = "50000")
    int bridgeCacheMaxSize;

    @Inject
    @ConfigProperty(name = "airwave.matching.bridge-cache.ttl-seconds", defaultValue = "600")
    int bridgeCacheTtlSeconds;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ResolutionEngine resolutionEngine() {
        MatchingOptions options = matchingOptions();
        log.info("Producing ResolutionEngine: {}", options);

        ResolutionEngine.Builder builder = ResolutionEngine.builder().options(options);
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            builder.metricsService(new MicrometerMetricsService(meterRegistry.get()));
            log.info("Micrometer metrics enabled");
        } else {
            log.info("No MeterRegistry available, metrics disabled");
        }
        return builder.build();
    }

    @Produces
    @ApplicationScoped
    public MatchReviewService matchReviewService(ResolutionEngine engine) {
        return engine.getMatchReviewService();
    }

    @Produces
    @ApplicationScoped
    public SplitReviewService splitReviewService(ResolutionEngine engine) {
        return engine.getSplitReviewService();
    }

    @Produces
    @ApplicationScoped
    public ThresholdSettings thresholdSettings(ResolutionEngine engine) {
        return engine.getThresholdSettings();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    MatchingOptions matchingOptions() {
        MatchThresholds thresholds = MatchThresholds.builder()
                .variantArtistScore(variantArtistScore)
                .variantTitleScore(variantTitleScore)
                .aliasArtistScore(aliasArtistScore)
                .aliasTitleScore(aliasTitleScore)
                .vectorStrongDistance(vectorStrongDistance)
                .vectorTitleGuard(vectorTitleGuard)
                .build();

        return MatchingOptions.builder()
                .thresholds(thresholds)
                .candidateLimit(candidateLimit)
                .sourceSystem(sourceSystem)
                .promotionMinOccurrences(promotionMinOccurrences)
                .promotionConfidence(promotionConfidence)
                .orphanChunkSize(orphanChunkSize)
                .bridgeCache(new CacheConfig(bridgeCacheMaxSize, bridgeCacheTtlSeconds, bridgeCacheEnabled))
                .build();
    }
}
