package com.airwave.resolution.api;

import com.airwave.resolution.audit.AuditService;
import com.airwave.resolution.cache.IdentityBridgeCache;
import com.airwave.resolution.core.model.ArtistTitle;
import com.airwave.resolution.core.model.BroadcastLog;
import com.airwave.resolution.core.model.IdentityBridgeEntry;
import com.airwave.resolution.core.model.MatchResult;
import com.airwave.resolution.core.model.Recording;
import com.airwave.resolution.core.model.Work;
import com.airwave.resolution.identity.CollaborationSplitDetector;
import com.airwave.resolution.identity.IdentityResolver;
import com.airwave.resolution.identity.SplitReviewService;
import com.airwave.resolution.index.GuardedSimilarityIndex;
import com.airwave.resolution.index.InMemorySimilarityIndex;
import com.airwave.resolution.index.IndexDocument;
import com.airwave.resolution.index.SimilarityIndex;
import com.airwave.resolution.matching.BatchMatchResult;
import com.airwave.resolution.matching.CandidateEvaluator;
import com.airwave.resolution.matching.CatalogPromoter;
import com.airwave.resolution.matching.MatchExplanation;
import com.airwave.resolution.matching.MatchThresholds;
import com.airwave.resolution.matching.Matcher;
import com.airwave.resolution.matching.OrphanLogLinker;
import com.airwave.resolution.matching.ThresholdSettings;
import com.airwave.resolution.metrics.MetricsService;
import com.airwave.resolution.metrics.NoOpMetricsService;
import com.airwave.resolution.review.InMemoryReviewQueue;
import com.airwave.resolution.review.MatchReviewService;
import com.airwave.resolution.review.ReviewQueue;
import com.airwave.resolution.similarity.RatcliffObershelpSimilarity;
import com.airwave.resolution.similarity.SimilarityAlgorithm;
import com.airwave.resolution.storage.ArtistAliasRepository;
import com.airwave.resolution.storage.BroadcastLogRepository;
import com.airwave.resolution.storage.CatalogRepository;
import com.airwave.resolution.storage.IdentityBridgeRepository;
import com.airwave.resolution.storage.InMemoryArtistAliasRepository;
import com.airwave.resolution.storage.InMemoryBroadcastLogRepository;
import com.airwave.resolution.storage.InMemoryCatalogRepository;
import com.airwave.resolution.storage.InMemoryIdentityBridgeRepository;
import com.airwave.resolution.storage.InMemoryProposedSplitRepository;
import com.airwave.resolution.storage.ProposedSplitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Main entry point for airwave matching and identity resolution.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ResolutionEngine engine = ResolutionEngine.builder()
 *     .catalogRepository(catalog)
 *     .similarityIndex(index)
 *     .metricsService(new MicrometerMetricsService(registry))
 *     .build();
 *
 * // Match a batch of played pairs
 * BatchMatchResult result = engine.matchBatch(List.of(
 *     ArtistTitle.of("GODSMACK", "Voodoo (Live)"),
 *     ArtistTitle.of("Ozzy/Primus", "N.I.B.")));
 *
 * // Canonical artist names, filing split proposals for collaborations
 * Map&lt;String, String&gt; names = engine.resolveArtists(List.of("Ozzy/Primus"));
 *
 * // Periodic jobs
 * engine.scanAndPromote();
 * engine.linkOrphanedLogs();
 * </pre>
 */
public class ResolutionEngine {
    private static final Logger log = LoggerFactory.getLogger(ResolutionEngine.class);

    private final MatchingOptions options;
    private final CatalogRepository catalogRepository;
    private final BroadcastLogRepository logRepository;
    private final SimilarityIndex similarityIndex;
    private final IdentityBridgeCache bridgeCache;
    private final ThresholdSettings thresholdSettings;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Matcher matcher;
    private final CatalogPromoter catalogPromoter;
    private final OrphanLogLinker orphanLogLinker;
    private final IdentityResolver identityResolver;
    private final MatchReviewService matchReviewService;
    private final SplitReviewService splitReviewService;

    private ResolutionEngine(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.auditService = builder.auditService != null
                ? builder.auditService : new AuditService();

        // Storage
        this.catalogRepository = builder.catalogRepository != null
                ? builder.catalogRepository : new InMemoryCatalogRepository();
        this.logRepository = builder.logRepository != null
                ? builder.logRepository : new InMemoryBroadcastLogRepository();
        IdentityBridgeRepository bridgeRepository = builder.bridgeRepository != null
                ? builder.bridgeRepository : new InMemoryIdentityBridgeRepository();
        ArtistAliasRepository aliasRepository = builder.aliasRepository != null
                ? builder.aliasRepository : new InMemoryArtistAliasRepository();
        ProposedSplitRepository splitRepository = builder.splitRepository != null
                ? builder.splitRepository : new InMemoryProposedSplitRepository();

        // The index is external; every call goes through the guard
        SimilarityIndex index = builder.similarityIndex != null
                ? builder.similarityIndex : new InMemorySimilarityIndex();
        this.similarityIndex = new GuardedSimilarityIndex(index, metricsService);

        SimilarityAlgorithm similarity = builder.similarityAlgorithm != null
                ? builder.similarityAlgorithm : new RatcliffObershelpSimilarity();
        CollaborationSplitDetector detector = builder.splitDetector != null
                ? builder.splitDetector : new CollaborationSplitDetector();

        this.thresholdSettings = new ThresholdSettings(options.getThresholds());
        this.bridgeCache = new IdentityBridgeCache(bridgeRepository, auditService, metricsService,
                options.getBridgeCache());

        ReviewQueue reviewQueue = builder.reviewQueue != null
                ? builder.reviewQueue : new InMemoryReviewQueue();
        this.matchReviewService = new MatchReviewService(reviewQueue, bridgeCache, auditService);

        this.matcher = new Matcher(bridgeCache, catalogRepository, similarityIndex,
                new CandidateEvaluator(similarity), thresholdSettings, matchReviewService,
                metricsService, options.getCandidateLimit());
        this.catalogPromoter = new CatalogPromoter(logRepository, catalogRepository, similarityIndex,
                bridgeCache, matcher, reviewQueue, auditService, metricsService,
                options.getPromotionMinOccurrences(), options.getPromotionConfidence());
        this.orphanLogLinker = new OrphanLogLinker(logRepository, matcher, auditService, metricsService,
                options.getOrphanChunkSize());

        this.identityResolver = new IdentityResolver(aliasRepository, splitRepository, detector,
                auditService, metricsService);
        this.splitReviewService = new SplitReviewService(splitRepository, aliasRepository, auditService);

        log.info("ResolutionEngine initialized: {}", options);
    }

    // ========== Matching API ==========

    /**
     * Matches a single played pair.
     *
     * @throws com.airwave.resolution.cache.DuplicateSignatureException if the pair's
     *         signature is bridged to a different work than the one it matched
     */
    public MatchResult findMatch(String artist, String title) {
        return matcher.findMatch(artist, title);
    }

    /**
     * Matches a batch of played pairs with a bounded number of storage and index round trips.
     */
    public BatchMatchResult matchBatch(Collection<ArtistTitle> pairs) {
        return matcher.matchBatch(pairs);
    }

    /**
     * Explains how each pair would be matched without linking or queueing anything.
     * Thresholds left null fall back to the active ones, so a curator can try a
     * setting before applying it.
     */
    public Map<ArtistTitle, MatchExplanation> explainBatch(Collection<ArtistTitle> pairs, MatchThresholds thresholds) {
        return matcher.explainBatch(pairs, thresholds != null ? thresholds : thresholdSettings.current());
    }

    // ========== Identity API ==========

    /**
     * Resolves raw artist credits to display names, filing split proposals for
     * collaborations seen for the first time.
     */
    public Map<String, String> resolveArtists(Collection<String> rawArtists) {
        return identityResolver.resolveBatch(rawArtists);
    }

    // ========== Catalog API ==========

    /**
     * Adds a work with its original recording to the catalog and makes the recording searchable.
     *
     * @return the stored recording
     */
    public Recording registerWork(Work work) {
        Objects.requireNonNull(work, "work is required");
        Work created = catalogRepository.createWork(work);
        Recording recording = catalogRepository.createRecording(Recording.builder()
                .workId(created.getId())
                .title(created.getTitle())
                .verified(true)
                .build());
        similarityIndex.add(new IndexDocument(recording.getId(), created.getPrimaryArtist(), recording.getTitle()));
        log.debug("catalog.registered workId={} recordingId={}", created.getId(), recording.getId());
        return recording;
    }

    public BroadcastLog recordBroadcast(BroadcastLog broadcastLog) {
        return logRepository.save(broadcastLog);
    }

    /**
     * Creates works for frequently played pairs that match nothing.
     *
     * @return the number of works created
     */
    public int scanAndPromote() {
        return catalogPromoter.scanAndPromote();
    }

    /**
     * @return the number of broadcast logs linked to a work
     */
    public int linkOrphanedLogs() {
        return orphanLogLinker.linkOrphanedLogs();
    }

    /**
     * Revokes a bridge entry on behalf of the configured source system.
     */
    public IdentityBridgeEntry revokeBridge(String signature) {
        return bridgeCache.revoke(signature, options.getSourceSystem());
    }

    // ========== Accessors ==========

    public MatchReviewService getMatchReviewService() {
        return matchReviewService;
    }

    public SplitReviewService getSplitReviewService() {
        return splitReviewService;
    }

    public IdentityBridgeCache getBridgeCache() {
        return bridgeCache;
    }

    public ThresholdSettings getThresholdSettings() {
        return thresholdSettings;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public MatchingOptions getOptions() {
        return options;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ResolutionEngine. Every collaborator is optional and defaults
     * to its in-memory or no-op implementation.
     */
    public static class Builder {
        private MatchingOptions options = MatchingOptions.defaults();
        private CatalogRepository catalogRepository;
        private BroadcastLogRepository logRepository;
        private IdentityBridgeRepository bridgeRepository;
        private ArtistAliasRepository aliasRepository;
        private ProposedSplitRepository splitRepository;
        private SimilarityIndex similarityIndex;
        private SimilarityAlgorithm similarityAlgorithm;
        private CollaborationSplitDetector splitDetector;
        private ReviewQueue reviewQueue;
        private AuditService auditService;
        private MetricsService metricsService;

        private Builder() {
        }

        public Builder options(MatchingOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder catalogRepository(CatalogRepository catalogRepository) {
            this.catalogRepository = catalogRepository;
            return this;
        }

        public Builder broadcastLogRepository(BroadcastLogRepository logRepository) {
            this.logRepository = logRepository;
            return this;
        }

        public Builder identityBridgeRepository(IdentityBridgeRepository bridgeRepository) {
            this.bridgeRepository = bridgeRepository;
            return this;
        }

        public Builder artistAliasRepository(ArtistAliasRepository aliasRepository) {
            this.aliasRepository = aliasRepository;
            return this;
        }

        public Builder proposedSplitRepository(ProposedSplitRepository splitRepository) {
            this.splitRepository = splitRepository;
            return this;
        }

        public Builder similarityIndex(SimilarityIndex similarityIndex) {
            this.similarityIndex = similarityIndex;
            return this;
        }

        public Builder similarityAlgorithm(SimilarityAlgorithm similarityAlgorithm) {
            this.similarityAlgorithm = similarityAlgorithm;
            return this;
        }

        public Builder splitDetector(CollaborationSplitDetector splitDetector) {
            this.splitDetector = splitDetector;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public ResolutionEngine build() {
            return new ResolutionEngine(this);
        }
    }
}
