package com.airwave.resolution.matching;

import com.airwave.resolution.audit.AuditAction;
import com.airwave.resolution.audit.AuditService;
import com.airwave.resolution.cache.DuplicateSignatureException;
import com.airwave.resolution.cache.IdentityBridgeCache;
import com.airwave.resolution.core.model.ArtistTitle;
import com.airwave.resolution.core.model.BroadcastLog;
import com.airwave.resolution.core.model.MatchResult;
import com.airwave.resolution.core.model.Recording;
import com.airwave.resolution.core.model.VersionedTitle;
import com.airwave.resolution.core.model.Work;
import com.airwave.resolution.index.IndexDocument;
import com.airwave.resolution.index.SimilarityIndex;
import com.airwave.resolution.logging.LogContext;
import com.airwave.resolution.metrics.MetricsService;
import com.airwave.resolution.review.ReviewQueue;
import com.airwave.resolution.rules.Normalizer;
import com.airwave.resolution.storage.BroadcastLogRepository;
import com.airwave.resolution.storage.CatalogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Turns recurring unmatched broadcast pairs into catalog entries.
 * A signature qualifies when it has been played often enough, has never been
 * bridged (not even to a since-revoked work), does not match the catalog and is
 * not waiting for review. Each promotion creates a Work, a placeholder Recording
 * without audio and a bridge entry, so running it twice promotes nothing new.
 * Concurrent scans claim a signature before creating anything for it, so at
 * most one of them writes catalog rows for that signature.
 */
public class CatalogPromoter {
    private static final Logger log = LoggerFactory.getLogger(CatalogPromoter.class);

    private final BroadcastLogRepository logRepository;
    private final CatalogRepository catalogRepository;
    private final SimilarityIndex similarityIndex;
    private final IdentityBridgeCache bridgeCache;
    private final Matcher matcher;
    private final ReviewQueue reviewQueue;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final int minOccurrences;
    private final double promotionConfidence;
    private final ConcurrentMap<String, Boolean> promotionsInFlight = new ConcurrentHashMap<>();

    public CatalogPromoter(BroadcastLogRepository logRepository, CatalogRepository catalogRepository,
                           SimilarityIndex similarityIndex, IdentityBridgeCache bridgeCache, Matcher matcher,
                           ReviewQueue reviewQueue, AuditService auditService, MetricsService metricsService,
                           int minOccurrences, double promotionConfidence) {
        this.logRepository = Objects.requireNonNull(logRepository, "logRepository is required");
        this.catalogRepository = Objects.requireNonNull(catalogRepository, "catalogRepository is required");
        this.similarityIndex = Objects.requireNonNull(similarityIndex, "similarityIndex is required");
        this.bridgeCache = Objects.requireNonNull(bridgeCache, "bridgeCache is required");
        this.matcher = Objects.requireNonNull(matcher, "matcher is required");
        this.reviewQueue = Objects.requireNonNull(reviewQueue, "reviewQueue is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.minOccurrences = minOccurrences;
        this.promotionConfidence = promotionConfidence;
    }

    /**
     * @return the number of works created
     */
    public int scanAndPromote() {
        try (LogContext ctx = LogContext.forPromotion(LogContext.generateBatchId())) {
            Map<String, SignatureGroup> groups = groupUnlinkedLogs();
            List<SignatureGroup> frequent = new ArrayList<>();
            for (SignatureGroup group : groups.values()) {
                if (group.count >= minOccurrences) {
                    frequent.add(group);
                }
            }
            if (frequent.isEmpty()) {
                log.info("promotion.completed signatures={} eligible=0 promoted=0", groups.size());
                return 0;
            }

            Set<String> frequentSignatures = new HashSet<>();
            frequent.forEach(group -> frequentSignatures.add(group.signature));
            Set<String> bridged = bridgeCache.existingSignatures(frequentSignatures);
            List<SignatureGroup> unbridged = new ArrayList<>();
            for (SignatureGroup group : frequent) {
                if (!bridged.contains(group.signature)) {
                    unbridged.add(group);
                }
            }

            List<ArtistTitle> pairs = new ArrayList<>(unbridged.size());
            unbridged.forEach(group -> pairs.add(group.display));
            BatchMatchResult matches = matcher.matchBatch(pairs);

            int promoted = 0;
            for (SignatureGroup group : unbridged) {
                MatchResult result = matches.outcomes().get(group.display);
                if (result == null || result.isMatched() || result.requiresReview()) {
                    continue;
                }
                if (reviewQueue.findPendingBySignature(group.signature).isPresent()) {
                    continue;
                }
                if (promote(group)) {
                    promoted++;
                }
            }

            metricsService.incrementWorksPromoted(promoted);
            log.info("promotion.completed signatures={} eligible={} promoted={}",
                    groups.size(), unbridged.size(), promoted);
            return promoted;
        }
    }

    private boolean promote(SignatureGroup group) {
        if (promotionsInFlight.putIfAbsent(group.signature, Boolean.TRUE) != null) {
            log.debug("promotion.skipped signature='{}' reason=in_flight", group.signature);
            return false;
        }
        try {
            // Another scan may have bridged the signature after this one matched it
            if (!bridgeCache.existingSignatures(Set.of(group.signature)).isEmpty()) {
                log.debug("promotion.skipped signature='{}' reason=already_bridged", group.signature);
                return false;
            }
            return createCatalogEntries(group);
        } finally {
            promotionsInFlight.remove(group.signature);
        }
    }

    private boolean createCatalogEntries(SignatureGroup group) {
        String rawArtist = group.display.artist().trim();
        VersionedTitle versioned = Normalizer.extractVersionType(group.display.title());

        Work work = catalogRepository.createWork(Work.builder()
                .title(versioned.title())
                .primaryArtist(rawArtist)
                .build());
        Recording recording = catalogRepository.createRecording(Recording.builder()
                .workId(work.getId())
                .title(group.display.title().trim())
                .versionType(versioned.versionType())
                .verified(false)
                .hasAudioFile(false)
                .build());
        similarityIndex.add(new IndexDocument(recording.getId(), rawArtist, recording.getTitle()));

        try {
            bridgeCache.record(group.signature, group.display.artist(), group.display.title(),
                    work.getId(), promotionConfidence);
        } catch (DuplicateSignatureException e) {
            log.error("promotion.bridge.conflict signature='{}' workId={} existingWorkId={}",
                    group.signature, work.getId(), e.getExistingWorkId());
            return false;
        }

        auditService.record(AuditAction.WORK_PROMOTED, String.valueOf(work.getId()), null, Map.of(
                "signature", group.signature,
                "plays", group.count,
                "recordingId", recording.getId(),
                "versionType", versioned.versionType()));
        log.info("work.promoted workId={} recordingId={} signature='{}' plays={} versionType={}",
                work.getId(), recording.getId(), group.signature, group.count, versioned.versionType());
        return true;
    }

    private Map<String, SignatureGroup> groupUnlinkedLogs() {
        Map<String, SignatureGroup> groups = new LinkedHashMap<>();
        for (BroadcastLog broadcastLog : logRepository.findUnlinked()) {
            String artist = broadcastLog.getRawArtist();
            String title = broadcastLog.getRawTitle();
            if (artist == null || artist.isBlank() || title == null || title.isBlank()) {
                continue;
            }
            String signature = Normalizer.generateSignature(artist, title);
            // The first raw spelling seen becomes the display form
            groups.computeIfAbsent(signature, s -> new SignatureGroup(s, ArtistTitle.of(artist, title))).count++;
        }
        return groups;
    }

    private static final class SignatureGroup {
        private final String signature;
        private final ArtistTitle display;
        private int count;

        private SignatureGroup(String signature, ArtistTitle display) {
            this.signature = signature;
            this.display = display;
        }
    }
}
