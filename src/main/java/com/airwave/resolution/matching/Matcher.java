package com.airwave.resolution.matching;

import com.airwave.resolution.cache.DuplicateSignatureException;
import com.airwave.resolution.cache.IdentityBridgeCache;
import com.airwave.resolution.core.model.ArtistTitle;
import com.airwave.resolution.core.model.IdentityBridgeEntry;
import com.airwave.resolution.core.model.MatchReason;
import com.airwave.resolution.core.model.MatchResult;
import com.airwave.resolution.core.model.Recording;
import com.airwave.resolution.core.model.Work;
import com.airwave.resolution.index.IndexCandidate;
import com.airwave.resolution.index.SimilarityIndex;
import com.airwave.resolution.logging.LogContext;
import com.airwave.resolution.metrics.MetricsService;
import com.airwave.resolution.review.MatchReviewService;
import com.airwave.resolution.review.ReviewItem;
import com.airwave.resolution.rules.Normalizer;
import com.airwave.resolution.storage.CatalogRepository;
import com.airwave.resolution.storage.NormalizedPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves artist/title pairs to works through three stages: identity bridge,
 * exact catalog match, then similarity search. Each stage issues one storage or
 * index call for the whole batch and only sees the pairs earlier stages left open.
 */
public class Matcher {
    private static final Logger log = LoggerFactory.getLogger(Matcher.class);

    static final double EXACT_MATCH_CONFIDENCE = 1.0;

    private final IdentityBridgeCache bridgeCache;
    private final CatalogRepository catalogRepository;
    private final SimilarityIndex similarityIndex;
    private final CandidateEvaluator evaluator;
    private final ThresholdSettings thresholdSettings;
    private final MatchReviewService reviewService;
    private final MetricsService metricsService;
    private final int candidateLimit;

    public Matcher(IdentityBridgeCache bridgeCache, CatalogRepository catalogRepository,
                   SimilarityIndex similarityIndex, CandidateEvaluator evaluator,
                   ThresholdSettings thresholdSettings, MatchReviewService reviewService,
                   MetricsService metricsService, int candidateLimit) {
        this.bridgeCache = Objects.requireNonNull(bridgeCache, "bridgeCache is required");
        this.catalogRepository = Objects.requireNonNull(catalogRepository, "catalogRepository is required");
        this.similarityIndex = Objects.requireNonNull(similarityIndex, "similarityIndex is required");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator is required");
        this.thresholdSettings = Objects.requireNonNull(thresholdSettings, "thresholdSettings is required");
        this.reviewService = Objects.requireNonNull(reviewService, "reviewService is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        if (candidateLimit <= 0) {
            throw new IllegalArgumentException("candidateLimit must be positive");
        }
        this.candidateLimit = candidateLimit;
    }

    /**
     * Matches a single pair.
     *
     * @throws DuplicateSignatureException if recording the pair's bridge hit an integrity conflict
     */
    public MatchResult findMatch(String artist, String title) {
        ArtistTitle pair = ArtistTitle.of(artist, title);
        BatchMatchResult result = matchBatch(List.of(pair));
        DuplicateSignatureException error = result.integrityErrors().get(pair);
        if (error != null) {
            throw error;
        }
        return result.outcomes().get(pair);
    }

    /**
     * Matches a batch of pairs. Duplicate pairs collapse to one key. An integrity
     * error fails only its own pair.
     */
    public BatchMatchResult matchBatch(Collection<ArtistTitle> pairs) {
        long start = System.nanoTime();
        MatchThresholds thresholds = thresholdSettings.current();
        Set<ArtistTitle> distinct = new LinkedHashSet<>(pairs);

        Map<ArtistTitle, MatchResult> outcomes = new LinkedHashMap<>();
        Map<ArtistTitle, DuplicateSignatureException> errors = new LinkedHashMap<>();
        if (distinct.isEmpty()) {
            return new BatchMatchResult(outcomes, errors);
        }

        try (LogContext ctx = LogContext.forMatchBatch(LogContext.generateBatchId(), distinct.size())) {
            Map<ArtistTitle, Query> queries = new LinkedHashMap<>();
            for (ArtistTitle pair : distinct) {
                Query query = Query.of(pair);
                if (query.isBlank()) {
                    outcomes.put(pair, MatchResult.noMatch());
                } else {
                    queries.put(pair, query);
                }
            }

            List<ArtistTitle> open = bridgeStage(queries, outcomes);
            open = exactStage(open, queries, outcomes, errors);
            similarityStage(open, queries, thresholds, outcomes);

            metricsService.recordBatchSize(distinct.size());
            outcomes.values().forEach(result -> metricsService.incrementMatchOutcome(result.reason()));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordMatchBatchDuration(elapsed);

            int matched = (int) outcomes.values().stream().filter(MatchResult::isMatched).count();
            log.info("match.batch.completed pairs={} matched={} unmatched={} integrityErrors={} durationMs={}",
                    distinct.size(), matched, outcomes.size() - matched, errors.size(), elapsed.toMillis());
        }

        // Re-key in input order
        Map<ArtistTitle, MatchResult> ordered = new LinkedHashMap<>();
        for (ArtistTitle pair : distinct) {
            MatchResult result = outcomes.get(pair);
            if (result != null) {
                ordered.put(pair, result);
            }
        }
        return new BatchMatchResult(ordered, errors);
    }

    /**
     * Explains how each pair would be matched under the current thresholds.
     */
    public Map<ArtistTitle, MatchExplanation> explainBatch(Collection<ArtistTitle> pairs) {
        return explainBatch(pairs, thresholdSettings.current());
    }

    /**
     * Explains how each pair would be matched under the given thresholds, listing
     * every scored candidate. Nothing is written: no bridge is recorded and no
     * review item is queued.
     */
    public Map<ArtistTitle, MatchExplanation> explainBatch(Collection<ArtistTitle> pairs,
                                                           MatchThresholds thresholds) {
        Objects.requireNonNull(thresholds, "thresholds are required");
        Map<ArtistTitle, Query> queries = new LinkedHashMap<>();
        Map<ArtistTitle, MatchExplanation> explanations = new LinkedHashMap<>();
        for (ArtistTitle pair : new LinkedHashSet<>(pairs)) {
            Query query = Query.of(pair);
            if (query.isBlank()) {
                explanations.put(pair, new MatchExplanation(pair, MatchReason.NO_MATCH, null, List.of()));
            } else {
                queries.put(pair, query);
            }
        }
        if (queries.isEmpty()) {
            return explanations;
        }

        Set<String> signatures = new LinkedHashSet<>();
        queries.values().forEach(query -> signatures.add(query.signature()));
        Map<String, IdentityBridgeEntry> bridges = bridgeCache.lookupAll(signatures);
        List<ArtistTitle> open = new ArrayList<>();
        for (Map.Entry<ArtistTitle, Query> entry : queries.entrySet()) {
            IdentityBridgeEntry bridge = bridges.get(entry.getValue().signature());
            if (bridge != null) {
                explanations.put(entry.getKey(), new MatchExplanation(entry.getKey(),
                        MatchReason.IDENTITY_BRIDGE, bridge.getWorkId(), List.of()));
            } else {
                open.add(entry.getKey());
            }
        }

        if (!open.isEmpty()) {
            Set<NormalizedPair> keys = new LinkedHashSet<>();
            open.forEach(pair -> keys.add(queries.get(pair).normalized()));
            Map<NormalizedPair, Work> exact = catalogRepository.findExactMatches(keys);
            CandidateRows rows = loadCandidates(open, queries);
            for (int i = 0; i < open.size(); i++) {
                ArtistTitle pair = open.get(i);
                Query query = queries.get(pair);
                explanations.put(pair, explain(pair, query, exact.get(query.normalized()), rows, i, thresholds));
            }
        }
        log.info("match.explain.completed pairs={} bridged={}", explanations.size(),
                queries.size() - open.size());

        Map<ArtistTitle, MatchExplanation> ordered = new LinkedHashMap<>();
        for (ArtistTitle pair : pairs) {
            ordered.putIfAbsent(pair, explanations.get(pair));
        }
        return ordered;
    }

    private MatchExplanation explain(ArtistTitle pair, Query query, Work exactWork, CandidateRows rows, int index,
                                     MatchThresholds thresholds) {
        Set<Long> rejectedWorkIds = rows.rejectedFor(query.signature());
        List<CandidateExplanation> candidates = new ArrayList<>();
        MatchReason reason = exactWork != null ? MatchReason.EXACT_MATCH : null;
        Long workId = exactWork != null ? exactWork.getId() : null;

        for (IndexCandidate candidate : rows.hitsAt(index)) {
            Recording recording = rows.recordings().get(candidate.recordingId());
            Work work = recording != null ? rows.works().get(recording.getWorkId()) : null;
            if (work == null) {
                continue;
            }
            CandidateEvaluation evaluation = evaluator.evaluate(query.normalized().artist(),
                    query.normalized().title(), work, candidate.distance(), thresholds);
            boolean rejected = rejectedWorkIds.contains(work.getId());
            candidates.add(new CandidateExplanation(recording.getId(), work.getId(), work.getPrimaryArtist(),
                    recording.getTitle(), evaluation.artistSimilarity(), evaluation.titleSimilarity(),
                    evaluation.distance(), evaluation.verdict(), rejected,
                    MatchQualityAnalyzer.analyze(pair.title(), recording.getTitle()),
                    MatchQualityAnalyzer.detectEdgeCase(evaluation.artistSimilarity(),
                            evaluation.titleSimilarity(), thresholds).orElse(null)));

            if (reason == null && !rejected) {
                switch (evaluation.verdict()) {
                    case VARIANT:
                        reason = MatchReason.VARIANT_MATCH;
                        workId = work.getId();
                        break;
                    case VECTOR:
                        reason = MatchReason.VECTOR_MATCH;
                        workId = work.getId();
                        break;
                    case REVIEW:
                        reason = MatchReason.NEEDS_REVIEW;
                        break;
                    default:
                        break;
                }
            }
        }
        return new MatchExplanation(pair, reason != null ? reason : MatchReason.NO_MATCH, workId, candidates);
    }

    private List<ArtistTitle> bridgeStage(Map<ArtistTitle, Query> queries, Map<ArtistTitle, MatchResult> outcomes) {
        Set<String> signatures = new LinkedHashSet<>();
        queries.values().forEach(query -> signatures.add(query.signature()));
        Map<String, IdentityBridgeEntry> bridges = bridgeCache.lookupAll(signatures);

        List<ArtistTitle> open = new ArrayList<>();
        for (Map.Entry<ArtistTitle, Query> entry : queries.entrySet()) {
            IdentityBridgeEntry bridge = bridges.get(entry.getValue().signature());
            if (bridge != null) {
                outcomes.put(entry.getKey(), MatchResult.matched(bridge.getWorkId(),
                        MatchReason.IDENTITY_BRIDGE, bridge.getConfidence()));
                log.debug("match.bridge pair={} workId={}", entry.getKey(), bridge.getWorkId());
            } else {
                open.add(entry.getKey());
            }
        }
        return open;
    }

    private List<ArtistTitle> exactStage(List<ArtistTitle> open, Map<ArtistTitle, Query> queries,
                                         Map<ArtistTitle, MatchResult> outcomes,
                                         Map<ArtistTitle, DuplicateSignatureException> errors) {
        if (open.isEmpty()) {
            return open;
        }
        Set<NormalizedPair> keys = new LinkedHashSet<>();
        open.forEach(pair -> keys.add(queries.get(pair).normalized()));
        Map<NormalizedPair, Work> exact = catalogRepository.findExactMatches(keys);

        List<ArtistTitle> remaining = new ArrayList<>();
        for (ArtistTitle pair : open) {
            Query query = queries.get(pair);
            Work work = exact.get(query.normalized());
            if (work == null) {
                remaining.add(pair);
                continue;
            }
            try {
                bridgeCache.record(query.signature(), pair.artist(), pair.title(), work.getId(),
                        EXACT_MATCH_CONFIDENCE);
                outcomes.put(pair, MatchResult.matched(work.getId(), MatchReason.EXACT_MATCH,
                        EXACT_MATCH_CONFIDENCE));
                log.debug("match.exact pair={} workId={}", pair, work.getId());
            } catch (DuplicateSignatureException e) {
                errors.put(pair, e);
            }
        }
        return remaining;
    }

    private void similarityStage(List<ArtistTitle> open, Map<ArtistTitle, Query> queries,
                                 MatchThresholds thresholds, Map<ArtistTitle, MatchResult> outcomes) {
        if (open.isEmpty()) {
            return;
        }
        CandidateRows rows = loadCandidates(open, queries);
        for (int i = 0; i < open.size(); i++) {
            ArtistTitle pair = open.get(i);
            Query query = queries.get(pair);
            outcomes.put(pair, decide(pair, query, rows.hitsAt(i), rows.recordings(), rows.works(),
                    rows.rejectedFor(query.signature()), thresholds));
        }
    }

    /**
     * One index search, one recording lookup, one work lookup and one rejection
     * lookup for all open pairs.
     */
    private CandidateRows loadCandidates(List<ArtistTitle> open, Map<ArtistTitle, Query> queries) {
        List<ArtistTitle> cleanedQueries = new ArrayList<>(open.size());
        Set<String> signatures = new LinkedHashSet<>();
        for (ArtistTitle pair : open) {
            cleanedQueries.add(queries.get(pair).cleaned());
            signatures.add(queries.get(pair).signature());
        }
        List<List<IndexCandidate>> hits = similarityIndex.searchBatch(cleanedQueries, candidateLimit);

        Set<Long> recordingIds = new HashSet<>();
        hits.forEach(candidates -> candidates.forEach(c -> recordingIds.add(c.recordingId())));
        Map<Long, Recording> recordings = recordingIds.isEmpty()
                ? Map.of() : catalogRepository.findRecordingsByIds(recordingIds);
        Set<Long> workIds = new HashSet<>();
        recordings.values().forEach(recording -> workIds.add(recording.getWorkId()));
        Map<Long, Work> works = workIds.isEmpty() ? Map.of() : catalogRepository.findWorksByIds(workIds);
        return new CandidateRows(hits, recordings, works, reviewService.findRejectedCandidates(signatures));
    }

    private MatchResult decide(ArtistTitle pair, Query query, List<IndexCandidate> candidates,
                               Map<Long, Recording> recordings, Map<Long, Work> works,
                               Set<Long> rejectedWorkIds, MatchThresholds thresholds) {
        for (IndexCandidate candidate : candidates) {
            Recording recording = recordings.get(candidate.recordingId());
            Work work = recording != null ? works.get(recording.getWorkId()) : null;
            if (work == null) {
                log.debug("match.candidate.dangling recordingId={}", candidate.recordingId());
                continue;
            }
            if (rejectedWorkIds.contains(work.getId())) {
                log.debug("match.candidate.rejected pair={} workId={}", pair, work.getId());
                continue;
            }

            CandidateEvaluation evaluation = evaluator.evaluate(query.normalized().artist(),
                    query.normalized().title(), work, candidate.distance(), thresholds);
            switch (evaluation.verdict()) {
                case VARIANT:
                    log.debug("match.variant pair={} workId={} artist={} title={}", pair, work.getId(),
                            evaluation.artistSimilarity(), evaluation.titleSimilarity());
                    return MatchResult.matched(work.getId(), MatchReason.VARIANT_MATCH,
                            (evaluation.artistSimilarity() + evaluation.titleSimilarity()) / 2.0);
                case VECTOR:
                    log.debug("match.vector pair={} workId={} distance={} title={}", pair, work.getId(),
                            evaluation.distance(), evaluation.titleSimilarity());
                    return MatchResult.matched(work.getId(), MatchReason.VECTOR_MATCH,
                            Math.max(0.0, 1.0 - evaluation.distance()));
                case REVIEW:
                    ReviewItem item = reviewService.submitForReview(ReviewItem.builder()
                            .signature(query.signature())
                            .rawArtist(pair.artist())
                            .rawTitle(pair.title())
                            .candidateWorkId(work.getId())
                            .artistSimilarity(evaluation.artistSimilarity())
                            .titleSimilarity(evaluation.titleSimilarity())
                            .vectorDistance(evaluation.distance())
                            .build());
                    return MatchResult.needsReview("reviewItemId=" + item.getId());
                default:
                    break;
            }
        }
        return MatchResult.noMatch();
    }

    private record CandidateRows(List<List<IndexCandidate>> hits, Map<Long, Recording> recordings,
                                 Map<Long, Work> works, Map<String, Set<Long>> rejected) {

        List<IndexCandidate> hitsAt(int index) {
            return index < hits.size() ? hits.get(index) : List.of();
        }

        Set<Long> rejectedFor(String signature) {
            return rejected.getOrDefault(signature, Set.of());
        }
    }

    /**
     * A pair's derived keys, computed once per batch.
     */
    private record Query(String signature, NormalizedPair normalized) {

        static Query of(ArtistTitle pair) {
            String artist = Normalizer.cleanArtist(pair.artist());
            String title = Normalizer.clean(pair.title());
            return new Query(artist + Normalizer.SIGNATURE_SEPARATOR + title, new NormalizedPair(artist, title));
        }

        boolean isBlank() {
            return normalized.artist().isEmpty() && normalized.title().isEmpty();
        }

        ArtistTitle cleaned() {
            return ArtistTitle.of(normalized.artist(), normalized.title());
        }
    }
}
