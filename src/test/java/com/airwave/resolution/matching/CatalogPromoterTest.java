package com.airwave.resolution.matching;

import com.airwave.resolution.audit.AuditAction;
import com.airwave.resolution.audit.AuditService;
import com.airwave.resolution.cache.CacheConfig;
import com.airwave.resolution.cache.IdentityBridgeCache;
import com.airwave.resolution.core.model.BroadcastLog;
import com.airwave.resolution.core.model.IdentityBridgeEntry;
import com.airwave.resolution.core.model.MatchReason;
import com.airwave.resolution.core.model.Recording;
import com.airwave.resolution.core.model.Work;
import com.airwave.resolution.index.GuardedSimilarityIndex;
import com.airwave.resolution.index.InMemorySimilarityIndex;
import com.airwave.resolution.index.IndexDocument;
import com.airwave.resolution.metrics.MetricsService;
import com.airwave.resolution.metrics.NoOpMetricsService;
import com.airwave.resolution.review.InMemoryReviewQueue;
import com.airwave.resolution.review.MatchReviewService;
import com.airwave.resolution.review.ReviewItem;
import com.airwave.resolution.similarity.RatcliffObershelpSimilarity;
import com.airwave.resolution.storage.InMemoryBroadcastLogRepository;
import com.airwave.resolution.storage.InMemoryCatalogRepository;
import com.airwave.resolution.storage.InMemoryIdentityBridgeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CatalogPromoterTest {

    private InMemoryBroadcastLogRepository logs;
    private InMemoryCatalogRepository catalog;
    private InMemoryIdentityBridgeRepository bridges;
    private InMemorySimilarityIndex index;
    private IdentityBridgeCache bridgeCache;
    private AuditService audit;
    private InMemoryReviewQueue reviewQueue;
    private MatchReviewService reviewService;
    private Matcher matcher;
    private CatalogPromoter promoter;

    @BeforeEach
    void setUp() {
        MetricsService metrics = new NoOpMetricsService();
        logs = new InMemoryBroadcastLogRepository();
        catalog = new InMemoryCatalogRepository();
        bridges = new InMemoryIdentityBridgeRepository();
        index = new InMemorySimilarityIndex();
        audit = new AuditService();
        bridgeCache = new IdentityBridgeCache(bridges, audit, metrics, CacheConfig.defaults());
        reviewQueue = new InMemoryReviewQueue();
        reviewService = new MatchReviewService(reviewQueue, bridgeCache, audit);
        GuardedSimilarityIndex guarded = new GuardedSimilarityIndex(index, metrics);
        matcher = new Matcher(bridgeCache, catalog, guarded,
                new CandidateEvaluator(new RatcliffObershelpSimilarity()), new ThresholdSettings(),
                reviewService, metrics, 10);
        promoter = new CatalogPromoter(logs, catalog, guarded, bridgeCache, matcher, reviewQueue, audit,
                metrics, 2, 0.8);
    }

    private void play(String artist, String title, int times) {
        for (int i = 0; i < times; i++) {
            logs.save(BroadcastLog.builder()
                    .stationId(1L)
                    .playedAt(Instant.now())
                    .rawArtist(artist)
                    .rawTitle(title)
                    .build());
        }
    }

    @Test
    @DisplayName("Recurring unmatched plays become a placeholder work with a bridge")
    void promotesRecurringPlays() {
        play("Godsmack", "Voodoo (Live at Hellfire)", 3);

        assertEquals(1, promoter.scanAndPromote());

        Work work = catalog.findAllWorks().get(0);
        assertEquals("Voodoo", work.getTitle());
        assertEquals("Godsmack", work.getPrimaryArtist());

        IdentityBridgeEntry bridge = bridges.findBySignature("godsmack::voodoo").orElseThrow();
        assertEquals(work.getId(), bridge.getWorkId());
        assertEquals(0.8, bridge.getConfidence());
        assertEquals(1, audit.getEntriesByAction(AuditAction.WORK_PROMOTED).size());

        Recording recording = catalog.findRecordingsByIds(List.of(1L)).get(1L);
        assertTrue(recording.isPlaceholder());
        assertEquals("Live", recording.getVersionType());
        assertEquals(1, index.size());
    }

    @Test
    @DisplayName("A second scan does not promote the same signature again")
    void idempotent() {
        play("Godsmack", "Voodoo (Live at Hellfire)", 3);

        assertEquals(1, promoter.scanAndPromote());
        assertEquals(0, promoter.scanAndPromote());
        assertEquals(1, catalog.countWorks());
        assertEquals(MatchReason.IDENTITY_BRIDGE, matcher.findMatch("GODSMACK", "Voodoo (Live at Hellfire)").reason());
    }

    @Test
    @DisplayName("Spelling variants of one signature are counted together")
    void groupsBySignature() {
        play("Godsmack", "Voodoo (Live)", 1);
        play("GODSMACK", "voodoo - live", 1);

        assertEquals(1, promoter.scanAndPromote());
        assertEquals("Godsmack", catalog.findAllWorks().get(0).getPrimaryArtist());
    }

    @Test
    @DisplayName("Plays below the occurrence threshold are left alone")
    void belowThreshold() {
        play("Godsmack", "Awake", 1);

        assertEquals(0, promoter.scanAndPromote());
        assertEquals(0, catalog.countWorks());
    }

    @Test
    @DisplayName("Plays that already match the catalog are not promoted")
    void alreadyMatching() {
        Work work = catalog.createWork(Work.builder().primaryArtist("Metallica").title("Enter Sandman").build());
        Recording recording = catalog.createRecording(Recording.builder().workId(work.getId()).title("Enter Sandman").build());
        index.add(new IndexDocument(recording.getId(), "Metallica", "Enter Sandman"));
        play("Metalica", "Enter Sandmann", 4);

        assertEquals(0, promoter.scanAndPromote());
        assertEquals(1, catalog.countWorks());
    }

    @Test
    @DisplayName("Logs with a blank artist or title are ignored")
    void blankLogs() {
        play("", "Untitled", 5);
        play("Somebody", "  ", 5);

        assertEquals(0, promoter.scanAndPromote());
    }

    @Test
    @DisplayName("A pair whose only candidate was rejected in review is promoted")
    void promotesAfterRejection() {
        Work work = catalog.createWork(Work.builder().primaryArtist("Prince").title("Purple Rain").build());
        Recording recording = catalog.createRecording(Recording.builder().workId(work.getId()).title("Purple Rain").build());
        index.add(new IndexDocument(recording.getId(), "Prince", "Purple Rain"));

        assertTrue(matcher.findMatch("Prins", "Purple Rain").requiresReview());
        ReviewItem item = reviewQueue.getPending(10).get(0);
        assertEquals(work.getId(), item.getCandidateWorkId());
        reviewService.reject(item.getId(), "curator", "different song");

        assertEquals(MatchReason.NO_MATCH, matcher.findMatch("Prins", "Purple Rain").reason());
        assertEquals(0, reviewQueue.countPending());

        play("Prins", "Purple Rain", 3);
        assertEquals(1, promoter.scanAndPromote());
        assertEquals(2, catalog.countWorks());
        assertEquals(0, reviewQueue.countPending());
    }

    @Test
    @DisplayName("Concurrent scans create one work per signature")
    void concurrentScans() throws Exception {
        CyclicBarrier bothScanned = new CyclicBarrier(2);
        InMemoryBroadcastLogRepository sharedLogs = new InMemoryBroadcastLogRepository() {
            @Override
            public List<BroadcastLog> findUnlinked() {
                List<BroadcastLog> unlinked = super.findUnlinked();
                try {
                    bothScanned.await(5, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException("scan did not overlap", e);
                }
                return unlinked;
            }
        };
        for (int i = 0; i < 3; i++) {
            sharedLogs.save(BroadcastLog.builder()
                    .stationId(1L)
                    .playedAt(Instant.now())
                    .rawArtist("Godsmack")
                    .rawTitle("Awake")
                    .build());
        }
        GuardedSimilarityIndex guarded = new GuardedSimilarityIndex(index, new NoOpMetricsService());
        CatalogPromoter racing = new CatalogPromoter(sharedLogs, catalog, guarded, bridgeCache, matcher,
                reviewQueue, audit, new NoOpMetricsService(), 2, 0.8);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<Integer>> scans = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                scans.add(executor.submit(racing::scanAndPromote));
            }
            int promoted = 0;
            for (Future<Integer> scan : scans) {
                promoted += scan.get(10, TimeUnit.SECONDS);
            }

            assertEquals(1, promoted);
            assertEquals(1, catalog.countWorks());
            assertEquals(1, index.size());
            assertEquals(1, audit.getEntriesByAction(AuditAction.WORK_PROMOTED).size());
        } finally {
            executor.shutdownNow();
        }
    }
}
