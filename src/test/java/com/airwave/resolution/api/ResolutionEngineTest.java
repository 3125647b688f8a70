package com.airwave.resolution.api;

import com.airwave.resolution.audit.AuditAction;
import com.airwave.resolution.core.model.ArtistTitle;
import com.airwave.resolution.core.model.BroadcastLog;
import com.airwave.resolution.core.model.IdentityBridgeEntry;
import com.airwave.resolution.core.model.MatchReason;
import com.airwave.resolution.core.model.MatchResult;
import com.airwave.resolution.core.model.Recording;
import com.airwave.resolution.core.model.Work;
import com.airwave.resolution.index.InMemorySimilarityIndex;
import com.airwave.resolution.matching.BatchMatchResult;
import com.airwave.resolution.matching.CandidateVerdict;
import com.airwave.resolution.matching.MatchExplanation;
import com.airwave.resolution.matching.MatchThresholds;
import com.airwave.resolution.metrics.MicrometerMetricsService;
import com.airwave.resolution.storage.InMemoryBroadcastLogRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ResolutionEngineTest {

    private InMemorySimilarityIndex index;
    private InMemoryBroadcastLogRepository logs;
    private SimpleMeterRegistry registry;
    private ResolutionEngine engine;

    @BeforeEach
    void setUp() {
        index = spy(new InMemorySimilarityIndex());
        logs = new InMemoryBroadcastLogRepository();
        registry = new SimpleMeterRegistry();
        engine = ResolutionEngine.builder()
                .options(MatchingOptions.builder().sourceSystem("wxyz-ingest").build())
                .similarityIndex(index)
                .broadcastLogRepository(logs)
                .metricsService(new MicrometerMetricsService(registry))
                .build();
    }

    private BroadcastLog play(String artist, String title) {
        return engine.recordBroadcast(BroadcastLog.builder()
                .stationId(1L)
                .playedAt(Instant.now())
                .rawArtist(artist)
                .rawTitle(title)
                .build());
    }

    @Nested
    @DisplayName("Matching")
    class MatchingTests {

        @Test
        @DisplayName("A registered work matches exactly, then through its bridge without the index")
        void exactThenBridge() {
            Recording voodoo = engine.registerWork(Work.builder().primaryArtist("Godsmack").title("Voodoo").build());
            assertTrue(voodoo.isVerified());
            assertEquals(1, index.size());

            MatchResult first = engine.findMatch("GODSMACK", "Voodoo (Live) feat. Someone");
            assertEquals(MatchReason.EXACT_MATCH, first.reason());
            assertEquals("Exact Match", first.label());

            clearInvocations(index);
            MatchResult second = engine.findMatch("GODSMACK", "Voodoo (Live) feat. Someone");
            assertEquals(MatchReason.IDENTITY_BRIDGE, second.reason());
            assertEquals(voodoo.getWorkId(), second.workId());
            verifyNoInteractions(index);
            assertEquals(1.0, registry.get("airwave.bridge.created").counter().count());
        }

        @Test
        @DisplayName("Batches return one outcome per distinct pair")
        void batch() {
            engine.registerWork(Work.builder().primaryArtist("Metallica").title("One").build());

            BatchMatchResult result = engine.matchBatch(List.of(
                    ArtistTitle.of("Metallica", "One"),
                    ArtistTitle.of("Metallica", "One"),
                    ArtistTitle.of("Nobody", "Nothing")));

            assertEquals(2, result.size());
            assertEquals(1, result.matchedCount());
            assertEquals(MatchReason.NO_MATCH, result.get("Nobody", "Nothing").orElseThrow().reason());
        }

        @Test
        @DisplayName("Threshold changes apply to the next match")
        void runtimeThresholds() {
            engine.registerWork(Work.builder().primaryArtist("Metallica").title("Enter Sandman").build());
            assertEquals(MatchReason.VARIANT_MATCH, engine.findMatch("Metalica", "Enter Sandmann").reason());

            engine.getThresholdSettings().update(MatchThresholds.builder()
                    .variantArtistScore(0.99)
                    .variantTitleScore(0.99)
                    .aliasArtistScore(0.99)
                    .aliasTitleScore(0.99)
                    .vectorStrongDistance(0.0)
                    .build());

            assertEquals(MatchReason.NO_MATCH, engine.findMatch("Metalica", "Enter Sandmann").reason());
        }

        @Test
        @DisplayName("Explaining a pair under trial thresholds links nothing")
        void explainWithTrialThresholds() {
            engine.registerWork(Work.builder().primaryArtist("Metallica").title("Enter Sandman").build());
            ArtistTitle pair = ArtistTitle.of("Metalica", "Enter Sandmann");
            MatchThresholds strict = MatchThresholds.builder()
                    .variantArtistScore(0.99)
                    .variantTitleScore(0.99)
                    .aliasArtistScore(0.99)
                    .aliasTitleScore(0.99)
                    .vectorStrongDistance(0.0)
                    .build();

            MatchExplanation active = engine.explainBatch(List.of(pair), null).get(pair);
            MatchExplanation trial = engine.explainBatch(List.of(pair), strict).get(pair);

            assertEquals(MatchReason.VARIANT_MATCH, active.reason());
            assertEquals(MatchReason.NO_MATCH, trial.reason());
            assertEquals(CandidateVerdict.REJECT, trial.candidates().get(0).verdict());
            assertEquals(0.0, registry.get("airwave.bridge.created").counter().count());
            assertEquals(MatchReason.VARIANT_MATCH, engine.findMatch("Metalica", "Enter Sandmann").reason());
        }
    }

    @Nested
    @DisplayName("Catalog maintenance")
    class MaintenanceTests {

        @Test
        @DisplayName("Recurring unknown plays are promoted and their logs linked")
        void promoteAndLink() {
            play("Unknown Band", "New Song");
            play("Unknown Band", "New Song");
            BroadcastLog once = play("One Off", "Rarity");

            assertEquals(1, engine.scanAndPromote());
            assertEquals(2, engine.linkOrphanedLogs());

            List<BroadcastLog> unlinked = logs.findUnlinked();
            assertEquals(1, unlinked.size());
            assertEquals(once.getId(), unlinked.get(0).getId());
            assertEquals(0, engine.linkOrphanedLogs());
            assertEquals(1, engine.getAuditService().getEntriesByAction(AuditAction.WORK_PROMOTED).size());
        }

        @Test
        @DisplayName("Revoking a bridge sends the pair back through the pipeline")
        void revoke() {
            engine.registerWork(Work.builder().primaryArtist("Godsmack").title("Voodoo").build());
            engine.findMatch("Godsmack", "Voodoo");

            IdentityBridgeEntry revoked = engine.revokeBridge("godsmack::voodoo");

            assertTrue(revoked.isRevoked());
            assertEquals("wxyz-ingest", revoked.getRevokedBy());
            assertEquals(MatchReason.EXACT_MATCH, engine.findMatch("Godsmack", "Voodoo").reason());
            assertTrue(engine.getBridgeCache().lookup("godsmack::voodoo").isEmpty());
        }
    }

    @Nested
    @DisplayName("Identity")
    class IdentityTests {

        @Test
        @DisplayName("Collaborations are proposed and become aliases once approved")
        void splitLifecycle() {
            Map<String, String> names = engine.resolveArtists(List.of("Ozzy/Primus", "Prince"));
            assertEquals("Ozzy/Primus", names.get("Ozzy/Primus"));
            assertEquals("Prince", names.get("Prince"));
            assertEquals(1, engine.getSplitReviewService().pending().size());

            engine.getSplitReviewService().approve("Ozzy/Primus", "curator");

            assertEquals("Ozzy; Primus", engine.resolveArtists(List.of("Ozzy/Primus")).get("Ozzy/Primus"));
            assertTrue(engine.getSplitReviewService().pending().isEmpty());
        }
    }

    @Test
    void defaults() {
        ResolutionEngine plain = ResolutionEngine.builder().build();

        assertEquals(MatchReason.NO_MATCH, plain.findMatch("Anyone", "Anything").reason());
        assertEquals("SYSTEM", plain.getOptions().getSourceSystem());
        assertNotNull(plain.getMatchReviewService());
        assertNotNull(plain.getMetricsService());
    }
}
