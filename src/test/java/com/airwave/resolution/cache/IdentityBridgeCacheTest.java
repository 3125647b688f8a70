package com.airwave.resolution.cache;

import com.airwave.resolution.audit.AuditAction;
import com.airwave.resolution.audit.AuditService;
import com.airwave.resolution.core.model.IdentityBridgeEntry;
import com.airwave.resolution.metrics.MicrometerMetricsService;
import com.airwave.resolution.metrics.NoOpMetricsService;
import com.airwave.resolution.storage.IdentityBridgeRepository;
import com.airwave.resolution.storage.InMemoryIdentityBridgeRepository;
import com.airwave.resolution.storage.UniqueConstraintViolationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

class IdentityBridgeCacheTest {

    private static final String SIGNATURE = "godsmack::voodoo";

    private InMemoryIdentityBridgeRepository repository;
    private AuditService auditService;
    private IdentityBridgeCache cache;

    @BeforeEach
    void setUp() {
        repository = new InMemoryIdentityBridgeRepository();
        auditService = new AuditService();
        cache = new IdentityBridgeCache(repository, auditService, new NoOpMetricsService(), CacheConfig.defaults());
    }

    @Nested
    @DisplayName("record")
    class RecordTests {

        @Test
        @DisplayName("Should create a bridge entry and audit it")
        void createsEntry() {
            IdentityBridgeEntry entry = cache.record(SIGNATURE, "GODSMACK", "Voodoo (Live)", 42L, 1.0);

            assertNotNull(entry.getId());
            assertEquals(42L, entry.getWorkId());
            assertTrue(entry.isActive());
            assertEquals(Optional.of(42L), cache.lookup(SIGNATURE));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.BRIDGE_CREATED).size());
        }

        @Test
        @DisplayName("Recording the same mapping twice keeps one row")
        void idempotentForSameWork() {
            IdentityBridgeEntry first = cache.record(SIGNATURE, "GODSMACK", "Voodoo", 42L, 1.0);
            IdentityBridgeEntry second = cache.record(SIGNATURE, "Godsmack", "VOODOO", 42L, 0.8);

            assertEquals(first.getId(), second.getId());
            assertEquals(1, repository.size());
            assertEquals(1.0, second.getConfidence());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.BRIDGE_CREATED).size());
        }

        @Test
        @DisplayName("A different work for an active signature is an integrity error")
        void conflictingWork() {
            cache.record(SIGNATURE, "GODSMACK", "Voodoo", 42L, 1.0);

            DuplicateSignatureException e = assertThrows(DuplicateSignatureException.class,
                    () -> cache.record(SIGNATURE, "GODSMACK", "Voodoo", 7L, 1.0));
            assertEquals(SIGNATURE, e.getSignature());
            assertEquals(42L, e.getExistingWorkId());
            assertEquals(7L, e.getRequestedWorkId());
            assertEquals(Optional.of(42L), cache.lookup(SIGNATURE));
        }

        @Test
        @DisplayName("A revoked entry is returned and not replaced")
        void revokedEntryIsKept() {
            cache.record(SIGNATURE, "GODSMACK", "Voodoo", 42L, 1.0);
            cache.revoke(SIGNATURE, "curator");

            IdentityBridgeEntry entry = cache.record(SIGNATURE, "GODSMACK", "Voodoo", 7L, 1.0);

            assertTrue(entry.isRevoked());
            assertEquals(42L, entry.getWorkId());
            assertEquals(1, repository.size());
        }

        @Test
        @DisplayName("Losing an insert race re-reads the winner")
        void insertRaceRecovers() {
            IdentityBridgeRepository racing = mock(IdentityBridgeRepository.class);
            IdentityBridgeEntry winner = IdentityBridgeEntry.builder()
                    .id(1L).signature(SIGNATURE).workId(42L).confidence(1.0).build();
            when(racing.findBySignature(SIGNATURE)).thenReturn(Optional.empty(), Optional.of(winner));
            when(racing.insert(any())).thenThrow(new UniqueConstraintViolationException("identity_bridge_signature", SIGNATURE));

            IdentityBridgeCache racingCache = new IdentityBridgeCache(racing, auditService,
                    new NoOpMetricsService(), CacheConfig.defaults());

            assertSame(winner, racingCache.record(SIGNATURE, "GODSMACK", "Voodoo", 42L, 1.0));
            assertThrows(DuplicateSignatureException.class,
                    () -> racingCache.record(SIGNATURE, "GODSMACK", "Voodoo", 7L, 1.0));
            assertTrue(auditService.getEntriesByAction(AuditAction.BRIDGE_CREATED).isEmpty());
        }

        @Test
        @DisplayName("Concurrent writers of the same signature produce exactly one row")
        void concurrentWriters() throws Exception {
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<IdentityBridgeEntry>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return cache.record(SIGNATURE, "GODSMACK", "Voodoo", 42L, 1.0);
                    }));
                }
                start.countDown();
                for (Future<IdentityBridgeEntry> future : futures) {
                    assertEquals(42L, future.get(10, TimeUnit.SECONDS).getWorkId());
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(1, repository.size());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.BRIDGE_CREATED).size());
        }
    }

    @Nested
    @DisplayName("lookup")
    class LookupTests {

        @Test
        @DisplayName("Unknown signatures are absent")
        void unknown() {
            assertTrue(cache.lookup("nobody::nothing").isEmpty());
            assertTrue(cache.lookupAll(List.of("a::b", "c::d")).isEmpty());
        }

        @Test
        @DisplayName("Revoked entries are never returned")
        void revokedNotReturned() {
            repository.insert(IdentityBridgeEntry.builder()
                    .signature(SIGNATURE).workId(42L).confidence(1.0)
                    .revoked(true).revokedAt(Instant.now()).revokedBy("curator")
                    .build());

            assertTrue(cache.lookup(SIGNATURE).isEmpty());
            assertEquals(Set.of(SIGNATURE), cache.existingSignatures(List.of(SIGNATURE, "other::song")));
        }

        @Test
        @DisplayName("Misses are fetched with one repository call")
        void batchedMisses() {
            IdentityBridgeRepository spyRepository = spy(repository);
            IdentityBridgeCache spyCache = new IdentityBridgeCache(spyRepository, auditService,
                    new NoOpMetricsService(), CacheConfig.defaults());
            repository.insert(IdentityBridgeEntry.builder().signature("a::one").workId(1L).confidence(1.0).build());
            repository.insert(IdentityBridgeEntry.builder().signature("b::two").workId(2L).confidence(1.0).build());

            Map<String, IdentityBridgeEntry> found = spyCache.lookupAll(List.of("a::one", "b::two", "c::three"));

            assertEquals(2, found.size());
            verify(spyRepository, times(1)).findBySignatures(anyCollection());
        }

        @Test
        @DisplayName("Cached entries do not hit the repository again")
        void cachedHits() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            IdentityBridgeRepository spyRepository = spy(repository);
            IdentityBridgeCache meteredCache = new IdentityBridgeCache(spyRepository, auditService,
                    new MicrometerMetricsService(registry), CacheConfig.defaults());
            meteredCache.record(SIGNATURE, "GODSMACK", "Voodoo", 42L, 1.0);

            assertEquals(Optional.of(42L), meteredCache.lookup(SIGNATURE));
            assertEquals(Optional.of(42L), meteredCache.lookup(SIGNATURE));

            verify(spyRepository, never()).findBySignatures(anyCollection());
            assertEquals(2.0, registry.counter("airwave.bridge.cache.hit").count());
        }

        @Test
        @DisplayName("A disabled cache always reads the repository")
        void disabledCache() {
            IdentityBridgeRepository spyRepository = spy(repository);
            IdentityBridgeCache uncached = new IdentityBridgeCache(spyRepository, auditService,
                    new NoOpMetricsService(), CacheConfig.disabled());
            uncached.record(SIGNATURE, "GODSMACK", "Voodoo", 42L, 1.0);

            uncached.lookup(SIGNATURE);
            uncached.lookup(SIGNATURE);

            verify(spyRepository, times(2)).findBySignatures(anyCollection());
        }
    }

    @Nested
    @DisplayName("revoke")
    class RevokeTests {

        @Test
        @DisplayName("Revocation evicts the cached entry and is audited")
        void revokeEvicts() {
            cache.record(SIGNATURE, "GODSMACK", "Voodoo", 42L, 1.0);
            assertTrue(cache.lookup(SIGNATURE).isPresent());

            IdentityBridgeEntry revoked = cache.revoke(SIGNATURE, "curator");

            assertTrue(revoked.isRevoked());
            assertEquals("curator", revoked.getRevokedBy());
            assertTrue(cache.lookup(SIGNATURE).isEmpty());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.BRIDGE_REVOKED).size());
        }

        @Test
        @DisplayName("Revoking twice is a no-op")
        void revokeTwice() {
            cache.record(SIGNATURE, "GODSMACK", "Voodoo", 42L, 1.0);
            cache.revoke(SIGNATURE, "curator");
            cache.revoke(SIGNATURE, "someone-else");

            assertEquals("curator", repository.findBySignature(SIGNATURE).orElseThrow().getRevokedBy());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.BRIDGE_REVOKED).size());
        }

        @Test
        @DisplayName("A lookup that read the row before revocation does not re-cache it")
        void staleReadAfterRevoke() throws Exception {
            CountDownLatch rowRead = new CountDownLatch(1);
            CountDownLatch revoked = new CountDownLatch(1);
            InMemoryIdentityBridgeRepository slowReader = new InMemoryIdentityBridgeRepository() {
                @Override
                public Map<String, IdentityBridgeEntry> findBySignatures(Collection<String> signatures) {
                    Map<String, IdentityBridgeEntry> rows = super.findBySignatures(signatures);
                    if (Thread.currentThread().getName().startsWith("bridge-reader")) {
                        rowRead.countDown();
                        try {
                            revoked.await(10, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    return rows;
                }
            };
            slowReader.insert(IdentityBridgeEntry.builder().signature(SIGNATURE).workId(7L).confidence(1.0).build());
            IdentityBridgeCache racingCache = new IdentityBridgeCache(slowReader, auditService,
                    new NoOpMetricsService(), CacheConfig.defaults());

            ExecutorService executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "bridge-reader"));
            try {
                Future<Optional<Long>> reader = executor.submit(() -> racingCache.lookup(SIGNATURE));
                assertTrue(rowRead.await(10, TimeUnit.SECONDS));

                racingCache.revoke(SIGNATURE, "alice");
                revoked.countDown();

                assertEquals(Optional.of(7L), reader.get(10, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            assertTrue(racingCache.lookup(SIGNATURE).isEmpty());
        }

        @Test
        @DisplayName("Revoking an unknown signature fails")
        void revokeUnknown() {
            assertThrows(IllegalArgumentException.class, () -> cache.revoke("nobody::nothing", "curator"));
        }
    }

    @Test
    @DisplayName("Stats reflect hits and misses")
    void stats() {
        cache.record(SIGNATURE, "GODSMACK", "Voodoo", 42L, 1.0);
        cache.lookup(SIGNATURE);
        cache.lookup("a::b");

        CacheStats stats = cache.getStats();
        assertTrue(stats.hitCount() >= 1);
        assertTrue(stats.missCount() >= 1);
        assertEquals(1, stats.size());

        cache.invalidateAll();
        assertTrue(cache.lookup(SIGNATURE).isPresent());
    }
}
