package com.airwave.resolution.cache;

import com.airwave.resolution.audit.AuditAction;
import com.airwave.resolution.audit.AuditService;
import com.airwave.resolution.core.model.IdentityBridgeEntry;
import com.airwave.resolution.metrics.MetricsService;
import com.airwave.resolution.storage.IdentityBridgeRepository;
import com.airwave.resolution.storage.UniqueConstraintViolationException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Signature to work mapping with at most one row per signature.
 * Active entries are held in a Caffeine cache in front of the repository;
 * revoked entries are never cached and never returned by lookups.
 */
public class IdentityBridgeCache {
    private static final Logger log = LoggerFactory.getLogger(IdentityBridgeCache.class);

    private final IdentityBridgeRepository repository;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final boolean enabled;
    private final Cache<String, IdentityBridgeEntry> cache;
    // Revocation is terminal; a read that started before it must not repopulate the cache
    private final Set<String> revokedSignatures = ConcurrentHashMap.newKeySet();

    public IdentityBridgeCache(IdentityBridgeRepository repository, AuditService auditService,
                               MetricsService metricsService, CacheConfig config) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.enabled = config.enabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("IdentityBridgeCache initialized: enabled={}, maxSize={}, ttl={}s",
                config.enabled(), config.maxSize(), config.ttlSeconds());
    }

    /**
     * Returns the work an active bridge entry maps the signature to.
     */
    public Optional<Long> lookup(String signature) {
        return Optional.ofNullable(lookupAll(List.of(signature)).get(signature))
                .map(IdentityBridgeEntry::getWorkId);
    }

    /**
     * Returns the active entries for the given signatures. Signatures not held in
     * memory are fetched with a single repository call.
     */
    public Map<String, IdentityBridgeEntry> lookupAll(Collection<String> signatures) {
        Map<String, IdentityBridgeEntry> found = new HashMap<>();
        List<String> misses = new ArrayList<>();
        for (String signature : new LinkedHashSet<>(signatures)) {
            IdentityBridgeEntry cached = enabled ? cache.getIfPresent(signature) : null;
            if (cached != null) {
                found.put(signature, cached);
                metricsService.recordBridgeCacheHit();
            } else {
                misses.add(signature);
                metricsService.recordBridgeCacheMiss();
            }
        }

        if (!misses.isEmpty()) {
            for (IdentityBridgeEntry entry : repository.findBySignatures(misses).values()) {
                if (entry.isActive()) {
                    found.put(entry.getSignature(), entry);
                    remember(entry);
                }
            }
        }
        return found;
    }

    /**
     * Returns the signatures that have any row, active or revoked.
     */
    public Set<String> existingSignatures(Collection<String> signatures) {
        if (signatures.isEmpty()) {
            return Set.of();
        }
        return Set.copyOf(repository.findBySignatures(signatures).keySet());
    }

    /**
     * Records a bridge from the signature to the work.
     * An active entry for the same work is returned unchanged. A revoked entry is
     * returned as is, since a human decided against it.
     *
     * @throws DuplicateSignatureException if an active entry maps the signature to another work
     */
    public IdentityBridgeEntry record(String signature, String referenceArtist, String referenceTitle,
                                      long workId, double confidence) {
        IdentityBridgeEntry cached = enabled ? cache.getIfPresent(signature) : null;
        if (cached != null) {
            return reconcile(cached, workId);
        }

        Optional<IdentityBridgeEntry> existing = repository.findBySignature(signature);
        if (existing.isPresent()) {
            return reconcile(existing.get(), workId);
        }

        IdentityBridgeEntry candidate = IdentityBridgeEntry.builder()
                .signature(signature)
                .referenceArtist(referenceArtist)
                .referenceTitle(referenceTitle)
                .workId(workId)
                .confidence(confidence)
                .build();

        IdentityBridgeEntry stored;
        try {
            stored = repository.insert(candidate);
        } catch (UniqueConstraintViolationException e) {
            log.debug("bridge.insert.conflict signature='{}', re-reading", signature);
            IdentityBridgeEntry winner = repository.findBySignature(signature)
                    .orElseThrow(() -> new IllegalStateException(
                            "Bridge row for '" + signature + "' conflicted on insert but cannot be read", e));
            return reconcile(winner, workId);
        }

        remember(stored);
        metricsService.incrementBridgeCreated();
        auditService.record(AuditAction.BRIDGE_CREATED, signature, null, Map.of(
                "workId", workId,
                "confidence", confidence,
                "referenceArtist", String.valueOf(referenceArtist),
                "referenceTitle", String.valueOf(referenceTitle)));
        log.info("bridge.created signature='{}' workId={} confidence={}", signature, workId, confidence);
        return stored;
    }

    /**
     * Revokes the entry for the signature. Revoking an already revoked entry is a no-op.
     *
     * @throws IllegalArgumentException if no entry exists for the signature
     */
    public IdentityBridgeEntry revoke(String signature, String actor) {
        IdentityBridgeEntry entry = repository.findBySignature(signature)
                .orElseThrow(() -> new IllegalArgumentException("Bridge entry not found: " + signature));
        if (entry.isRevoked()) {
            forget(signature);
            return entry;
        }

        IdentityBridgeEntry revoked = repository.update(entry.revoke(actor, Instant.now()));
        forget(signature);
        auditService.record(AuditAction.BRIDGE_REVOKED, signature, actor, Map.of("workId", entry.getWorkId()));
        log.info("bridge.revoked signature='{}' workId={} by={}", signature, entry.getWorkId(), actor);
        return revoked;
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    /**
     * Drops every in-memory entry; the repository is untouched.
     */
    public void invalidateAll() {
        cache.invalidateAll();
    }

    private IdentityBridgeEntry reconcile(IdentityBridgeEntry existing, long requestedWorkId) {
        if (existing.isRevoked()) {
            log.info("bridge.record.skipped signature='{}' reason=revoked revokedBy={} requestedWorkId={}",
                    existing.getSignature(), existing.getRevokedBy(), requestedWorkId);
            return existing;
        }
        if (existing.getWorkId() != requestedWorkId) {
            log.error("bridge.integrity.conflict signature='{}' existingWorkId={} requestedWorkId={}",
                    existing.getSignature(), existing.getWorkId(), requestedWorkId);
            throw new DuplicateSignatureException(existing.getSignature(), existing.getWorkId(), requestedWorkId);
        }
        remember(existing);
        return existing;
    }

    private void remember(IdentityBridgeEntry entry) {
        if (enabled && entry.isActive()) {
            cache.asMap().compute(entry.getSignature(),
                    (signature, current) -> revokedSignatures.contains(signature) ? null : entry);
        }
    }

    /**
     * Called after the revocation is stored. Any put that raced ahead of the marker
     * is removed by the invalidation that follows it.
     */
    private void forget(String signature) {
        revokedSignatures.add(signature);
        cache.invalidate(signature);
    }
}
