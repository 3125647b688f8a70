package com.airwave.resolution.identity;

import com.airwave.resolution.audit.AuditAction;
import com.airwave.resolution.audit.AuditService;
import com.airwave.resolution.core.model.ArtistAlias;
import com.airwave.resolution.core.model.ProposedSplit;
import com.airwave.resolution.logging.LogContext;
import com.airwave.resolution.metrics.MetricsService;
import com.airwave.resolution.storage.ArtistAliasRepository;
import com.airwave.resolution.storage.ProposedSplitRepository;
import com.airwave.resolution.storage.UniqueConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves raw artist credits to display names.
 *
 * <p>A name with an alias resolves to the alias. A name without one resolves to itself,
 * and if it looks like a collaboration a pending split proposal is filed for a human
 * to confirm. Resolution never changes because of a pending proposal.</p>
 *
 * <p>Each batch costs one alias query, plus one existence query and the inserts when
 * new collaborations are seen.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final ArtistAliasRepository aliasRepository;
    private final ProposedSplitRepository splitRepository;
    private final CollaborationSplitDetector detector;
    private final AuditService auditService;
    private final MetricsService metricsService;

    public IdentityResolver(ArtistAliasRepository aliasRepository, ProposedSplitRepository splitRepository,
                            CollaborationSplitDetector detector, AuditService auditService,
                            MetricsService metricsService) {
        this.aliasRepository = Objects.requireNonNull(aliasRepository, "aliasRepository is required");
        this.splitRepository = Objects.requireNonNull(splitRepository, "splitRepository is required");
        this.detector = Objects.requireNonNull(detector, "detector is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * @return a display name for every distinct non-null input, in input order
     */
    public Map<String, String> resolveBatch(Collection<String> rawArtists) {
        Set<String> unique = new LinkedHashSet<>();
        for (String raw : rawArtists) {
            if (raw != null) {
                unique.add(raw);
            }
        }
        Map<String, String> resolved = new LinkedHashMap<>();
        if (unique.isEmpty()) {
            return resolved;
        }

        try (LogContext ctx = LogContext.forResolveBatch(LogContext.generateBatchId(), unique.size())) {
            List<String> lookups = new ArrayList<>();
            for (String raw : unique) {
                if (!raw.isBlank()) {
                    lookups.add(raw);
                }
            }
            Map<String, ArtistAlias> aliases = lookups.isEmpty() ? Map.of() : aliasRepository.findByRawNames(lookups);

            Map<String, List<String>> detected = new LinkedHashMap<>();
            for (String raw : unique) {
                ArtistAlias alias = aliases.get(raw);
                if (alias != null) {
                    resolved.put(raw, alias.effectiveName());
                    continue;
                }
                resolved.put(raw, raw);
                if (!raw.isBlank()) {
                    Optional<List<String>> split = detector.detect(raw);
                    split.ifPresent(parts -> detected.put(raw, parts));
                }
            }

            int proposed = proposeSplits(detected);
            log.info("artists.resolved distinct={} aliased={} splitsProposed={}",
                    unique.size(), aliases.size(), proposed);
            return resolved;
        }
    }

    public String resolve(String rawArtist) {
        return resolveBatch(List.of(rawArtist)).get(rawArtist);
    }

    private int proposeSplits(Map<String, List<String>> detected) {
        if (detected.isEmpty()) {
            return 0;
        }
        Set<String> existing = splitRepository.findExistingRawArtists(detected.keySet());
        int proposed = 0;
        for (Map.Entry<String, List<String>> entry : detected.entrySet()) {
            String raw = entry.getKey();
            if (existing.contains(raw)) {
                continue;
            }
            ProposedSplit split = ProposedSplit.pending(raw, entry.getValue(), detector.confidenceFor(raw));
            try {
                splitRepository.insert(split);
            } catch (UniqueConstraintViolationException e) {
                // Another batch filed the same proposal first
                log.debug("split.already-proposed rawArtist='{}'", raw);
                continue;
            }
            proposed++;
            metricsService.incrementSplitProposed();
            auditService.record(AuditAction.SPLIT_PROPOSED, raw, null, Map.of(
                    "proposedArtists", split.proposedArtists(),
                    "confidence", split.confidence()));
            log.info("split.proposed rawArtist='{}' artists={} confidence={}",
                    raw, split.proposedArtists(), split.confidence());
        }
        return proposed;
    }
}
