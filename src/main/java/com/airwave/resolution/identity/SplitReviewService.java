package com.airwave.resolution.identity;

import com.airwave.resolution.audit.AuditAction;
import com.airwave.resolution.audit.AuditService;
import com.airwave.resolution.core.model.ArtistAlias;
import com.airwave.resolution.core.model.ProposedSplit;
import com.airwave.resolution.core.model.SplitStatus;
import com.airwave.resolution.storage.ArtistAliasRepository;
import com.airwave.resolution.storage.ProposedSplitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Human decisions on split proposals and manual alias maintenance.
 * Decisions take effect through the alias table, which is what {@link IdentityResolver} reads.
 */
public class SplitReviewService {
    private static final Logger log = LoggerFactory.getLogger(SplitReviewService.class);

    static final String ARTIST_SEPARATOR = "; ";

    private final ProposedSplitRepository splitRepository;
    private final ArtistAliasRepository aliasRepository;
    private final AuditService auditService;

    public SplitReviewService(ProposedSplitRepository splitRepository, ArtistAliasRepository aliasRepository,
                              AuditService auditService) {
        this.splitRepository = Objects.requireNonNull(splitRepository, "splitRepository is required");
        this.aliasRepository = Objects.requireNonNull(aliasRepository, "aliasRepository is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
    }

    public List<ProposedSplit> pending() {
        return splitRepository.findByStatus(SplitStatus.PENDING);
    }

    /**
     * Accepts the proposal; the raw credit then resolves to the joined artist names.
     */
    public ProposedSplit approve(String rawArtist, String reviewerId) {
        ProposedSplit split = requirePending(rawArtist);
        ProposedSplit approved = splitRepository.update(split.withStatus(SplitStatus.APPROVED));
        aliasRepository.upsert(ArtistAlias.of(rawArtist,
                String.join(ARTIST_SEPARATOR, approved.proposedArtists()), true));

        auditService.record(AuditAction.SPLIT_APPROVED, rawArtist, reviewerId,
                Map.of("proposedArtists", approved.proposedArtists()));
        log.info("split.approved rawArtist='{}' artists={} reviewer={}",
                rawArtist, approved.proposedArtists(), reviewerId);
        return approved;
    }

    /**
     * Declines the proposal; the raw credit is pinned to itself so it is not proposed again.
     */
    public ProposedSplit reject(String rawArtist, String reviewerId) {
        ProposedSplit split = requirePending(rawArtist);
        ProposedSplit rejected = splitRepository.update(split.withStatus(SplitStatus.REJECTED));
        aliasRepository.upsert(ArtistAlias.of(rawArtist, rawArtist, true));

        auditService.record(AuditAction.SPLIT_REJECTED, rawArtist, reviewerId,
                Map.of("proposedArtists", rejected.proposedArtists()));
        log.info("split.rejected rawArtist='{}' reviewer={}", rawArtist, reviewerId);
        return rejected;
    }

    /**
     * Corrects the proposed names before a decision is made.
     */
    public ProposedSplit updateProposal(String rawArtist, List<String> artists) {
        if (artists == null || artists.isEmpty() || artists.stream().anyMatch(a -> a == null || a.isBlank())) {
            throw new IllegalArgumentException("Proposed artists must be non-blank names");
        }
        ProposedSplit split = requirePending(rawArtist);
        ProposedSplit updated = splitRepository.update(split.withProposedArtists(artists));
        log.info("split.updated rawArtist='{}' artists={}", rawArtist, updated.proposedArtists());
        return updated;
    }

    public ArtistAlias addAlias(String rawName, String resolvedName, boolean verified, String actorId) {
        ArtistAlias alias = aliasRepository.upsert(ArtistAlias.of(rawName, resolvedName, verified));
        auditService.record(AuditAction.ALIAS_UPDATED, rawName, actorId, Map.of(
                "resolvedName", resolvedName,
                "verified", verified));
        log.info("alias.updated rawName='{}' resolvedName='{}' verified={}", rawName, resolvedName, verified);
        return alias;
    }

    /**
     * Records that the raw name is already the best available name.
     */
    public ArtistAlias markNoBetterName(String rawName, String actorId) {
        ArtistAlias alias = aliasRepository.upsert(ArtistAlias.noBetterName(rawName));
        auditService.record(AuditAction.ALIAS_UPDATED, rawName, actorId, Map.of("nullAlias", true));
        log.info("alias.no-better-name rawName='{}'", rawName);
        return alias;
    }

    private ProposedSplit requirePending(String rawArtist) {
        ProposedSplit split = splitRepository.findByRawArtist(rawArtist)
                .orElseThrow(() -> new IllegalArgumentException("Split proposal not found: " + rawArtist));
        if (!split.isPending()) {
            throw new IllegalStateException("Split proposal is not pending: " + rawArtist);
        }
        return split;
    }
}
