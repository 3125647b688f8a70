package com.airwave.resolution.matching;

import com.airwave.resolution.audit.AuditAction;
import com.airwave.resolution.audit.AuditService;
import com.airwave.resolution.core.model.ArtistTitle;
import com.airwave.resolution.core.model.BroadcastLog;
import com.airwave.resolution.core.model.MatchResult;
import com.airwave.resolution.logging.LogContext;
import com.airwave.resolution.metrics.MetricsService;
import com.airwave.resolution.storage.BroadcastLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Re-runs the matching pipeline over broadcast logs that have no work yet and
 * links the ones that now match. Logs linked in the meantime are left alone.
 */
public class OrphanLogLinker {
    private static final Logger log = LoggerFactory.getLogger(OrphanLogLinker.class);

    private final BroadcastLogRepository logRepository;
    private final Matcher matcher;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final int chunkSize;

    public OrphanLogLinker(BroadcastLogRepository logRepository, Matcher matcher, AuditService auditService,
                           MetricsService metricsService, int chunkSize) {
        this.logRepository = Objects.requireNonNull(logRepository, "logRepository is required");
        this.matcher = Objects.requireNonNull(matcher, "matcher is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
    }

    /**
     * @return the number of logs linked by this call
     */
    public int linkOrphanedLogs() {
        try (LogContext ctx = LogContext.forOrphanLinking(LogContext.generateBatchId())) {
            Map<ArtistTitle, List<Long>> logsByPair = new LinkedHashMap<>();
            for (BroadcastLog broadcastLog : logRepository.findUnlinked()) {
                logsByPair.computeIfAbsent(ArtistTitle.of(broadcastLog.getRawArtist(), broadcastLog.getRawTitle()),
                        k -> new ArrayList<>()).add(broadcastLog.getId());
            }

            List<ArtistTitle> pairs = new ArrayList<>(logsByPair.keySet());
            int linked = 0;
            int failed = 0;
            for (int from = 0; from < pairs.size(); from += chunkSize) {
                List<ArtistTitle> chunk = pairs.subList(from, Math.min(from + chunkSize, pairs.size()));
                BatchMatchResult result = matcher.matchBatch(chunk);
                failed += result.integrityErrors().size();
                for (Map.Entry<ArtistTitle, MatchResult> match : result.matches().entrySet()) {
                    MatchResult outcome = match.getValue();
                    linked += logRepository.linkToWork(logsByPair.get(match.getKey()),
                            outcome.workId(), outcome.label());
                }
            }

            if (linked > 0) {
                metricsService.incrementLogsLinked(linked);
                auditService.record(AuditAction.LOGS_LINKED, null, null, Map.of(
                        "linked", linked,
                        "distinctPairs", pairs.size()));
            }
            log.info("orphans.linked pairs={} linked={} integrityErrors={}", pairs.size(), linked, failed);
            return linked;
        }
    }
}
