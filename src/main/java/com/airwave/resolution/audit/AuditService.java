package com.airwave.resolution.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only trail of bridge, promotion, split and review decisions.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries;

    public AuditService() {
        this.entries = new CopyOnWriteArrayList<>();
    }

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("Audit entry recorded: {} for {} by {}",
                entry.action(), entry.subject(), entry.actorId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String subject, String actorId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .subject(subject)
                .actorId(actorId != null ? actorId : AuditEntry.SYSTEM_ACTOR)
                .details(details)
                .build());
    }

    public AuditEntry record(AuditAction action, String subject, String actorId) {
        return record(action, subject, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForSubject(String subject) {
        return entries.stream()
                .filter(e -> subject.equals(e.subject()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }
}
