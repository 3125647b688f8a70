package com.airwave.resolution.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest {

    private AuditService audit;

    @BeforeEach
    void setUp() {
        audit = new AuditService();
    }

    @Test
    @DisplayName("Entries are filtered by subject and action")
    void filters() {
        audit.record(AuditAction.BRIDGE_CREATED, "godsmack::voodoo", null, Map.of("workId", 1L));
        audit.record(AuditAction.BRIDGE_REVOKED, "godsmack::voodoo", "curator");
        audit.record(AuditAction.SPLIT_PROPOSED, "Ozzy/Primus", null, Map.of());

        assertEquals(3, audit.size());
        assertEquals(2, audit.getEntriesForSubject("godsmack::voodoo").size());
        assertEquals(1, audit.getEntriesByAction(AuditAction.BRIDGE_REVOKED).size());
        assertEquals(1L, audit.getEntriesByAction(AuditAction.BRIDGE_CREATED).get(0).details().get("workId"));
        assertEquals(AuditEntry.SYSTEM_ACTOR, audit.getEntriesByAction(AuditAction.SPLIT_PROPOSED).get(0).actorId());
    }

    @Test
    @DisplayName("Builder fills id, timestamp and system actor")
    void builderDefaults() {
        AuditEntry entry = AuditEntry.builder()
                .action(AuditAction.WORK_PROMOTED)
                .subject("godsmack::voodoo")
                .build();

        assertNotNull(entry.id());
        assertNotNull(entry.timestamp());
        assertEquals(AuditEntry.SYSTEM_ACTOR, entry.actorId());
        assertTrue(entry.details().isEmpty());
    }

    @Test
    void entriesAreReadOnly() {
        audit.record(AuditAction.LOGS_LINKED, "batch", "system");

        assertThrows(UnsupportedOperationException.class, () -> audit.getAllEntries().clear());
        assertThrows(NullPointerException.class, () -> AuditEntry.builder().build());
    }
}
