package com.airwave.resolution.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an auditable operation.
 * The subject is whatever the action is about: a signature, a raw artist name or a work id.
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String subject,
        String actorId,
        Map<String, Object> details,
        Instant timestamp
) {
    public static final String SYSTEM_ACTOR = "system";

    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private String subject;
        private String actorId = SYSTEM_ACTOR;
        private Map<String, Object> details;
        private Instant timestamp = Instant.now();

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId != null ? actorId : SYSTEM_ACTOR;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, subject, actorId, details, timestamp);
        }
    }
}
