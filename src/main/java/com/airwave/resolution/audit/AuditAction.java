package com.airwave.resolution.audit;

/**
 * Types of auditable actions in the matching and identity workflows.
 */
public enum AuditAction {
    BRIDGE_CREATED,
    BRIDGE_REVOKED,
    WORK_PROMOTED,
    LOGS_LINKED,
    SPLIT_PROPOSED,
    SPLIT_APPROVED,
    SPLIT_REJECTED,
    ALIAS_UPDATED,
    MATCH_REVIEW_REQUESTED,
    MATCH_REVIEW_COMPLETED
}
