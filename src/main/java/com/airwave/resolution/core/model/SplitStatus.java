package com.airwave.resolution.core.model;

/**
 * Lifecycle of a proposed collaboration split.
 */
public enum SplitStatus {
    PENDING,
    APPROVED,
    REJECTED
}
