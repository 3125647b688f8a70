package com.airwave.resolution.review;

/**
 * Status of a match review item.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
