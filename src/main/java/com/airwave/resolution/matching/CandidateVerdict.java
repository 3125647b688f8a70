package com.airwave.resolution.matching;

/**
 * What the similarity stage makes of a single index candidate.
 */
public enum CandidateVerdict {
    VARIANT,
    VECTOR,
    REVIEW,
    REJECT
}
