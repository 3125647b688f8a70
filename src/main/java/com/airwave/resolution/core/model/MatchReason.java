package com.airwave.resolution.core.model;

/**
 * How a query reached its outcome. The label is what gets written to broadcast logs.
 */
public enum MatchReason {
    IDENTITY_BRIDGE("Identity Bridge", true),
    EXACT_MATCH("Exact Match", true),
    VARIANT_MATCH("Variant Match", true),
    VECTOR_MATCH("Vector Match", true),
    NEEDS_REVIEW("Needs Review", false),
    NO_MATCH("No Match Found", false);

    private final String label;
    private final boolean matched;

    MatchReason(String label, boolean matched) {
        this.label = label;
        this.matched = matched;
    }

    public String getLabel() {
        return label;
    }

    public boolean isMatched() {
        return matched;
    }
}
