package com.airwave.resolution.rules;

/**
 * The field a normalization rule is written for.
 */
public enum NormalizationTarget {
    ARTIST,
    TITLE
}
