package com.airwave.resolution.identity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Detects raw artist credits that name more than one artist.
 * Pure: detection never touches storage.
 */
public class CollaborationSplitDetector {

    public static final double CONFIDENCE_EXPLICIT_MARKER = 0.95;
    public static final double CONFIDENCE_CONJUNCTION = 0.7;

    static final Set<String> DEFAULT_KNOWN_ACTS = Set.of(
            "AC/DC",
            "P!nk",
            "Panic! At The Disco",
            "Earth, Wind & Fire",
            "Mumford & Sons",
            "Simon & Garfunkel",
            "Crosby, Stills & Nash",
            "Crosby, Stills, Nash & Young",
            "Brooks & Dunn",
            "Big & Rich",
            "Sam & Dave",
            "Hall & Oates",
            "Belle and Sebastian",
            "Angus & Julia Stone",
            "Years & Years"
    );

    // Tried in order; the first pattern that yields two distinct names wins
    private static final List<Pattern> SPLIT_PATTERNS = List.of(
            Pattern.compile("\\s+w/\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+f/\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+(?:feat|ft|featuring|with|and|&)\\.?\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*/\\s*")
    );

    // "Bob Marley & The Wailers", "Kool and the Gang"
    private static final Pattern BAND_WITH_BACKING = Pattern.compile(
            "^\\S.*\\s(?:&|and)\\s+the\\s+\\S.*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern EXPLICIT_MARKER = Pattern.compile(
            "/|\\b(?:feat|ft|featuring|with)\\b", Pattern.CASE_INSENSITIVE);

    private final Set<String> knownActs;

    public CollaborationSplitDetector() {
        this(DEFAULT_KNOWN_ACTS);
    }

    public CollaborationSplitDetector(Set<String> knownActs) {
        this.knownActs = knownActs.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Returns the individual names in credit order, or empty if the credit names a single act.
     */
    public Optional<List<String>> detect(String rawArtist) {
        if (rawArtist == null || rawArtist.isBlank()) {
            return Optional.empty();
        }
        String trimmed = rawArtist.trim();
        if (knownActs.contains(trimmed.toLowerCase(Locale.ROOT)) || BAND_WITH_BACKING.matcher(trimmed).matches()) {
            return Optional.empty();
        }

        for (Pattern pattern : SPLIT_PATTERNS) {
            String[] parts = pattern.split(trimmed);
            if (parts.length < 2) {
                continue;
            }
            Set<String> names = new LinkedHashSet<>();
            for (String part : parts) {
                String formatted = ArtistNameFormatter.format(part);
                if (!formatted.isEmpty()) {
                    names.add(formatted);
                }
            }
            if (names.size() > 1) {
                return Optional.of(new ArrayList<>(names));
            }
        }
        return Optional.empty();
    }

    /**
     * Confidence of a detected split: explicit collaboration markers score higher
     * than plain conjunctions, which also occur inside band names.
     */
    public double confidenceFor(String rawArtist) {
        return EXPLICIT_MARKER.matcher(rawArtist).find() ? CONFIDENCE_EXPLICIT_MARKER : CONFIDENCE_CONJUNCTION;
    }
}
