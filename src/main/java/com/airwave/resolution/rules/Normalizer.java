package com.airwave.resolution.rules;

import com.airwave.resolution.core.model.VersionedTitle;

import java.text.Normalizer.Form;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure text utilities shared by every matching stage: cleaning, signature
 * generation, collaboration splitting and version extraction.
 * All methods are total; null or blank input yields empty output.
 */
public final class Normalizer {

    /**
     * Separator between the artist and title halves of a signature. Cleaned text
     * never contains a colon, so the concatenation is injective.
     */
    public static final String SIGNATURE_SEPARATOR = "::";

    private static final NormalizationEngine ENGINE = MusicNormalizationRules.createDefaultEngine();

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private static final Map<Character, String> TRANSLITERATIONS = Map.ofEntries(
            Map.entry('ø', "o"), Map.entry('Ø', "O"),
            Map.entry('ß', "ss"),
            Map.entry('æ', "ae"), Map.entry('Æ', "AE"),
            Map.entry('œ', "oe"), Map.entry('Œ', "OE"),
            Map.entry('ł', "l"), Map.entry('Ł', "L"),
            Map.entry('đ', "d"), Map.entry('Đ', "D"),
            Map.entry('ð', "d"), Map.entry('Ð', "D"),
            Map.entry('þ', "th"), Map.entry('Þ', "TH"),
            Map.entry('ı', "i"),
            Map.entry('‘', "'"), Map.entry('’', "'"), Map.entry('‛', "'"),
            Map.entry('“', "\""), Map.entry('”', "\"")
    );

    // Applied in order; F/ and W/ must precede the bare slash
    private static final List<Pattern> ARTIST_SEPARATORS = compileAll(
            "\\s+feat\\.?\\s+",
            "\\s+ft\\.?\\s+",
            "\\s+featuring\\s+",
            "\\s+duet\\s+with\\s+",
            "\\s+duet\\s+",
            "\\s+vs\\.?\\s+",
            "\\s+with\\s+",
            "\\s+f/\\s*",
            "\\s+w/\\s*",
            "\\s+&\\s+",
            "\\s+/\\s+",
            "(?<!\\d),\\s*(?!\\d)",
            "\\s+and\\s+"
    );

    private static final Pattern VERSION_TAG = Pattern.compile(
            "[\\(\\[]\\s*("
                    + "remastered?|instrumental|unplugged|acoustic|explicit|"
                    + "lyrical|live|remix|mix|edit|version|demo|radio|clean|"
                    + "cover|track|fade|lyrics|dub|original|alt|"
                    + "single|album|extended|short|mono|stereo|"
                    + "deluxe|bonus|anniversary|special|limited|"
                    + "\\d{4}"
                    + ").*?[\\)\\]]",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DASH_VERSION = Pattern.compile(
            "\\s+-\\s+(live|remix|mix|edit|version|demo|radio|acoustic|unplugged)\\b.*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern EMPTY_BRACKETS = Pattern.compile("\\s*[\\(\\[]\\s*[\\)\\]]");

    private Normalizer() {
        // Utility class
    }

    /**
     * Cleans a title (or any free text) for comparison.
     */
    public static String clean(String text) {
        return ENGINE.normalize(prepare(text), NormalizationTarget.TITLE);
    }

    /**
     * Cleans an artist name: everything {@link #clean} does, plus leading
     * article and collaboration-suffix removal.
     */
    public static String cleanArtist(String text) {
        return ENGINE.normalize(prepare(text), NormalizationTarget.ARTIST);
    }

    /**
     * Deterministic identity key for an artist/title pair.
     */
    public static String generateSignature(String artist, String title) {
        return cleanArtist(artist) + SIGNATURE_SEPARATOR + clean(title);
    }

    /**
     * Splits a collaboration string into individual cleaned artist names,
     * deduplicated in first-seen order.
     */
    public static List<String> splitArtists(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String marked = text;
        for (Pattern separator : ARTIST_SEPARATORS) {
            marked = separator.matcher(marked).replaceAll("|");
        }

        Map<String, String> unique = new LinkedHashMap<>();
        for (String part : marked.split("\\|")) {
            String cleaned = cleanArtist(part);
            if (!cleaned.isEmpty()) {
                unique.putIfAbsent(cleaned.toLowerCase(Locale.ROOT), cleaned);
            }
        }
        return List.copyOf(unique.values());
    }

    /**
     * Removes diacritics and transliterates letters that do not decompose.
     */
    public static String stripAccents(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = java.text.Normalizer.normalize(text, Form.NFKD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        StringBuilder sb = null;
        for (int i = 0; i < stripped.length(); i++) {
            String replacement = TRANSLITERATIONS.get(stripped.charAt(i));
            if (replacement != null) {
                if (sb == null) {
                    sb = new StringBuilder(stripped.length() + 8);
                    sb.append(stripped, 0, i);
                }
                sb.append(replacement);
            } else if (sb != null) {
                sb.append(stripped.charAt(i));
            }
        }
        return sb != null ? sb.toString() : stripped;
    }

    /**
     * Separates a version qualifier from a raw title.
     * "Voodoo (Live)" yields ("Voodoo", "Live"); an undecorated title yields "Original".
     */
    public static VersionedTitle extractVersionType(String title) {
        if (title == null || title.isBlank()) {
            return new VersionedTitle("", VersionedTitle.ORIGINAL);
        }

        Matcher bracketed = VERSION_TAG.matcher(title);
        if (bracketed.find()) {
            String versionType = titleCase(bracketed.group(1));
            String stripped = VERSION_TAG.matcher(title).replaceAll("");
            stripped = EMPTY_BRACKETS.matcher(stripped).replaceAll("").trim();
            return new VersionedTitle(stripped, versionType);
        }

        Matcher dashed = DASH_VERSION.matcher(title);
        if (dashed.find()) {
            String versionType = titleCase(dashed.group(1));
            return new VersionedTitle(title.substring(0, dashed.start()).trim(), versionType);
        }

        return new VersionedTitle(title.trim(), VersionedTitle.ORIGINAL);
    }

    private static String prepare(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return stripAccents(text).toLowerCase(Locale.ROOT).trim();
    }

    private static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return sb.toString();
    }

    private static List<Pattern> compileAll(String... regexes) {
        List<Pattern> patterns = new ArrayList<>(regexes.length);
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }
}
