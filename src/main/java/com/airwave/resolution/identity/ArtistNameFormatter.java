package com.airwave.resolution.identity;

import com.airwave.resolution.rules.Normalizer;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Display casing for individual artist names produced by a split.
 * Strips leftover collaboration markers at either end, then title-cases each word,
 * keeping short all-caps words (acronyms such as "REM" or "UB40") as they are.
 */
public final class ArtistNameFormatter {

    private static final Pattern DEBRIS = Pattern.compile(
            "^\\s*(?:feat|ft|featuring|with)\\.?(?![\\p{L}\\p{N}])\\s*"
                    + "|\\s+(?:feat|ft|featuring|with)\\.?\\s*$"
                    + "|^\\s*[fw]/\\s*"
                    + "|\\s+[fw]/\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> NEVER_ACRONYMS = Set.of("and", "the", "with", "feat");
    private static final int MAX_ACRONYM_LENGTH = 4;

    private ArtistNameFormatter() {
        // Utility class
    }

    public static String format(String name) {
        if (name == null) {
            return "";
        }
        String stripped = DEBRIS.matcher(Normalizer.stripAccents(name)).replaceAll("").trim();
        if (stripped.isEmpty()) {
            return "";
        }

        String[] words = stripped.split("\\s+");
        StringBuilder sb = new StringBuilder(stripped.length());
        for (String word : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(isAcronym(word) ? word : capitalize(word));
        }
        return sb.toString();
    }

    private static boolean isAcronym(String word) {
        if (word.length() > MAX_ACRONYM_LENGTH || NEVER_ACRONYMS.contains(word.toLowerCase(Locale.ROOT))) {
            return false;
        }
        boolean hasLetter = false;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isLetter(c)) {
                hasLetter = true;
                if (!Character.isUpperCase(c)) {
                    return false;
                }
            }
        }
        return hasLetter;
    }

    private static String capitalize(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        return lower.substring(0, 1).toUpperCase(Locale.ROOT) + lower.substring(1);
    }
}
