package com.airwave.resolution.rules;

import java.util.List;

/**
 * Built-in rules for broadcast log artist and title text.
 * Input is expected lower-cased and transliterated; output contains only
 * letters, digits and spaces.
 */
public final class MusicNormalizationRules {

    private MusicNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all built-in rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getDecorationRules());
        engine.addRules(getCollaborationRules());
        engine.addRules(getCharacterRules());
        return engine;
    }

    /**
     * Bracketed qualifiers, remaster tags, truncation markers and dash version suffixes.
     */
    public static List<NormalizationRule> getDecorationRules() {
        return List.of(
                // (Live), [2011 Remaster], {Radio Edit}
                NormalizationRule.builder()
                        .name("bracketed-qualifier")
                        .pattern("\\s*[\\(\\[\\{][^\\)\\]\\}]*[\\)\\]\\}]")
                        .replacement(" ")
                        .priority(10)
                        .build(),

                // Bracket opened but cut off by the station's field length
                NormalizationRule.builder()
                        .name("unclosed-bracket")
                        .pattern("\\s*[\\(\\[\\{][^\\)\\]\\}]*$")
                        .replacement("")
                        .priority(11)
                        .build(),

                // "- remaster 2011", "remastered 2009", "- 2011 remaster"
                NormalizationRule.builder()
                        .name("remaster-tag")
                        .pattern("(?:\\s+-\\s*)?(?:\\b\\d{4}\\s+)?\\b(?:digital(?:ly)?\\s+)?remaster(?:ed)?\\b(?:\\s+version)?(?:\\s+\\d{4}\\b)?")
                        .replacement(" ")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("truncation-ellipsis")
                        .pattern("\\.{3,}|\u2026")
                        .replacement(" ")
                        .priority(30)
                        .build(),

                // "- live", "- radio edit", "- 2011 mix", "- single version"
                NormalizationRule.builder()
                        .name("dash-version-suffix")
                        .pattern("\\s+-\\s+(?:\\d{4}\\s+)?(?:live|radio|single|album|extended|edit|remix|mix|version|demo|acoustic|unplugged|mono|stereo|instrumental)\\b.*$")
                        .replacement("")
                        .priority(40)
                        .build()
        );
    }

    /**
     * Featured-artist tails, leading articles and collaboration suffixes.
     */
    public static List<NormalizationRule> getCollaborationRules() {
        return List.of(
                // Titles: "song feat. someone", "song ft someone", "song featuring someone"
                NormalizationRule.builder()
                        .name("title-featuring")
                        .pattern("\\s+(?:feat\\.?|ft\\.?|featuring)(?![\\p{L}\\p{N}]).*$")
                        .replacement("")
                        .only(NormalizationTarget.TITLE)
                        .priority(50)
                        .build(),

                // Artists: period required for feat/ft so "Little Feat" survives
                NormalizationRule.builder()
                        .name("artist-collaboration-suffix")
                        .pattern("\\s+(?:duet|feat\\.|ft\\.|featuring|vs\\.?)(?![\\p{L}\\p{N}]).*$")
                        .replacement("")
                        .only(NormalizationTarget.ARTIST)
                        .priority(50)
                        .build(),

                NormalizationRule.builder()
                        .name("artist-leading-article")
                        .pattern("^\\s*(?:the|a|an)\\s+")
                        .replacement("")
                        .only(NormalizationTarget.ARTIST)
                        .priority(55)
                        .build()
        );
    }

    /**
     * Symbol spelling, apostrophes and remaining punctuation.
     */
    public static List<NormalizationRule> getCharacterRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("ampersand")
                        .pattern("&")
                        .replacement(" and ")
                        .priority(60)
                        .build(),

                NormalizationRule.builder()
                        .name("plus")
                        .pattern("\\+")
                        .replacement(" plus ")
                        .priority(60)
                        .build(),

                // "guns n' roses" -> "guns n roses", "r.e.m." -> "rem"
                NormalizationRule.builder()
                        .name("apostrophes-and-periods")
                        .pattern("['`.]")
                        .replacement("")
                        .priority(70)
                        .build(),

                NormalizationRule.builder()
                        .name("punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s]|_")
                        .replacement(" ")
                        .priority(80)
                        .build()
        );
    }
}
