package com.airwave.resolution.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = MusicNormalizationRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        assertEquals("", engine.normalize(null, NormalizationTarget.TITLE));
        assertEquals("", engine.normalize("", NormalizationTarget.ARTIST));
        assertEquals("", engine.normalize("   ", NormalizationTarget.TITLE));
    }

    @Test
    @DisplayName("Artist-only rules do not touch titles")
    void testTargetedRules() {
        assertEquals("beatles", engine.normalize("the beatles", NormalizationTarget.ARTIST));
        assertEquals("the beatles", engine.normalize("the beatles", NormalizationTarget.TITLE));
    }

    @Test
    @DisplayName("Title featuring tail does not need a period")
    void testTitleFeaturing() {
        assertEquals("crazy", engine.normalize("crazy feat someone", NormalizationTarget.TITLE));
        assertEquals("little feat", engine.normalize("little feat", NormalizationTarget.ARTIST));
    }

    @Test
    @DisplayName("Should apply rules in priority order")
    void testPriorityOrder() {
        NormalizationEngine custom = new NormalizationEngine(List.of(
                NormalizationRule.builder().name("second").pattern("b").replacement("c").priority(20).build(),
                NormalizationRule.builder().name("first").pattern("a").replacement("b").priority(10).build()
        ));

        assertEquals("first", custom.getRules().get(0).getName());
        assertEquals("cc", custom.normalize("ab", NormalizationTarget.TITLE));
    }

    @Test
    @DisplayName("A rule scoped to one field leaves the other alone")
    void testScopedRule() {
        NormalizationRule dropThe = NormalizationRule.builder()
                .name("drop-the").pattern("^the\\s+").replacement("").only(NormalizationTarget.ARTIST).build();
        NormalizationEngine custom = new NormalizationEngine(List.of(dropThe));

        assertTrue(dropThe.appliesTo(NormalizationTarget.ARTIST));
        assertFalse(dropThe.appliesTo(NormalizationTarget.TITLE));
        assertEquals("who", custom.normalize("the who", NormalizationTarget.ARTIST));
        assertEquals("the wall", custom.normalize("the wall", NormalizationTarget.TITLE));
    }

    @Test
    @DisplayName("Should repeat passes until the text stops changing")
    void testFixedPoint() {
        // The underscore only becomes a space after the featuring rule has run
        assertEquals("crazy", engine.normalize("crazy_feat someone", NormalizationTarget.TITLE));
    }

    @Test
    @DisplayName("Should collapse whitespace")
    void testWhitespace() {
        assertEquals("a b c", engine.normalize("  a   b\tc  ", NormalizationTarget.TITLE));
    }

    @Test
    @DisplayName("Should reject invalid rules")
    void testInvalidRule() {
        assertThrows(RuntimeException.class, () ->
                NormalizationRule.builder().name("bad").pattern(null).replacement("").build());
    }
}
