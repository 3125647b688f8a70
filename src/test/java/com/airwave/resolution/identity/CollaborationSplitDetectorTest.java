package com.airwave.resolution.identity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CollaborationSplitDetectorTest {

    private final CollaborationSplitDetector detector = new CollaborationSplitDetector();

    @Test
    @DisplayName("Slash-separated credits split")
    void slash() {
        assertEquals(Optional.of(List.of("Ozzy", "Primus")), detector.detect("Ozzy/Primus"));
        assertEquals(CollaborationSplitDetector.CONFIDENCE_EXPLICIT_MARKER, detector.confidenceFor("Ozzy/Primus"));
    }

    @Test
    @DisplayName("Featuring credits split")
    void featuring() {
        assertEquals(Optional.of(List.of("Santana", "Rob Thomas")), detector.detect("Santana feat. Rob Thomas"));
        assertEquals(Optional.of(List.of("DJ Snake", "Lil Jon")), detector.detect("DJ Snake w/ Lil Jon"));
    }

    @Test
    @DisplayName("Plain conjunctions split with lower confidence")
    void conjunction() {
        assertEquals(Optional.of(List.of("Dolly Parton", "Kenny Rogers")), detector.detect("Dolly Parton & Kenny Rogers"));
        assertEquals(CollaborationSplitDetector.CONFIDENCE_CONJUNCTION, detector.confidenceFor("Dolly Parton & Kenny Rogers"));
    }

    @ParameterizedTest
    @DisplayName("Known acts and bands with backing groups are never split")
    @ValueSource(strings = {
            "AC/DC",
            "ac/dc",
            "Earth, Wind & Fire",
            "Mumford & Sons",
            "Simon & Garfunkel",
            "Bob Marley & The Wailers",
            "Kool and the Gang",
            "Prince",
            "Drake with Drake",
            ""
    })
    void notSplit(String rawArtist) {
        assertTrue(detector.detect(rawArtist).isEmpty());
    }

    @Test
    @DisplayName("Custom known acts replace the defaults")
    void customKnownActs() {
        CollaborationSplitDetector custom = new CollaborationSplitDetector(Set.of("Sonny & Cher"));

        assertTrue(custom.detect("SONNY & CHER").isEmpty());
        assertTrue(custom.detect("Simon & Garfunkel").isPresent());
    }

    @Test
    @DisplayName("A word containing a marker does not raise confidence")
    void markerInsideWord() {
        assertEquals(CollaborationSplitDetector.CONFIDENCE_CONJUNCTION, detector.confidenceFor("Taylor Swift & Bon Iver"));
    }

    @Test
    void nullInput() {
        assertTrue(detector.detect(null).isEmpty());
    }
}
