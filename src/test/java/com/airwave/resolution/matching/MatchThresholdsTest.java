package com.airwave.resolution.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MatchThresholdsTest {

    @Test
    @DisplayName("Defaults match the documented values")
    void defaults() {
        MatchThresholds thresholds = MatchThresholds.defaults();

        assertEquals(0.85, thresholds.variantArtistScore());
        assertEquals(0.80, thresholds.variantTitleScore());
        assertEquals(0.70, thresholds.aliasArtistScore());
        assertEquals(0.70, thresholds.aliasTitleScore());
        assertEquals(0.15, thresholds.vectorStrongDistance());
        assertEquals(0.5, thresholds.vectorTitleGuard());
    }

    @Test
    @DisplayName("Scores outside [0, 1] are rejected")
    void scoreRange() {
        assertThrows(IllegalArgumentException.class, () -> MatchThresholds.builder().variantArtistScore(1.1).build());
        assertThrows(IllegalArgumentException.class, () -> MatchThresholds.builder().aliasTitleScore(-0.1).build());
        assertThrows(IllegalArgumentException.class, () -> MatchThresholds.builder().vectorTitleGuard(Double.NaN).build());
    }

    @Test
    @DisplayName("Negative distance is rejected")
    void negativeDistance() {
        assertThrows(IllegalArgumentException.class, () -> MatchThresholds.builder().vectorStrongDistance(-0.01).build());
    }

    @Test
    @DisplayName("The variant band may not sit below the review band")
    void ordering() {
        assertThrows(IllegalArgumentException.class, () -> MatchThresholds.builder()
                .variantArtistScore(0.6).aliasArtistScore(0.7).build());
        assertThrows(IllegalArgumentException.class, () -> MatchThresholds.builder()
                .variantTitleScore(0.6).aliasTitleScore(0.7).build());
    }

    @Test
    @DisplayName("Copy builder keeps unchanged values")
    void copyBuilder() {
        MatchThresholds tuned = MatchThresholds.builder(MatchThresholds.defaults()).vectorStrongDistance(0.2).build();

        assertEquals(0.2, tuned.vectorStrongDistance());
        assertEquals(0.85, tuned.variantArtistScore());
    }

    @Test
    @DisplayName("Settings swap atomically under concurrent readers")
    void settingsUpdate() throws Exception {
        ThresholdSettings settings = new ThresholdSettings();
        MatchThresholds strict = MatchThresholds.builder().variantArtistScore(0.95).build();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(100);
        try {
            for (int i = 0; i < 100; i++) {
                executor.submit(() -> {
                    try {
                        double value = settings.current().variantArtistScore();
                        assertTrue(value == 0.85 || value == 0.95);
                    } finally {
                        done.countDown();
                    }
                });
            }
            MatchThresholds previous = settings.update(strict);
            assertTrue(done.await(10, TimeUnit.SECONDS));
            assertEquals(MatchThresholds.defaults(), previous);
        } finally {
            executor.shutdownNow();
        }
        assertSame(strict, settings.current());
    }
}
