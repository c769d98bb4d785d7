package com.momentumshift.common.sentiment;

import com.momentumshift.common.TestFixtures;
import com.momentumshift.common.model.SentimentObservation;
import com.momentumshift.common.model.SentimentSignal;
import com.momentumshift.common.model.SentimentSourceType;
import com.momentumshift.common.settings.SentimentSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SentimentAggregatorTest {

    private final SentimentSettings settings = TestFixtures.sentimentSettings();

    private static SentimentObservation obs(String playerId, double polarity, double volume, Duration offset) {
        return new SentimentObservation("m-1", playerId, SentimentSourceType.MEDIA, polarity, volume, offset);
    }

    @Nested
    @DisplayName("identity cases")
    class Identity {

        @Test
        @DisplayName("zero observations → N = 0 with no-sentiment flag")
        void none() {
            SentimentSignal s = SentimentAggregator.aggregate("m-1", "p-1", List.of(), settings);

            assertEquals(0.0, s.narrative());
            assertTrue(s.noSentimentData());
        }

        @Test
        @DisplayName("null observation list behaves like an empty one")
        void nullList() {
            assertTrue(SentimentAggregator.aggregate("m-1", "p-1", null, settings).noSentimentData());
        }

        @Test
        @DisplayName("single fresh observation with volume 1 → N equals its polarity exactly")
        void singleObservation() {
            SentimentSignal s = SentimentAggregator.aggregate("m-1", "p-1",
                List.of(obs("p-1", 0.37, 1.0, Duration.ZERO)), settings);

            assertEquals(0.37, s.narrative());
            assertFalse(s.noSentimentData());
            assertEquals(1, s.observationCount());
        }
    }

    @Nested
    @DisplayName("weighting")
    class Weighting {

        @Test
        @DisplayName("volume weights the average")
        void volumeWeighted() {
            SentimentSignal s = SentimentAggregator.aggregate("m-1", "p-1", List.of(
                obs("p-1", 1.0, 3.0, Duration.ZERO),
                obs("p-1", -1.0, 1.0, Duration.ZERO)), settings);

            assertEquals(0.5, s.narrative(), 1e-12);
        }

        @Test
        @DisplayName("an observation one half-life old counts half")
        void recencyHalvesWeight() {
            SentimentSignal s = SentimentAggregator.aggregate("m-1", "p-1", List.of(
                obs("p-1", 1.0, 1.0, Duration.ZERO),
                obs("p-1", -1.0, 2.0, Duration.ofHours(24))), settings);

            // weights 1 and 2 × 0.5 = 1 → (1 − 1) / 2
            assertEquals(0.0, s.narrative(), 1e-12);
        }

        @Test
        @DisplayName("source weights scale observations by type")
        void sourceWeights() {
            SentimentSettings fanHeavy = new SentimentSettings(Duration.ofHours(24),
                Map.of(SentimentSourceType.FAN, 3.0, SentimentSourceType.MEDIA, 1.0));
            SentimentSignal s = SentimentAggregator.aggregate("m-1", "p-1", List.of(
                new SentimentObservation("m-1", "p-1", SentimentSourceType.FAN, 1.0, 1.0, Duration.ZERO),
                new SentimentObservation("m-1", "p-1", SentimentSourceType.MEDIA, -1.0, 1.0, Duration.ZERO)), fanHeavy);

            assertEquals(0.5, s.narrative(), 1e-12);
        }

        @Test
        @DisplayName("other players' and other moments' observations are ignored")
        void filtersByKey() {
            SentimentSignal s = SentimentAggregator.aggregate("m-1", "p-1", List.of(
                obs("p-2", -1.0, 5.0, Duration.ZERO),
                new SentimentObservation("m-2", "p-1", SentimentSourceType.FAN, -1.0, 5.0, Duration.ZERO),
                obs("p-1", 0.4, 1.0, Duration.ZERO)), settings);

            assertEquals(0.4, s.narrative(), 1e-12);
            assertEquals(1, s.observationCount());
        }

        @Test
        @DisplayName("moment-level observations apply to every participant")
        void momentLevel() {
            SentimentSignal s = SentimentAggregator.aggregate("m-1", "p-9",
                List.of(obs(null, -0.6, 1.0, Duration.ZERO)), settings);

            assertEquals(-0.6, s.narrative(), 1e-12);
        }

        @Test
        @DisplayName("zero total weight counts as no sentiment")
        void zeroVolume() {
            SentimentSignal s = SentimentAggregator.aggregate("m-1", "p-1",
                List.of(obs("p-1", 0.9, 0.0, Duration.ZERO)), settings);

            assertTrue(s.noSentimentData());
            assertEquals(0.0, s.narrative());
            assertEquals(1, s.observationCount());
        }

        @Test
        @DisplayName("N always stays within [-1, 1]")
        void bounded() {
            SentimentSignal s = SentimentAggregator.aggregate("m-1", "p-1", List.of(
                obs("p-1", 1.0, 1e9, Duration.ZERO),
                obs("p-1", 1.0, 1e-9, Duration.ofDays(365))), settings);

            assertTrue(s.narrative() <= 1.0 && s.narrative() >= -1.0);
        }
    }

    @Nested
    @DisplayName("decay and validation")
    class DecayAndValidation {

        @Test
        @DisplayName("exponential decay is 1 at zero and non-increasing")
        void decayMonotonic() {
            ExponentialDecay decay = new ExponentialDecay(Duration.ofHours(6));

            assertEquals(1.0, decay.factor(Duration.ZERO));
            assertEquals(0.5, decay.factor(Duration.ofHours(6)), 1e-12);
            assertTrue(decay.factor(Duration.ofHours(12)) <= decay.factor(Duration.ofHours(7)));
        }

        @Test
        @DisplayName("polarity outside [-1, 1] is rejected at construction")
        void polarityRange() {
            assertThrows(IllegalArgumentException.class, () -> obs("p-1", 1.5, 1.0, Duration.ZERO));
        }

        @Test
        @DisplayName("negative volume or offset is rejected")
        void negativeInputs() {
            assertThrows(IllegalArgumentException.class, () -> obs("p-1", 0.1, -1.0, Duration.ZERO));
            assertThrows(IllegalArgumentException.class, () -> obs("p-1", 0.1, 1.0, Duration.ofMinutes(-5)));
        }
    }
}
