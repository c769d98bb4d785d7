package com.momentumshift.common.sentiment;

import com.momentumshift.common.model.SentimentObservation;
import com.momentumshift.common.model.SentimentSignal;
import com.momentumshift.common.settings.SentimentSettings;

import java.util.List;

/**
 * Reduces the sentiment observations of one (moment, player) pair to the
 * narrative component N.
 *
 * <pre>
 *   wᵢ = volumeᵢ × sourceWeight(sourceᵢ) × decay(recencyOffsetᵢ)
 *   N  = Σ polarityᵢ·wᵢ / Σ wᵢ            clamped to [-1, 1]
 * </pre>
 *
 * <p>Observations for other moments or other players are ignored; moment-level
 * observations (no player id) count for every participant. With nothing applicable,
 * or a total weight of zero, N = 0 and {@code noSentimentData} is set. Missing
 * sentiment is never an error.
 */
public final class SentimentAggregator {

    private SentimentAggregator() {}

    public static SentimentSignal aggregate(String momentId, String playerId,
                                            List<SentimentObservation> observations,
                                            SentimentSettings settings) {
        return aggregate(momentId, playerId, observations, settings, new ExponentialDecay(settings.halfLife()));
    }

    public static SentimentSignal aggregate(String momentId, String playerId,
                                            List<SentimentObservation> observations,
                                            SentimentSettings settings, RecencyDecay decay) {
        if (observations == null || observations.isEmpty()) {
            return SentimentSignal.none(momentId, playerId, 0);
        }
        double weightedPolarity = 0.0;
        double totalWeight = 0.0;
        int count = 0;
        for (SentimentObservation observation : observations) {
            if (observation == null || !observation.appliesTo(momentId, playerId)) continue;
            count++;
            double weight = observation.volume()
                          * settings.weightFor(observation.source())
                          * decay.factor(observation.recencyOffset());
            weightedPolarity += observation.polarity() * weight;
            totalWeight += weight;
        }
        if (count == 0 || totalWeight <= 0.0) {
            return SentimentSignal.none(momentId, playerId, count);
        }
        double narrative = Math.max(-1.0, Math.min(1.0, weightedPolarity / totalWeight));
        return new SentimentSignal(momentId, playerId, narrative, count, totalWeight, false);
    }
}
