package com.momentumshift.common.settings;

import com.momentumshift.common.model.SentimentSourceType;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/** Half-life of the exponential recency decay and the per-source weight table. */
public record SentimentSettings(Duration halfLife, Map<SentimentSourceType, Double> sourceWeights) {

    public SentimentSettings {
        if (halfLife == null || halfLife.isZero() || halfLife.isNegative()) {
            throw new IllegalArgumentException("halfLife must be positive but was " + halfLife);
        }
        EnumMap<SentimentSourceType, Double> copy = new EnumMap<>(SentimentSourceType.class);
        for (SentimentSourceType type : SentimentSourceType.values()) {
            double weight = sourceWeights == null ? 1.0 : sourceWeights.getOrDefault(type, 1.0);
            if (!Double.isFinite(weight) || weight < 0.0) {
                throw new IllegalArgumentException("source weight for " + type + " must be >= 0 but was " + weight);
            }
            copy.put(type, weight);
        }
        sourceWeights = Map.copyOf(copy);
    }

    public double weightFor(SentimentSourceType source) {
        return sourceWeights.getOrDefault(source, 1.0);
    }
}
