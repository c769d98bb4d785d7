package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Aggregated narrative component N for one (moment, player) pair. */
public record SentimentSignal(
    @JsonProperty("momentId")         String momentId,
    @JsonProperty("playerId")         String playerId,
    @JsonProperty("narrative")        double narrative,
    @JsonProperty("observationCount") int observationCount,
    @JsonProperty("totalWeight")      double totalWeight,
    @JsonProperty("noSentimentData")  boolean noSentimentData
) {
    public static SentimentSignal none(String momentId, String playerId, int observationCount) {
        return new SentimentSignal(momentId, playerId, 0.0, observationCount, 0.0, true);
    }
}
