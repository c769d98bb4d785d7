package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Pre-scored sentiment measurement from an external source. The engine never
 * computes polarity itself, it only aggregates.
 *
 * <p>A {@code null} playerId means the observation is about the moment as a
 * whole and counts toward every participant.
 */
public record SentimentObservation(
    @JsonProperty("momentId")      String momentId,
    @JsonProperty("playerId")      String playerId,
    @JsonProperty("source")        SentimentSourceType source,
    @JsonProperty("polarity")      double polarity,
    @JsonProperty("volume")        double volume,
    @JsonProperty("recencyOffset") Duration recencyOffset
) {
    public SentimentObservation {
        if (!Double.isFinite(polarity) || polarity < -1.0 || polarity > 1.0) {
            throw new IllegalArgumentException("polarity must lie in [-1, 1] but was " + polarity);
        }
        if (!Double.isFinite(volume) || volume < 0.0) {
            throw new IllegalArgumentException("volume must be a non-negative number but was " + volume);
        }
        if (recencyOffset == null) {
            recencyOffset = Duration.ZERO;
        } else if (recencyOffset.isNegative()) {
            throw new IllegalArgumentException("recencyOffset must not be negative but was " + recencyOffset);
        }
        if (source == null) {
            source = SentimentSourceType.MEDIA;
        }
    }

    public boolean appliesTo(String momentId, String playerId) {
        return this.momentId != null && this.momentId.equals(momentId)
            && (this.playerId == null || this.playerId.equals(playerId));
    }
}
