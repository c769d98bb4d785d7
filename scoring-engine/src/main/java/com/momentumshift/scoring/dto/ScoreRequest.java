package com.momentumshift.scoring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.momentumshift.common.model.PlayerHistory;
import com.momentumshift.common.model.RawMomentEvent;
import com.momentumshift.common.model.SentimentObservation;

import java.util.List;
import java.util.Map;

/**
 * One moment to score.
 *
 * <p>{@code histories} and {@code sentiment} are optional: when absent they are read
 * from the player-history store and the sentiment source. An empty sentiment list
 * means "no sentiment", not "fetch it". {@code weightVersion} defaults to the
 * current weight version.
 */
public record ScoreRequest(
    @JsonProperty("event")         RawMomentEvent event,
    @JsonProperty("histories")     Map<String, PlayerHistory> histories,
    @JsonProperty("sentiment")     List<SentimentObservation> sentiment,
    @JsonProperty("weightVersion") String weightVersion
) {
    public String momentId() {
        return event == null || event.momentId() == null ? "unknown" : event.momentId();
    }
}
