package com.momentumshift.scoring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One (moment, player) pair whose realized trajectory is requested from the ground-truth source. */
public record OutcomeQuery(
    @JsonProperty("momentId") String momentId,
    @JsonProperty("playerId") String playerId,
    @JsonProperty("periods")  int periods
) {}
