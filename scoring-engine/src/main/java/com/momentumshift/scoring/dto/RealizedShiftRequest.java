package com.momentumshift.scoring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.momentumshift.common.model.PlayerRole;
import com.momentumshift.common.stats.PitchEvent;

import java.util.List;
import java.util.Map;

/**
 * Tracking rows for one player before and after a moment. {@code weights} is
 * optional; the role's default component weights apply when it is null.
 */
public record RealizedShiftRequest(
    @JsonProperty("playerId") String playerId,
    @JsonProperty("role")     PlayerRole role,
    @JsonProperty("before")   List<PitchEvent> before,
    @JsonProperty("after")    List<PitchEvent> after,
    @JsonProperty("weights")  Map<String, Double> weights
) {}
