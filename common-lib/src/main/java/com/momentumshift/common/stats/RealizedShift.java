package com.momentumshift.common.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.momentumshift.common.model.PlayerRole;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Observed before/after performance shift on a 0–100 scale, 50 neutral.
 * {@code available} is false when either side had no data; the score is then 50.
 */
public record RealizedShift(
    @JsonProperty("playerId")   String playerId,
    @JsonProperty("role")       PlayerRole role,
    @JsonProperty("available")  boolean available,
    @JsonProperty("score")      double score,
    @JsonProperty("components") Map<String, Double> components,
    @JsonProperty("weights")    Map<String, Double> weights
) {
    public RealizedShift {
        components = components == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(components));
        weights    = weights == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }
}
