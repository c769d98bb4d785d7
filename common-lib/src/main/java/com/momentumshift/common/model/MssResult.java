package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Momentum Shift Score for one (moment, player) pair under one weight version.
 * Immutable once emitted; refits produce new results under a new version and
 * never touch this one.
 *
 * <p>{@code baseline} and {@code role} are carried so the outcome predictor can
 * run from the result alone.
 */
public record MssResult(
    @JsonProperty("momentId")             String momentId,
    @JsonProperty("playerId")             String playerId,
    @JsonProperty("role")                 PlayerRole role,
    @JsonProperty("side")                 Side side,
    @JsonProperty("weightVersion")        String weightVersion,
    @JsonProperty("statisticalComponent") double statisticalComponent,
    @JsonProperty("narrativeComponent")   double narrativeComponent,
    @JsonProperty("contextMultiplier")    double contextMultiplier,
    @JsonProperty("baseline")             double baseline,
    @JsonProperty("score")                double score,
    @JsonProperty("breakdown")            ScoreBreakdown breakdown,
    @JsonProperty("flags")                List<ResultFlag> flags
) {
    public MssResult {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public boolean hasFlag(ResultFlag flag) {
        return flags.contains(flag);
    }

    public String key() {
        return momentId + "|" + playerId;
    }
}
