package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-player, per-moment context produced by
 * {@link com.momentumshift.common.context.ContextEnricher}.
 *
 * <p>{@code teamDeltaWinProbability} is the moment's ΔWP seen from this player's
 * team; {@code side} is its sign. {@code lowConfidence} is set when the trailing
 * window was shorter than the configured minimum and the caller chose to proceed.
 */
public record PlayerContext(
    @JsonProperty("momentId")                String momentId,
    @JsonProperty("playerId")                String playerId,
    @JsonProperty("role")                    PlayerRole role,
    @JsonProperty("careerStage")             CareerStage careerStage,
    @JsonProperty("seasonsPlayed")           double seasonsPlayed,
    @JsonProperty("baseline")                double baseline,
    @JsonProperty("careerAverage")           double careerAverage,
    @JsonProperty("appearancesUsed")         int appearancesUsed,
    @JsonProperty("side")                    Side side,
    @JsonProperty("teamDeltaWinProbability") double teamDeltaWinProbability,
    @JsonProperty("lowConfidence")           boolean lowConfidence
) {}
