package com.momentumshift.common.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.momentumshift.common.model.MssResult;

import java.util.List;

/**
 * Results for one moment plus the participants dropped under the SKIP policy.
 * Results are ordered by participant order (batter, pitcher, fielders).
 */
public record ScoringOutcome(
    @JsonProperty("momentId")       String momentId,
    @JsonProperty("results")        List<MssResult> results,
    @JsonProperty("skippedPlayers") List<String> skippedPlayers
) {
    public ScoringOutcome {
        results        = results == null ? List.of() : List.copyOf(results);
        skippedPlayers = skippedPlayers == null ? List.of() : List.copyOf(skippedPlayers);
    }
}
