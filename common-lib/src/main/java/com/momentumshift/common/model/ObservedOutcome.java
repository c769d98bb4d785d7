package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Realized per-period performance after a moment, from the ground-truth source. */
public record ObservedOutcome(
    @JsonProperty("momentId") String momentId,
    @JsonProperty("playerId") String playerId,
    @JsonProperty("observed") List<Double> observed
) {
    public ObservedOutcome {
        observed = observed == null ? List.of() : List.copyOf(observed);
    }

    public String key() {
        return momentId + "|" + playerId;
    }
}
