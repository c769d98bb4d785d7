package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** One historical (features, realized trajectory) pair used to fit a trajectory model. */
public record TrainingExample(
    @JsonProperty("features") PredictionFeatures features,
    @JsonProperty("observed") List<Double> observed
) {
    public TrainingExample {
        observed = observed == null ? List.of() : List.copyOf(observed);
    }
}
