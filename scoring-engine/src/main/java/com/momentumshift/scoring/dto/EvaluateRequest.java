package com.momentumshift.scoring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.momentumshift.common.model.ObservedOutcome;
import com.momentumshift.common.model.PredictionRecord;

import java.util.List;

/**
 * Prediction records to evaluate. When {@code outcomes} is null the realized
 * trajectories are read from the ground-truth source.
 */
public record EvaluateRequest(
    @JsonProperty("records")  List<PredictionRecord> records,
    @JsonProperty("outcomes") List<ObservedOutcome> outcomes
) {
    public EvaluateRequest {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
