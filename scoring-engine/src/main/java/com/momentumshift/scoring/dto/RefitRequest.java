package com.momentumshift.scoring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.momentumshift.common.model.ObservedOutcome;
import com.momentumshift.common.model.PredictionRecord;

import java.util.List;

/**
 * Calibration batch plus the parent versions to derive from (current when absent).
 * Outcomes are fetched from the ground-truth source when null.
 */
public record RefitRequest(
    @JsonProperty("records")       List<PredictionRecord> records,
    @JsonProperty("outcomes")      List<ObservedOutcome> outcomes,
    @JsonProperty("weightVersion") String weightVersion,
    @JsonProperty("modelVersion")  String modelVersion
) {
    public RefitRequest {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
