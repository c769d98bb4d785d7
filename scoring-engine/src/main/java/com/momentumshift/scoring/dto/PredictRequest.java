package com.momentumshift.scoring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.momentumshift.common.model.MssResult;

/** {@code modelVersion} defaults to the current model version. */
public record PredictRequest(
    @JsonProperty("result")       MssResult result,
    @JsonProperty("modelVersion") String modelVersion
) {}
