package com.momentumshift.scoring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.momentumshift.common.model.TrainingExample;

import java.util.List;

/** Historical samples for an initial fit. {@code parentVersion} is recorded, not required. */
public record TrainRequest(
    @JsonProperty("examples")      List<TrainingExample> examples,
    @JsonProperty("parentVersion") String parentVersion
) {
    public TrainRequest {
        examples = examples == null ? List.of() : List.copyOf(examples);
    }
}
