package com.momentumshift.scoring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Many moments scored under one weight version; per-moment versions are ignored. */
public record BatchScoreRequest(
    @JsonProperty("moments")       List<ScoreRequest> moments,
    @JsonProperty("weightVersion") String weightVersion
) {
    public BatchScoreRequest {
        moments = moments == null ? List.of() : List.copyOf(moments);
    }
}
