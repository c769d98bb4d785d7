package com.momentumshift.scoring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Batch scoring result; {@code entries} are sorted by moment id. */
public record BatchScoreResponse(
    @JsonProperty("runId")         String runId,
    @JsonProperty("weightVersion") String weightVersion,
    @JsonProperty("scored")        int scored,
    @JsonProperty("failed")        int failed,
    @JsonProperty("entries")       List<MomentScoreEntry> entries
) {}
