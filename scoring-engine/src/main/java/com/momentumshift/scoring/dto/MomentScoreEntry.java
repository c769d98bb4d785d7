package com.momentumshift.scoring.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.momentumshift.common.scoring.ScoringOutcome;

/** Per-moment entry of a batch: either an outcome or the error that rejected the moment. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MomentScoreEntry(
    @JsonProperty("momentId") String momentId,
    @JsonProperty("outcome")  ScoringOutcome outcome,
    @JsonProperty("error")    ErrorResponse error
) {
    public static MomentScoreEntry scored(ScoringOutcome outcome) {
        return new MomentScoreEntry(outcome.momentId(), outcome, null);
    }

    public static MomentScoreEntry failed(String momentId, ErrorResponse error) {
        return new MomentScoreEntry(momentId, null, error);
    }

    public boolean succeeded() {
        return outcome != null;
    }
}
