package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A calibration problem reported inside a {@link CalibrationReport} instead of
 * being thrown, so a batch job can keep processing other groupings.
 */
public record CalibrationIssue(
    @JsonProperty("code")    Code code,
    @JsonProperty("subject") String subject,
    @JsonProperty("detail")  String detail
) {
    public enum Code {
        EMPTY_BATCH,
        MISSING_OUTCOME,
        EMPTY_PREDICTION,
        ALREADY_EVALUATED,
        HORIZON_MISMATCH,
        INSUFFICIENT_SAMPLES,
        DEGENERATE_OBSERVED_VARIANCE,
        DEGENERATE_SCORE_VARIANCE,
        DEGENERATE_WEIGHT_FIT
    }

    public static CalibrationIssue of(Code code, String subject, String detail) {
        return new CalibrationIssue(code, subject, detail);
    }
}
