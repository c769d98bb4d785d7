package com.momentumshift.common.calibration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.momentumshift.common.model.CalibrationIssue;
import com.momentumshift.common.model.CalibrationReport;
import com.momentumshift.common.model.ComposerWeights;
import com.momentumshift.common.predict.VersionedModel;

import java.util.List;

/**
 * Outcome of one calibration pass. {@code model} is {@code null} when the predictor
 * could not be refit; the reason is in {@code issues}.
 */
public record RefitResult(
    @JsonProperty("report")  CalibrationReport report,
    @JsonProperty("weights") ComposerWeights weights,
    @JsonProperty("model")   VersionedModel model,
    @JsonProperty("issues")  List<CalibrationIssue> issues
) {
    public RefitResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
