package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Backtest summary of a batch of predictions against realized outcomes.
 *
 * <ul>
 *   <li>{@code meanAbsoluteError} – mean of per-record MAE</li>
 *   <li>{@code rootMeanSquaredError} – over every compared period in the batch</li>
 *   <li>{@code scoreChangeCorrelation} – Pearson r of signed MSS vs. realized change</li>
 *   <li>{@code magnitudeCorrelation} – Pearson r of |MSS| vs. |realized change|</li>
 * </ul>
 * Metrics that cannot be computed are {@code null} and explained in {@code issues}.
 */
public record CalibrationReport(
    @JsonProperty("batchSize")              int batchSize,
    @JsonProperty("evaluatedCount")         int evaluatedCount,
    @JsonProperty("evaluated")              List<PredictionRecord> evaluated,
    @JsonProperty("meanAbsoluteError")      Double meanAbsoluteError,
    @JsonProperty("rootMeanSquaredError")   Double rootMeanSquaredError,
    @JsonProperty("scoreChangeCorrelation") Double scoreChangeCorrelation,
    @JsonProperty("magnitudeCorrelation")   Double magnitudeCorrelation,
    @JsonProperty("issues")                 List<CalibrationIssue> issues
) {
    public CalibrationReport {
        evaluated = evaluated == null ? List.of() : List.copyOf(evaluated);
        issues    = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean hasIssue(CalibrationIssue.Code code) {
        return issues.stream().anyMatch(i -> i.code() == code);
    }
}
