package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Predicted post-moment trajectory for one MSSResult, and once ground truth
 * arrives, the observed trajectory and its error.
 *
 * <p>The only permitted transition is PREDICTED → EVALUATED via {@link #evaluate(List)},
 * which returns a new record; an evaluated record cannot be evaluated again.
 */
public record PredictionRecord(
    @JsonProperty("momentId")          String momentId,
    @JsonProperty("playerId")          String playerId,
    @JsonProperty("weightVersion")     String weightVersion,
    @JsonProperty("modelVersion")      String modelVersion,
    @JsonProperty("score")             double score,
    @JsonProperty("features")          PredictionFeatures features,
    @JsonProperty("predicted")         List<TrajectoryPoint> predicted,
    @JsonProperty("observed")          List<Double> observed,
    @JsonProperty("meanAbsoluteError") Double meanAbsoluteError,
    @JsonProperty("status")            PredictionStatus status
) {
    public PredictionRecord {
        predicted = predicted == null ? List.of() : List.copyOf(predicted);
        observed  = observed == null ? null : List.copyOf(observed);
        if (status == null) status = PredictionStatus.PREDICTED;
    }

    public static PredictionRecord predicted(MssResult result, String modelVersion,
                                             List<TrajectoryPoint> trajectory) {
        return new PredictionRecord(result.momentId(), result.playerId(), result.weightVersion(),
            modelVersion, result.score(), PredictionFeatures.from(result), trajectory,
            null, null, PredictionStatus.PREDICTED);
    }

    /**
     * Attaches the observed trajectory. Error is the mean absolute deviation over the
     * periods both trajectories cover.
     *
     * @throws IllegalStateException    if this record is already evaluated
     * @throws IllegalArgumentException if the observed trajectory is empty
     */
    public PredictionRecord evaluate(List<Double> observedTrajectory) {
        if (status == PredictionStatus.EVALUATED) {
            throw new IllegalStateException("Prediction already evaluated: " + key() + " model=" + modelVersion);
        }
        if (observedTrajectory == null || observedTrajectory.isEmpty()) {
            throw new IllegalArgumentException("Observed trajectory is empty for " + key());
        }
        int overlap = Math.min(predicted.size(), observedTrajectory.size());
        if (overlap == 0) {
            throw new IllegalArgumentException("Prediction has no periods to compare for " + key());
        }
        double sum = 0.0;
        for (int i = 0; i < overlap; i++) {
            sum += Math.abs(predicted.get(i).expected() - observedTrajectory.get(i));
        }
        return new PredictionRecord(momentId, playerId, weightVersion, modelVersion, score, features,
            predicted, observedTrajectory, sum / overlap, PredictionStatus.EVALUATED);
    }

    public String key() {
        return momentId + "|" + playerId;
    }

    /** Mean predicted value minus the pre-moment baseline. */
    public double predictedChange() {
        return predicted.stream().mapToDouble(TrajectoryPoint::expected).average().orElse(features.baseline())
            - features.baseline();
    }

    /** Mean observed value minus the pre-moment baseline; NaN before evaluation. */
    public double realizedChange() {
        if (observed == null || observed.isEmpty()) return Double.NaN;
        return observed.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN)
            - features.baseline();
    }
}
