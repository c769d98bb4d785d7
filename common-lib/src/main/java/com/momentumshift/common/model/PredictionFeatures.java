package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Feature set consumed by every trajectory model: {S, N, contextMultiplier, baseline, role}. */
public record PredictionFeatures(
    @JsonProperty("statisticalComponent") double statisticalComponent,
    @JsonProperty("narrativeComponent")   double narrativeComponent,
    @JsonProperty("contextMultiplier")    double contextMultiplier,
    @JsonProperty("baseline")             double baseline,
    @JsonProperty("role")                 PlayerRole role
) {
    public static PredictionFeatures from(MssResult result) {
        return new PredictionFeatures(
            result.statisticalComponent(),
            result.narrativeComponent(),
            result.contextMultiplier(),
            result.baseline(),
            result.role());
    }
}
