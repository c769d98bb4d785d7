package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Every sub-term behind one composite score.
 *
 * <pre>
 *   statisticalTerm = w1 × S
 *   narrativeTerm   = w2 × N × contextMultiplier
 *   unclampedScore  = statisticalTerm + narrativeTerm
 * </pre>
 *
 * {@link #reconstruct()} re-adds the stored terms and always equals
 * {@code unclampedScore} exactly.
 */
public record ScoreBreakdown(
    @JsonProperty("teamDeltaWinProbability") double teamDeltaWinProbability,
    @JsonProperty("phaseWeight")             double phaseWeight,
    @JsonProperty("statisticalComponent")    double statisticalComponent,
    @JsonProperty("narrativeComponent")      double narrativeComponent,
    @JsonProperty("contextMultiplier")       double contextMultiplier,
    @JsonProperty("w1")                      double w1,
    @JsonProperty("w2")                      double w2,
    @JsonProperty("statisticalTerm")         double statisticalTerm,
    @JsonProperty("narrativeTerm")           double narrativeTerm,
    @JsonProperty("unclampedScore")          double unclampedScore,
    @JsonProperty("clamped")                 boolean clamped
) {
    public double reconstruct() {
        return statisticalTerm + narrativeTerm;
    }
}
