package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Versioned composer weight set. A refit never edits an instance; it derives a
 * new version whose {@code parentVersion} points back here.
 */
public record ComposerWeights(
    @JsonProperty("version")       String version,
    @JsonProperty("w1")            double w1,
    @JsonProperty("w2")            double w2,
    @JsonProperty("parentVersion") String parentVersion,
    @JsonProperty("createdAt")     Instant createdAt
) {
    public ComposerWeights {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("weight version must not be blank");
        }
        if (!Double.isFinite(w1) || !Double.isFinite(w2)) {
            throw new IllegalArgumentException("weights must be finite: w1=" + w1 + " w2=" + w2);
        }
    }

    public ComposerWeights derive(String newVersion, double newW1, double newW2, Instant at) {
        return new ComposerWeights(newVersion, newW1, newW2, version, at);
    }
}
