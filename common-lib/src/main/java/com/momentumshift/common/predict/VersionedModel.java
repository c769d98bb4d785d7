package com.momentumshift.common.predict;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One immutable entry of the model registry. An untrained version carries a
 * {@code null} model; predicting against it is an error, never a zero forecast.
 */
public record VersionedModel(
    @JsonProperty("version")       String version,
    @JsonProperty("parentVersion") String parentVersion,
    @JsonIgnore                    TrajectoryModel model,
    @JsonProperty("createdAt")     Instant createdAt
) {
    @JsonProperty("trained")
    public boolean trained() {
        return model != null;
    }

    @JsonProperty("sampleCount")
    public int sampleCount() {
        return model == null ? 0 : model.sampleCount();
    }

    @JsonProperty("horizon")
    public int horizon() {
        return model == null ? 0 : model.horizon();
    }

    public static VersionedModel untrained(String version, Instant createdAt) {
        return new VersionedModel(version, null, null, createdAt);
    }
}
