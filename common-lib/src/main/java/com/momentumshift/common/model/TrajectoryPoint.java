package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Expected performance for one future period with its confidence interval. */
public record TrajectoryPoint(
    @JsonProperty("period")   int period,
    @JsonProperty("expected") double expected,
    @JsonProperty("lower")    double lower,
    @JsonProperty("upper")    double upper
) {}
