package com.momentumshift.common.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Batting average (or average against) inside one game situation. */
public record SituationalSplit(
    @JsonProperty("average") double average,
    @JsonProperty("atBats")  int atBats
) {}
