package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One pitch or play inside a raw event, as delivered by the play-by-play feed. */
public record RawPlay(
    @JsonProperty("sequence")    Integer sequence,
    @JsonProperty("description") String description,
    @JsonProperty("runsScored")  Integer runsScored
) {}
