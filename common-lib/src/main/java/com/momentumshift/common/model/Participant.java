package com.momentumshift.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Participant(
    @JsonProperty("playerId") String playerId,
    @JsonProperty("role")     PlayerRole role
) {}
