package com.momentumshift.common.model;

public enum SeasonPhase {
    REGULAR_SEASON,
    POSTSEASON
}
