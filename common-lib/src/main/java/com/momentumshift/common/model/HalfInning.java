package com.momentumshift.common.model;

/** TOP = away team batting, BOTTOM = home team batting. */
public enum HalfInning {
    TOP,
    BOTTOM
}
