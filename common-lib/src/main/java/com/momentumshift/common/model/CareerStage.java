package com.momentumshift.common.model;

/**
 * Discretised career stage. Declared in order of trajectory fragility:
 * earlier constants are amplified more by the context multiplier.
 */
public enum CareerStage {
    ROOKIE,
    PRIME,
    VETERAN
}
