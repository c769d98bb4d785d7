package com.momentumshift.common.model;

public enum PredictionStatus {
    PREDICTED,
    EVALUATED
}
