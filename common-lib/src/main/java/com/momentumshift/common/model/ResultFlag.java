package com.momentumshift.common.model;

public enum ResultFlag {
    NO_SENTIMENT_DATA,
    LOW_CONFIDENCE_CONTEXT,
    CLAMPED
}
