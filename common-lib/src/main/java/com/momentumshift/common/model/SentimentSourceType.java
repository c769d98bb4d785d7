package com.momentumshift.common.model;

/** Where a sentiment observation was scored. Used for weighting only. */
public enum SentimentSourceType {
    MEDIA,
    FAN,
    SOCIAL
}
