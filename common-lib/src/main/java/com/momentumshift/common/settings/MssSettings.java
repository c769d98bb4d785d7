package com.momentumshift.common.settings;

import com.momentumshift.common.model.InsufficientHistoryPolicy;

/**
 * The complete, immutable configuration surface of the engine. Built once by the
 * hosting service and handed to each stage explicitly.
 */
public record MssSettings(
    ContextSettings context,
    InsufficientHistoryPolicy insufficientHistoryPolicy,
    ImpactSettings impact,
    SentimentSettings sentiment,
    MultiplierSettings multiplier,
    PredictionSettings prediction
) {
    public MssSettings {
        if (context == null || impact == null || sentiment == null || multiplier == null || prediction == null) {
            throw new IllegalArgumentException("every settings section is required");
        }
        if (insufficientHistoryPolicy == null) {
            insufficientHistoryPolicy = InsufficientHistoryPolicy.FAIL;
        }
    }
}
