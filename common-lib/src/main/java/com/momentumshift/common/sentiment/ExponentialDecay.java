package com.momentumshift.common.sentiment;

import java.time.Duration;

/** {@code factor = 0.5 ^ (elapsed / halfLife)}. */
public final class ExponentialDecay implements RecencyDecay {

    private final double halfLifeSeconds;

    public ExponentialDecay(Duration halfLife) {
        if (halfLife == null || halfLife.isZero() || halfLife.isNegative()) {
            throw new IllegalArgumentException("halfLife must be positive but was " + halfLife);
        }
        this.halfLifeSeconds = halfLife.toMillis() / 1000.0;
    }

    @Override
    public double factor(Duration elapsed) {
        if (elapsed == null || elapsed.isZero() || elapsed.isNegative()) return 1.0;
        return Math.pow(0.5, (elapsed.toMillis() / 1000.0) / halfLifeSeconds);
    }
}
