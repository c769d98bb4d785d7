package com.momentumshift.common.sentiment;

import java.time.Duration;

/**
 * Weight multiplier for an observation of a given age. Implementations must return
 * exactly 1.0 at zero elapsed time and be monotonically non-increasing.
 */
@FunctionalInterface
public interface RecencyDecay {

    double factor(Duration elapsed);
}
