package com.momentumshift.common.context;

import com.momentumshift.common.model.PlayerContext;

/**
 * Amplification applied to the narrative term. Implementations must be
 * deterministic, strictly positive, non-increasing in career stage and
 * non-decreasing in how far the trailing baseline sits below the career average.
 */
@FunctionalInterface
public interface ContextMultiplierFunction {

    double multiplier(PlayerContext context);
}
