package com.momentumshift.common.settings;

/**
 * @param horizon     number of future periods in every predicted trajectory
 * @param ridgeLambda L2 penalty on non-intercept coefficients, strictly positive
 * @param intervalZ   half-width of the per-period interval in residual standard deviations
 * @param minSamples  fewest training examples accepted by a fit
 */
public record PredictionSettings(int horizon, double ridgeLambda, double intervalZ, int minSamples) {

    public PredictionSettings {
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be >= 1 but was " + horizon);
        }
        if (!(ridgeLambda > 0.0)) {
            throw new IllegalArgumentException("ridgeLambda must be positive but was " + ridgeLambda);
        }
        if (intervalZ < 0.0) {
            throw new IllegalArgumentException("intervalZ must be non-negative but was " + intervalZ);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1 but was " + minSamples);
        }
    }
}
