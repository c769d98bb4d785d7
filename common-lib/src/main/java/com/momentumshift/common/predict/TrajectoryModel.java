package com.momentumshift.common.predict;

import com.momentumshift.common.model.PredictionFeatures;
import com.momentumshift.common.model.TrajectoryPoint;

import java.util.List;

/**
 * A fitted mapping from the prediction feature set to a per-period expected
 * performance trajectory with intervals.
 *
 * <p>Implementations must be immutable once fitted: concurrent forecasts on one
 * instance are safe, and refitting always yields a new instance.
 */
public interface TrajectoryModel {

    int horizon();

    int sampleCount();

    /**
     * @param features  feature set for one (moment, player)
     * @param intervalZ half-width of each interval in residual standard deviations
     * @return exactly {@link #horizon()} points, period 1 first
     */
    List<TrajectoryPoint> forecast(PredictionFeatures features, double intervalZ);
}
