package com.momentumshift.common.predict;

import com.momentumshift.common.exception.UntrainedModelException;
import com.momentumshift.common.model.MssResult;
import com.momentumshift.common.model.PredictionFeatures;
import com.momentumshift.common.model.PredictionRecord;
import com.momentumshift.common.model.TrajectoryPoint;
import com.momentumshift.common.settings.PredictionSettings;

import java.util.List;

/**
 * Maps an {@link MssResult} to a {@link PredictionRecord} using one explicit model version.
 * Missing sentiment needs no handling here: it already arrives as N = 0.
 */
public final class OutcomePredictor {

    private OutcomePredictor() {}

    public static PredictionRecord predict(MssResult result, VersionedModel model, PredictionSettings settings) {
        if (model == null || !model.trained()) {
            throw new UntrainedModelException(model == null ? "none" : model.version());
        }
        List<TrajectoryPoint> trajectory = model.model().forecast(PredictionFeatures.from(result), settings.intervalZ());
        for (TrajectoryPoint point : trajectory) {
            if (!Double.isFinite(point.expected()) || point.lower() > point.upper()) {
                throw new IllegalStateException("Model " + model.version() + " produced an invalid forecast for "
                    + result.key() + " at period " + point.period());
            }
        }
        return PredictionRecord.predicted(result, model.version(), trajectory);
    }
}
