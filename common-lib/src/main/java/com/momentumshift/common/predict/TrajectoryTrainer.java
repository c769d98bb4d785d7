package com.momentumshift.common.predict;

import com.momentumshift.common.model.TrainingExample;
import com.momentumshift.common.settings.PredictionSettings;

import java.util.List;

/** Fits a {@link TrajectoryModel}; the regression technique is the implementation's choice. */
public interface TrajectoryTrainer {

    /**
     * @throws IllegalArgumentException when fewer than {@code settings.minSamples()} examples are given
     */
    TrajectoryModel fit(List<TrainingExample> examples, PredictionSettings settings);
}
