package com.momentumshift.common.calibration;

import com.momentumshift.common.model.CalibrationIssue;
import com.momentumshift.common.model.CalibrationIssue.Code;
import com.momentumshift.common.model.CalibrationReport;
import com.momentumshift.common.model.ComposerWeights;
import com.momentumshift.common.model.ObservedOutcome;
import com.momentumshift.common.model.PredictionRecord;
import com.momentumshift.common.model.TrainingExample;
import com.momentumshift.common.predict.TrajectoryModel;
import com.momentumshift.common.predict.TrajectoryTrainer;
import com.momentumshift.common.predict.VersionedModel;
import com.momentumshift.common.settings.PredictionSettings;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The calibration loop: evaluate a batch, then derive a new weight version and a new
 * model version from it. Inputs are never modified; both outputs point back at the
 * versions they were derived from.
 */
public final class Calibrator {

    private Calibrator() {}

    public static RefitResult refit(List<PredictionRecord> records,
                                    List<ObservedOutcome> outcomes,
                                    ComposerWeights parentWeights,
                                    String newWeightVersion,
                                    String parentModelVersion,
                                    String newModelVersion,
                                    TrajectoryTrainer trainer,
                                    PredictionSettings settings,
                                    Instant at) {
        CalibrationReport report = Evaluator.evaluate(records, outcomes);
        List<CalibrationIssue> issues = new ArrayList<>(report.issues());

        WeightRefitter.Fit fit = WeightRefitter.refit(report.evaluated(), parentWeights, newWeightVersion, at);
        issues.addAll(fit.issues());

        VersionedModel model = null;
        try {
            TrajectoryModel fitted = trainer.fit(trainingExamples(report.evaluated()), settings);
            model = new VersionedModel(newModelVersion, parentModelVersion, fitted, at);
        } catch (IllegalArgumentException e) {
            issues.add(CalibrationIssue.of(Code.INSUFFICIENT_SAMPLES, parentModelVersion, e.getMessage()));
        }
        return new RefitResult(report, fit.weights(), model, issues);
    }

    public static List<TrainingExample> trainingExamples(List<PredictionRecord> evaluated) {
        return evaluated.stream()
            .filter(r -> r.observed() != null && !r.observed().isEmpty())
            .map(r -> new TrainingExample(r.features(), r.observed()))
            .toList();
    }
}
