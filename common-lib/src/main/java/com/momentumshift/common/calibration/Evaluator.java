package com.momentumshift.common.calibration;

import com.momentumshift.common.model.CalibrationIssue;
import com.momentumshift.common.model.CalibrationIssue.Code;
import com.momentumshift.common.model.CalibrationReport;
import com.momentumshift.common.model.ObservedOutcome;
import com.momentumshift.common.model.PredictionRecord;
import com.momentumshift.common.model.PredictionStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backtests a batch of predictions against realized trajectories.
 *
 * <p>Per record: mean absolute deviation over the periods both trajectories cover.
 * Per batch:
 * <pre>
 *   meanAbsoluteError      = mean(record MAE)
 *   rootMeanSquaredError   = sqrt(mean(squared error over every compared period))
 *   scoreChangeCorrelation = pearson(MSS, realizedChange)
 *   magnitudeCorrelation   = pearson(|MSS|, |realizedChange|)
 * </pre>
 * where {@code realizedChange = mean(observed) − baseline}.
 *
 * <p>Nothing here throws for data problems. Missing outcomes, empty predicted trajectories,
 * records that were already evaluated, horizon mismatches and degenerate batches all become {@link CalibrationIssue}s
 * on the report, and the affected metric is left {@code null}.
 */
public final class Evaluator {

    static final int MIN_CORRELATION_SAMPLES = 2;

    private Evaluator() {}

    public static CalibrationReport evaluate(List<PredictionRecord> records, List<ObservedOutcome> outcomes) {
        List<CalibrationIssue> issues = new ArrayList<>();
        if (records == null || records.isEmpty()) {
            issues.add(CalibrationIssue.of(Code.EMPTY_BATCH, "batch", "no prediction records supplied"));
            return new CalibrationReport(0, 0, List.of(), null, null, null, null, issues);
        }

        Map<String, ObservedOutcome> byKey = new LinkedHashMap<>();
        if (outcomes != null) {
            for (ObservedOutcome outcome : outcomes) {
                byKey.putIfAbsent(outcome.key(), outcome);
            }
        }

        List<PredictionRecord> evaluated = new ArrayList<>();
        for (PredictionRecord record : records) {
            if (record.status() == PredictionStatus.EVALUATED) {
                issues.add(CalibrationIssue.of(Code.ALREADY_EVALUATED, record.key(),
                    "prediction under model " + record.modelVersion() + " was already evaluated"));
                continue;
            }
            if (record.predicted().isEmpty()) {
                issues.add(CalibrationIssue.of(Code.EMPTY_PREDICTION, record.key(),
                    "prediction under model " + record.modelVersion() + " has no periods to compare"));
                continue;
            }
            ObservedOutcome outcome = byKey.get(record.key());
            if (outcome == null || outcome.observed().isEmpty()) {
                issues.add(CalibrationIssue.of(Code.MISSING_OUTCOME, record.key(), "no observed trajectory"));
                continue;
            }
            if (outcome.observed().size() != record.predicted().size()) {
                issues.add(CalibrationIssue.of(Code.HORIZON_MISMATCH, record.key(),
                    "predicted " + record.predicted().size() + " periods, observed "
                        + outcome.observed().size() + "; compared over the overlap"));
            }
            evaluated.add(record.evaluate(outcome.observed()));
        }
        evaluated.sort(Comparator.comparing(PredictionRecord::momentId).thenComparing(PredictionRecord::playerId));

        if (evaluated.isEmpty()) {
            return new CalibrationReport(records.size(), 0, evaluated, null, null, null, null, issues);
        }

        double maeSum = 0.0;
        double squaredSum = 0.0;
        int periods = 0;
        double[] scores = new double[evaluated.size()];
        double[] changes = new double[evaluated.size()];
        for (int i = 0; i < evaluated.size(); i++) {
            PredictionRecord r = evaluated.get(i);
            maeSum += r.meanAbsoluteError();
            int overlap = Math.min(r.predicted().size(), r.observed().size());
            for (int k = 0; k < overlap; k++) {
                double err = r.predicted().get(k).expected() - r.observed().get(k);
                squaredSum += err * err;
                periods++;
            }
            scores[i] = r.score();
            changes[i] = r.realizedChange();
        }
        Double mae = maeSum / evaluated.size();
        Double rmse = Math.sqrt(squaredSum / periods);

        Double signed = null;
        Double magnitude = null;
        if (evaluated.size() < MIN_CORRELATION_SAMPLES) {
            issues.add(CalibrationIssue.of(Code.INSUFFICIENT_SAMPLES, "batch",
                "correlation needs at least " + MIN_CORRELATION_SAMPLES + " evaluated records, got " + evaluated.size()));
        } else {
            boolean degenerateObserved = Statistics.degenerate(changes);
            boolean degenerateScores = Statistics.degenerate(scores);
            if (degenerateObserved) {
                issues.add(CalibrationIssue.of(Code.DEGENERATE_OBSERVED_VARIANCE, "batch",
                    "realized change has zero variance across " + evaluated.size() + " records"));
            }
            if (degenerateScores) {
                issues.add(CalibrationIssue.of(Code.DEGENERATE_SCORE_VARIANCE, "batch",
                    "MSS has zero variance across " + evaluated.size() + " records"));
            }
            if (!degenerateObserved && !degenerateScores) {
                signed = Statistics.pearson(scores, changes);
                double[] absScores = abs(scores);
                double[] absChanges = abs(changes);
                magnitude = Statistics.pearson(absScores, absChanges);
                if (magnitude == null) {
                    Code code = Statistics.degenerate(absChanges)
                        ? Code.DEGENERATE_OBSERVED_VARIANCE : Code.DEGENERATE_SCORE_VARIANCE;
                    issues.add(CalibrationIssue.of(code, "magnitude", "absolute values have zero variance"));
                }
            }
        }
        return new CalibrationReport(records.size(), evaluated.size(), evaluated, mae, rmse, signed, magnitude, issues);
    }

    private static double[] abs(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = Math.abs(values[i]);
        return out;
    }
}
