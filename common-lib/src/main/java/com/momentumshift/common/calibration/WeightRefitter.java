package com.momentumshift.common.calibration;

import com.momentumshift.common.model.CalibrationIssue;
import com.momentumshift.common.model.CalibrationIssue.Code;
import com.momentumshift.common.model.ComposerWeights;
import com.momentumshift.common.model.PredictionRecord;
import com.momentumshift.common.model.PredictionStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Refits the composer weights (w₁, w₂) against realized change.
 *
 * <p><b>Fit</b> (least squares, no intercept) over evaluated records:
 * <pre>
 *   realizedChange ≈ a·S + b·(N × contextMultiplier)
 *   a, b = max(0, ·)
 *   w₁' = scale · a / (a + b)
 *   w₂' = scale · b / (a + b)        scale = w₁ + w₂ of the parent version
 * </pre>
 * The parent's total w₁ + w₂ is preserved.
 *
 * <p>When the fit is degenerate (too few samples, singular system, or both
 * coefficients clamped to zero) the new version inherits the parent's weights
 * and the reason is returned as an issue.
 */
public final class WeightRefitter {

    static final int MIN_SAMPLES = 2;

    private WeightRefitter() {}

    public record Fit(ComposerWeights weights, int sampleCount, List<CalibrationIssue> issues) {}

    public static Fit refit(List<PredictionRecord> evaluated, ComposerWeights parent, String newVersion, Instant at) {
        List<CalibrationIssue> issues = new ArrayList<>();
        List<PredictionRecord> usable = evaluated.stream()
            .filter(r -> r.status() == PredictionStatus.EVALUATED && Double.isFinite(r.realizedChange()))
            .toList();

        if (usable.size() < MIN_SAMPLES) {
            issues.add(CalibrationIssue.of(Code.INSUFFICIENT_SAMPLES, parent.version(),
                "weight refit needs at least " + MIN_SAMPLES + " evaluated records, got " + usable.size()));
            return new Fit(parent.derive(newVersion, parent.w1(), parent.w2(), at), usable.size(), issues);
        }

        double sss = 0.0, ssx = 0.0, sxx = 0.0, ssy = 0.0, sxy = 0.0;
        for (PredictionRecord r : usable) {
            double s = r.features().statisticalComponent();
            double x = r.features().narrativeComponent() * r.features().contextMultiplier();
            double y = r.realizedChange();
            sss += s * s;
            ssx += s * x;
            sxx += x * x;
            ssy += s * y;
            sxy += x * y;
        }
        double det = sss * sxx - ssx * ssx;
        if (Math.abs(det) < Statistics.EPSILON) {
            issues.add(CalibrationIssue.of(Code.DEGENERATE_WEIGHT_FIT, parent.version(),
                "statistical and narrative terms are collinear or constant; weights carried over"));
            return new Fit(parent.derive(newVersion, parent.w1(), parent.w2(), at), usable.size(), issues);
        }
        double a = Math.max(0.0, (ssy * sxx - sxy * ssx) / det);
        double b = Math.max(0.0, (sss * sxy - ssx * ssy) / det);
        if (a + b < Statistics.EPSILON) {
            issues.add(CalibrationIssue.of(Code.DEGENERATE_WEIGHT_FIT, parent.version(),
                "no positive relationship between score terms and realized change; weights carried over"));
            return new Fit(parent.derive(newVersion, parent.w1(), parent.w2(), at), usable.size(), issues);
        }
        double scale = parent.w1() + parent.w2();
        return new Fit(parent.derive(newVersion, scale * a / (a + b), scale * b / (a + b), at), usable.size(), issues);
    }
}
