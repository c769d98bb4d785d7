package com.momentumshift.common.predict;

import com.momentumshift.common.model.PlayerRole;
import com.momentumshift.common.model.PredictionFeatures;
import com.momentumshift.common.model.TrajectoryPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-period linear model on the feature vector built by {@link #featureVector}.
 *
 * <pre>
 *   expected_k = baseline + β_k · x
 *   interval_k = expected_k ± z · σ_k
 * </pre>
 *
 * With all-zero coefficients the forecast is the flat baseline.
 */
public final class RidgeTrajectoryModel implements TrajectoryModel {

    static final int INTERCEPT   = 0;
    static final int STATISTICAL = 1;
    static final int NARRATIVE   = 2;
    static final int MULTIPLIER  = 3;
    static final int BASELINE    = 4;
    static final int PITCHER     = 5;
    static final int FIELDER     = 6;
    static final int FEATURE_COUNT = 7;

    private final double[][] coefficients;
    private final double[] residualSd;
    private final int sampleCount;

    RidgeTrajectoryModel(double[][] coefficients, double[] residualSd, int sampleCount) {
        this.coefficients = new double[coefficients.length][];
        for (int k = 0; k < coefficients.length; k++) {
            this.coefficients[k] = coefficients[k].clone();
        }
        this.residualSd = residualSd.clone();
        this.sampleCount = sampleCount;
    }

    static double[] featureVector(PredictionFeatures f) {
        double[] x = new double[FEATURE_COUNT];
        x[INTERCEPT]   = 1.0;
        x[STATISTICAL] = f.statisticalComponent();
        x[NARRATIVE]   = f.narrativeComponent() * f.contextMultiplier();
        x[MULTIPLIER]  = f.contextMultiplier();
        x[BASELINE]    = f.baseline();
        x[PITCHER]     = f.role() == PlayerRole.PITCHER ? 1.0 : 0.0;
        x[FIELDER]     = f.role() == PlayerRole.FIELDER ? 1.0 : 0.0;
        return x;
    }

    @Override
    public int horizon() {
        return coefficients.length;
    }

    @Override
    public int sampleCount() {
        return sampleCount;
    }

    @Override
    public List<TrajectoryPoint> forecast(PredictionFeatures features, double intervalZ) {
        double[] x = featureVector(features);
        List<TrajectoryPoint> points = new ArrayList<>(coefficients.length);
        for (int k = 0; k < coefficients.length; k++) {
            double delta = 0.0;
            for (int j = 0; j < FEATURE_COUNT; j++) {
                delta += coefficients[k][j] * x[j];
            }
            double expected = features.baseline() + delta;
            double halfWidth = intervalZ * residualSd[k];
            points.add(new TrajectoryPoint(k + 1, expected, expected - halfWidth, expected + halfWidth));
        }
        return points;
    }

    public double coefficient(int period, int feature) {
        return coefficients[period][feature];
    }

    public double residualSd(int period) {
        return residualSd[period];
    }
}
