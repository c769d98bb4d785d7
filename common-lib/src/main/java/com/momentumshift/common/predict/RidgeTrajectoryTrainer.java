package com.momentumshift.common.predict;

import com.momentumshift.common.model.TrainingExample;
import com.momentumshift.common.settings.PredictionSettings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fits one ridge regression per horizon period on {@code observed_k − baseline}.
 *
 * <p><b>Solve</b>: {@code (XᵀX + λD) β = Xᵀy} where D is the identity with a zero in the
 * intercept slot, via Gaussian elimination with partial pivoting. λ &gt; 0 keeps the
 * system positive definite for any non-empty sample.
 *
 * <p><b>Monotonic sanity</b>: the coefficients on the statistical and on the
 * multiplied narrative feature must not be negative. A violating feature is dropped
 * and the period refit without it.
 *
 * <p>Periods that no example covers get zero coefficients and zero spread.
 */
public final class RidgeTrajectoryTrainer implements TrajectoryTrainer {

    private static final int[] NON_NEGATIVE = {
        RidgeTrajectoryModel.STATISTICAL,
        RidgeTrajectoryModel.NARRATIVE
    };

    @Override
    public TrajectoryModel fit(List<TrainingExample> examples, PredictionSettings settings) {
        List<TrainingExample> usable = examples == null ? List.of()
            : examples.stream().filter(e -> e != null && e.features() != null && !e.observed().isEmpty()).toList();
        if (usable.size() < settings.minSamples()) {
            throw new IllegalArgumentException("Need at least " + settings.minSamples()
                + " training examples but got " + usable.size());
        }

        int horizon = settings.horizon();
        double[][] coefficients = new double[horizon][RidgeTrajectoryModel.FEATURE_COUNT];
        double[] residualSd = new double[horizon];

        for (int k = 0; k < horizon; k++) {
            List<double[]> rows = new ArrayList<>();
            List<Double> targets = new ArrayList<>();
            for (TrainingExample example : usable) {
                if (example.observed().size() <= k || example.observed().get(k) == null) continue;
                rows.add(RidgeTrajectoryModel.featureVector(example.features()));
                targets.add(example.observed().get(k) - example.features().baseline());
            }
            if (rows.isEmpty()) continue;

            boolean[] active = new boolean[RidgeTrajectoryModel.FEATURE_COUNT];
            Arrays.fill(active, true);
            double[] beta = solveRidge(rows, targets, active, settings.ridgeLambda());
            int violating = mostNegativeConstrained(beta, active);
            while (violating >= 0) {
                active[violating] = false;
                beta = solveRidge(rows, targets, active, settings.ridgeLambda());
                violating = mostNegativeConstrained(beta, active);
            }
            coefficients[k] = beta;
            residualSd[k] = residualStandardDeviation(rows, targets, beta);
        }
        return new RidgeTrajectoryModel(coefficients, residualSd, usable.size());
    }

    private static int mostNegativeConstrained(double[] beta, boolean[] active) {
        int worst = -1;
        for (int index : NON_NEGATIVE) {
            if (active[index] && beta[index] < 0.0 && (worst < 0 || beta[index] < beta[worst])) {
                worst = index;
            }
        }
        return worst;
    }

    static double[] solveRidge(List<double[]> rows, List<Double> targets, boolean[] active, double lambda) {
        int p = active.length;
        int[] map = new int[p];
        int m = 0;
        for (int j = 0; j < p; j++) {
            map[j] = active[j] ? m++ : -1;
        }
        double[][] a = new double[m][m];
        double[] b = new double[m];
        for (int i = 0; i < rows.size(); i++) {
            double[] x = rows.get(i);
            double y = targets.get(i);
            for (int r = 0; r < p; r++) {
                if (map[r] < 0) continue;
                b[map[r]] += x[r] * y;
                for (int c = 0; c < p; c++) {
                    if (map[c] < 0) continue;
                    a[map[r]][map[c]] += x[r] * x[c];
                }
            }
        }
        for (int j = 0; j < p; j++) {
            if (map[j] >= 0 && j != RidgeTrajectoryModel.INTERCEPT) {
                a[map[j]][map[j]] += lambda;
            }
        }
        double[] solved = gaussianSolve(a, b);
        double[] beta = new double[p];
        for (int j = 0; j < p; j++) {
            beta[j] = map[j] < 0 ? 0.0 : solved[map[j]];
        }
        return beta;
    }

    /** Solves {@code a·x = b} in place; a near-zero pivot yields a zero coefficient for that column. */
    static double[] gaussianSolve(double[][] a, double[] b) {
        int n = b.length;
        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) pivot = row;
            }
            double[] tmpRow = a[col]; a[col] = a[pivot]; a[pivot] = tmpRow;
            double tmp = b[col]; b[col] = b[pivot]; b[pivot] = tmp;
            if (Math.abs(a[col][col]) < 1e-12) continue;
            for (int row = col + 1; row < n; row++) {
                double factor = a[row][col] / a[col][col];
                if (factor == 0.0) continue;
                for (int c = col; c < n; c++) {
                    a[row][c] -= factor * a[col][c];
                }
                b[row] -= factor * b[col];
            }
        }
        double[] x = new double[n];
        for (int row = n - 1; row >= 0; row--) {
            if (Math.abs(a[row][row]) < 1e-12) {
                x[row] = 0.0;
                continue;
            }
            double sum = b[row];
            for (int c = row + 1; c < n; c++) {
                sum -= a[row][c] * x[c];
            }
            x[row] = sum / a[row][row];
        }
        return x;
    }

    private static double residualStandardDeviation(List<double[]> rows, List<Double> targets, double[] beta) {
        double ssr = 0.0;
        for (int i = 0; i < rows.size(); i++) {
            double fitted = 0.0;
            double[] x = rows.get(i);
            for (int j = 0; j < beta.length; j++) {
                fitted += beta[j] * x[j];
            }
            double residual = targets.get(i) - fitted;
            ssr += residual * residual;
        }
        return Math.sqrt(ssr / Math.max(1, rows.size() - 1));
    }
}
