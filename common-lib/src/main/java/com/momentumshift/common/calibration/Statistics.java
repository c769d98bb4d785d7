package com.momentumshift.common.calibration;

/**
 * Small descriptive-statistics helpers shared by the evaluator and the refitter.
 * Variances are population variances; a variance below {@link #EPSILON} counts as zero.
 */
public final class Statistics {

    static final double EPSILON = 1e-12;

    private Statistics() {}

    public static double mean(double[] values) {
        if (values.length == 0) return Double.NaN;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    public static double variance(double[] values) {
        if (values.length == 0) return Double.NaN;
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return sum / values.length;
    }

    public static boolean degenerate(double[] values) {
        return values.length < 2 || variance(values) < EPSILON;
    }

    /**
     * Pearson correlation coefficient.
     *
     * @return r in [-1, 1], or {@code null} when either series has zero variance
     *         or the series hold fewer than two points
     */
    public static Double pearson(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("series lengths differ: " + x.length + " vs " + y.length);
        }
        if (degenerate(x) || degenerate(y)) return null;
        double mx = mean(x);
        double my = mean(y);
        double sxy = 0.0, sxx = 0.0, syy = 0.0;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - mx;
            double dy = y[i] - my;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        double r = sxy / Math.sqrt(sxx * syy);
        return Math.max(-1.0, Math.min(1.0, r));
    }
}
