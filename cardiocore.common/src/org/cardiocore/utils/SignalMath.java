package org.cardiocore.utils;

import java.util.Arrays;

/**
 * Descriptive statistics over sample arrays. Empty input yields 0 for every
 * statistic so callers can apply their own defaults.
 */
public final class SignalMath {

    private SignalMath() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population variance
     */
    public static double variance(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return sum / values.length;
    }

    public static double std(double[] values) {
        return Math.sqrt(variance(values));
    }

    public static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2.0 : sorted[mid];
    }

    public static double maxAbs(double[] values) {
        double max = 0.0;
        for (double v : values) {
            max = Math.max(max, Math.abs(v));
        }
        return max;
    }

    public static double min(double[] values) {
        return values.length == 0 ? 0.0 : Arrays.stream(values).min().getAsDouble();
    }

    public static double max(double[] values) {
        return values.length == 0 ? 0.0 : Arrays.stream(values).max().getAsDouble();
    }

    public static boolean allFinite(double[] values) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Successive differences, length n-1
     */
    public static double[] diff(double[] values) {
        if (values.length < 2) {
            return new double[0];
        }
        double[] out = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            out[i - 1] = values[i] - values[i - 1];
        }
        return out;
    }

    public static double clip(double value, double low, double high) {
        return Math.max(low, Math.min(high, value));
    }
}
