package org.cardiocore.signal.filter;

/**
 * Stateless filtering primitives used by preprocessing, quality scoring and
 * R-peak detection.
 */
public final class DigitalFilters {

    private DigitalFilters() {
    }

    /**
     * Centered moving average. Windows shrink at the edges instead of padding.
     */
    public static double[] movingAverageCentered(double[] x, int window) {
        int n = x.length;
        double[] out = new double[n];
        if (n == 0) {
            return out;
        }
        int half = Math.max(0, window / 2);
        double[] prefix = new double[n + 1];
        for (int i = 0; i < n; i++) {
            prefix[i + 1] = prefix[i] + x[i];
        }
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - half);
            int to = Math.min(n - 1, i + half);
            out[i] = (prefix[to + 1] - prefix[from]) / (to - from + 1);
        }
        return out;
    }

    /**
     * Subtract a moving-average baseline estimate of the given width
     */
    public static double[] removeBaseline(double[] x, double sampleRate, double windowSeconds) {
        int window = (int) Math.max(1, Math.round(windowSeconds * sampleRate));
        double[] baseline = movingAverageCentered(x, window);
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = x[i] - baseline[i];
        }
        return out;
    }

    /**
     * Zero-phase filtering: the section runs forward then backward over an
     * odd (point-reflected) extension of padLength samples at each end.
     */
    public static double[] filtfilt(Biquad filter, double[] x, int padLength) {
        int n = x.length;
        if (n == 0) {
            return new double[0];
        }
        int pad = Math.max(0, Math.min(padLength, n - 1));
        double[] extended = new double[n + 2 * pad];
        for (int i = 0; i < pad; i++) {
            extended[i] = 2 * x[0] - x[pad - i];
            extended[n + pad + i] = 2 * x[n - 1] - x[n - 2 - i];
        }
        System.arraycopy(x, 0, extended, pad, n);

        double[] forward = filter.apply(extended);
        double[] backward = filter.apply(reverse(forward));
        double[] result = reverse(backward);

        double[] out = new double[n];
        System.arraycopy(result, pad, out, 0, n);
        return out;
    }

    public static double[] reverse(double[] x) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = x[x.length - 1 - i];
        }
        return out;
    }
}
