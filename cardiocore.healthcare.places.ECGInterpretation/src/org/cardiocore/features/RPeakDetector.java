package org.cardiocore.features;

import java.util.ArrayList;
import java.util.List;

import org.cardiocore.signal.filter.DigitalFilters;

/**
 * R-peak detection in the Pan-Tompkins manner, on an already baseline-corrected lead:
 * light smoothing, squared first difference, ~110 ms moving integration,
 * adaptive threshold, refractory period, then peak refinement on the smoothed lead.
 * A relaxed second pass runs when the first finds nothing.
 */
public class RPeakDetector {

    private static final int SMOOTHING_SAMPLES = 5;
    private static final double INTEGRATION_SECONDS = 0.110;
    private static final double REFRACTORY_SECONDS = 0.200;
    private static final double REFINE_SECONDS = 0.050;
    private static final double MIN_RECORDING_SECONDS = 0.5;

    /**
     * Sample indices of R-peaks in ascending order; empty when none can be found.
     */
    public int[] detect(double[] x, double fs) {
        int n = x.length;
        if (n < Math.max(50, MIN_RECORDING_SECONDS * fs)) {
            return new int[0];
        }

        double[] smoothed = DigitalFilters.movingAverageCentered(x, SMOOTHING_SAMPLES);

        double[] slopeEnergy = new double[n];
        for (int i = 1; i < n; i++) {
            double d = smoothed[i] - smoothed[i - 1];
            slopeEnergy[i] = d * d;
        }
        int integrationWindow = (int) Math.max(1, Math.round(INTEGRATION_SECONDS * fs));
        double[] integrated = DigitalFilters.movingAverageCentered(slopeEnergy, integrationWindow);

        double max = 0.0;
        double sum = 0.0;
        for (double v : integrated) {
            sum += v;
            max = Math.max(max, v);
        }
        if (max <= 1e-12) {
            return new int[0];
        }
        double mean = sum / n;
        double var = 0.0;
        for (double v : integrated) {
            var += (v - mean) * (v - mean);
        }
        double std = Math.sqrt(var / Math.max(1, n - 1));

        // mean + 3 std, kept between 25% and 50% of the maximum so fast rhythms
        // (where QRS energy dominates the statistics) still cross it
        double threshold = Math.min(Math.max(mean + 3.0 * std, 0.25 * max), 0.5 * max);

        int refractory = (int) Math.max(1, Math.round(REFRACTORY_SECONDS * fs));
        int refine = (int) Math.max(1, Math.round(REFINE_SECONDS * fs));

        List<Integer> peaks = findPeaks(integrated, smoothed, threshold, refractory, refine);
        if (peaks.isEmpty()) {
            peaks = findPeaks(integrated, smoothed, 0.15 * max, refractory, refine);
        }

        int[] result = new int[peaks.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = peaks.get(i);
        }
        return result;
    }

    private static List<Integer> findPeaks(double[] integrated, double[] smoothed, double threshold,
            int refractory, int refine) {
        int n = integrated.length;
        List<Integer> peaks = new ArrayList<>();
        int i = 1;
        while (i < n - 1) {
            if (integrated[i] > threshold && integrated[i] >= integrated[i - 1] && integrated[i] >= integrated[i + 1]) {
                int best = refineToCrest(smoothed, i, refine);
                if (peaks.isEmpty()) {
                    peaks.add(best);
                } else {
                    int last = peaks.get(peaks.size() - 1);
                    if (best - last > refractory) {
                        peaks.add(best);
                    } else if (smoothed[best] > smoothed[last]) {
                        // two candidates inside one refractory period: keep the taller crest
                        peaks.set(peaks.size() - 1, best);
                    }
                }
                i += refractory;
            } else {
                i++;
            }
        }
        return peaks;
    }

    private static int refineToCrest(double[] smoothed, int center, int window) {
        int from = Math.max(0, center - window);
        int to = Math.min(smoothed.length - 1, center + window);
        int best = center;
        for (int k = from; k <= to; k++) {
            if (smoothed[k] > smoothed[best]) {
                best = k;
            }
        }
        return best;
    }
}
