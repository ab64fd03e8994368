package org.cardiocore.features;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.cardiocore.utils.SignalMath;

/**
 * Locates QRS onset/offset, P onset and T end around known R-peaks.
 *
 * QRS boundaries are where the slope stays below a fraction of the beat's peak
 * slope for a short quiet run. The isoelectric level is the median of the PR
 * segment just before QRS onset. P and T are the largest excursions from that
 * level inside their search windows; their outer edges are where the excursion
 * falls below a fraction of the wave amplitude.
 */
public class WaveDelineator {

    private static final double QRS_SEARCH_SECONDS = 0.150;
    private static final double SLOPE_WINDOW_SECONDS = 0.080;
    private static final double SLOPE_FRACTION = 0.15;
    private static final double QUIET_SECONDS = 0.012;
    private static final double ISO_FROM_SECONDS = 0.030;
    private static final double ISO_TO_SECONDS = 0.010;
    private static final double P_SEARCH_SECONDS = 0.300;
    private static final double P_GAP_SECONDS = 0.030;
    private static final double T_GAP_SECONDS = 0.060;
    private static final double T_SEARCH_SECONDS = 0.500;
    private static final double EDGE_FRACTION = 0.2;
    private static final double MIN_WAVE_FRACTION = 0.03;

    public List<BeatFiducials> delineate(double[] x, double fs, int[] rPeaks) {
        double[] slope = slope(x);
        List<BeatFiducials> beats = new ArrayList<>();
        for (int b = 0; b < rPeaks.length; b++) {
            int r = rPeaks[b];
            int previousR = b > 0 ? rPeaks[b - 1] : BeatFiducials.ABSENT;
            int nextR = b + 1 < rPeaks.length ? rPeaks[b + 1] : BeatFiducials.ABSENT;
            beats.add(delineateBeat(x, slope, fs, r, previousR, nextR));
        }
        return beats;
    }

    private BeatFiducials delineateBeat(double[] x, double[] slope, double fs, int r, int previousR, int nextR) {
        int n = x.length;
        int slopeWindow = seconds(SLOPE_WINDOW_SECONDS, fs);
        double peakSlope = 0.0;
        for (int i = Math.max(0, r - slopeWindow); i <= Math.min(n - 1, r + slopeWindow); i++) {
            peakSlope = Math.max(peakSlope, Math.abs(slope[i]));
        }
        double slopeThreshold = SLOPE_FRACTION * peakSlope;
        int quiet = Math.max(2, seconds(QUIET_SECONDS, fs));
        int search = seconds(QRS_SEARCH_SECONDS, fs);

        int onset = findQuietRun(slope, r, Math.max(0, r - search), -1, slopeThreshold, quiet);
        int offset = findQuietRun(slope, r, Math.min(n - 1, r + search), 1, slopeThreshold, quiet);
        if (onset == BeatFiducials.ABSENT || offset == BeatFiducials.ABSENT) {
            return new BeatFiducials(r, BeatFiducials.ABSENT, BeatFiducials.ABSENT,
                BeatFiducials.ABSENT, BeatFiducials.ABSENT, 0.0);
        }

        double iso = isoelectricLevel(x, fs, onset);
        double rAmplitude = Math.abs(x[r] - iso);
        double minWave = MIN_WAVE_FRACTION * rAmplitude;

        // P wave: before QRS onset, after the middle of the previous R-R interval
        int pFrom = onset - seconds(P_SEARCH_SECONDS, fs);
        if (previousR != BeatFiducials.ABSENT) {
            pFrom = Math.max(pFrom, previousR + (r - previousR) / 2);
        }
        pFrom = Math.max(0, pFrom);
        int pTo = onset - seconds(P_GAP_SECONDS, fs);
        int pOnset = BeatFiducials.ABSENT;
        int pPeak = largestExcursion(x, iso, pFrom, pTo);
        if (pPeak != BeatFiducials.ABSENT && Math.abs(x[pPeak] - iso) >= minWave) {
            pOnset = waveEdge(x, iso, pPeak, pFrom, -1);
        }

        // T wave: after the J point, before the next beat's P region
        int tFrom = offset + seconds(T_GAP_SECONDS, fs);
        int tTo = Math.min(n - 1, offset + seconds(T_SEARCH_SECONDS, fs));
        if (nextR != BeatFiducials.ABSENT) {
            tTo = Math.min(tTo, nextR - (nextR - r) / 5);
        }
        int tEnd = BeatFiducials.ABSENT;
        int tPeak = largestExcursion(x, iso, tFrom, tTo);
        if (tPeak != BeatFiducials.ABSENT && Math.abs(x[tPeak] - iso) >= minWave) {
            tEnd = waveEdge(x, iso, tPeak, tTo, 1);
        }

        return new BeatFiducials(r, onset, offset, pOnset, tEnd, iso);
    }

    /**
     * Median of the PR segment ending just before the given QRS onset
     */
    public double isoelectricLevel(double[] x, double fs, int qrsOnset) {
        int from = Math.max(0, qrsOnset - seconds(ISO_FROM_SECONDS, fs));
        int to = Math.min(x.length, Math.max(from + 1, qrsOnset - seconds(ISO_TO_SECONDS, fs)));
        return SignalMath.median(Arrays.copyOfRange(x, from, to));
    }

    /**
     * Walk from start toward limit; return the first index that begins a run of
     * quiet samples with |slope| below threshold.
     */
    private static int findQuietRun(double[] slope, int start, int limit, int direction, double threshold, int quiet) {
        int run = 0;
        for (int i = start; direction < 0 ? i >= limit : i <= limit; i += direction) {
            if (Math.abs(slope[i]) < threshold) {
                run++;
                if (run >= quiet) {
                    return i - direction * (quiet - 1);
                }
            } else {
                run = 0;
            }
        }
        return BeatFiducials.ABSENT;
    }

    private static int largestExcursion(double[] x, double iso, int from, int to) {
        if (from < 0 || to >= x.length || to - from < 2) {
            return BeatFiducials.ABSENT;
        }
        int best = from;
        for (int i = from; i <= to; i++) {
            if (Math.abs(x[i] - iso) > Math.abs(x[best] - iso)) {
                best = i;
            }
        }
        return best;
    }

    /**
     * Walk from the wave peak toward limit until the excursion drops below
     * EDGE_FRACTION of the peak; ABSENT when it never does inside the window.
     */
    private static int waveEdge(double[] x, double iso, int peak, int limit, int direction) {
        double edge = EDGE_FRACTION * Math.abs(x[peak] - iso);
        for (int i = peak; direction < 0 ? i >= limit : i <= limit; i += direction) {
            if (Math.abs(x[i] - iso) <= edge) {
                return i;
            }
        }
        return BeatFiducials.ABSENT;
    }

    private static double[] slope(double[] x) {
        double[] d = new double[x.length];
        for (int i = 1; i < x.length - 1; i++) {
            d[i] = (x[i + 1] - x[i - 1]) / 2.0;
        }
        return d;
    }

    private static int seconds(double seconds, double fs) {
        return (int) Math.round(seconds * fs);
    }
}
