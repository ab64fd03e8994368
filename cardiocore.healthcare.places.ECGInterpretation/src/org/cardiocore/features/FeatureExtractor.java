package org.cardiocore.features;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;
import org.cardiocore.base.BasePipelineStage;
import org.cardiocore.config.PipelineSettings;
import org.cardiocore.quality.AssessedSignal;
import org.cardiocore.quality.QualityReport;
import org.cardiocore.signal.EcgSignal;
import org.cardiocore.signal.WaveformMatrix;
import org.cardiocore.signal.spectral.PowerSpectrum;
import org.cardiocore.signal.spectral.SpectralAnalysis;
import org.cardiocore.utils.SignalMath;

/**
 * Feature Extractor
 *
 * Rhythm, interval and spectral features from the cleaned waveform:
 * - rhythm and HRV from R-peaks on the best-quality lead (lead II wins ties)
 * - PR, QRS and QT as medians over delineated beats, each checked against a
 *   physiologic window; qtc by Bazett
 * - ST deviation at J + offset in every lead, using the analysis lead's fiducials
 * - Welch spectrum of the analysis lead for dominant frequency and entropy
 *
 * Anything that cannot be measured keeps its {@link FeatureSet#DEFAULTS} value
 * and is reported as a warning.
 */
public class FeatureExtractor extends BasePipelineStage<AssessedSignal, FeatureSet> {

    private static final Logger logger = Logger.getLogger(FeatureExtractor.class);

    public static final String STAGE_NAME = "FEATURES";
    public static final String PREFERRED_LEAD = "II";

    // physiologic plausibility windows, milliseconds / bpm
    private static final double MIN_HEART_RATE = 20.0;
    private static final double MAX_HEART_RATE = 300.0;
    private static final double MIN_PR = 80.0, MAX_PR = 400.0;
    private static final double MIN_QRS = 40.0, MAX_QRS = 200.0;
    private static final double MIN_QT = 200.0, MAX_QT = 700.0;

    private final double irregularRhythmCv;
    private final double stElevationThreshold;
    private final int stElevationMinLeads;
    private final double stMeasurementOffsetSeconds;
    private final int welchSegmentLength;

    private final RPeakDetector peakDetector = new RPeakDetector();
    private final WaveDelineator delineator = new WaveDelineator();

    public FeatureExtractor(PipelineSettings settings) {
        super(STAGE_NAME);
        this.irregularRhythmCv = settings.getPositiveDouble("irregularRhythmCv");
        this.stElevationThreshold = settings.getPositiveDouble("stElevationThreshold");
        this.stElevationMinLeads = settings.getPositiveInt("stElevationMinLeads");
        this.stMeasurementOffsetSeconds = settings.getPositiveDouble("stMeasurementOffsetSeconds");
        this.welchSegmentLength = settings.getPositiveInt("welchSegmentLength");
    }

    @Override
    protected FeatureSet processStageSpecific(String analysisId, AssessedSignal input, List<String> warnings) {
        EcgSignal signal = input.signal;
        double fs = signal.getSampleRate();
        int leadIndex = selectAnalysisLead(signal, input.quality);
        String leadName = signal.getLeadName(leadIndex);
        double[] x = signal.waveform.getLead(leadIndex);

        FeatureSet.Builder features = FeatureSet.builder().analysisLead(leadName);
        logger.debug("Extracting features from lead " + leadName);

        features.put(FeatureSet.SIGNAL_STD, SignalMath.std(x));
        features.put(FeatureSet.SIGNAL_AMPLITUDE_RANGE, SignalMath.max(x) - SignalMath.min(x));

        PowerSpectrum spectrum = SpectralAnalysis.welch(x, fs, welchSegmentLength);
        features.put(FeatureSet.DOMINANT_FREQUENCY, spectrum.dominantFrequency(0.5, Math.min(40.0, fs / 2)));
        features.put(FeatureSet.SPECTRAL_ENTROPY, spectrum.normalizedEntropy());

        int[] peaks = peakDetector.detect(x, fs);
        features.rPeakIndices(peaks);
        features.put(FeatureSet.BEAT_COUNT, peaks.length);
        if (!extractRhythm(x, fs, peaks, features)) {
            warnings.add("R-peaks indeterminate on lead " + leadName + ", rhythm features set to defaults");
            return features.build();
        }

        List<BeatFiducials> beats = delineator.delineate(x, fs, peaks);
        List<String> unmeasured = extractIntervals(beats, fs, features);
        if (!unmeasured.isEmpty()) {
            warnings.add("Intervals not measurable on lead " + leadName + ", defaults used for " + unmeasured);
        }

        if (!extractStDeviation(signal.waveform, fs, beats, features)) {
            warnings.add("ST segment not measurable, st_elevation set to default");
        }

        FeatureSet result = features.build();
        logger.info("Features extracted: " + result.getSummary());
        return result;
    }

    @Override
    protected FeatureSet createFallback(String analysisId, AssessedSignal input) {
        return FeatureSet.defaults();
    }

    // ===== LEAD SELECTION =====

    int selectAnalysisLead(EcgSignal signal, QualityReport quality) {
        int best = 0;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int lead = 0; lead < signal.metadata.getLeadCount(); lead++) {
            String name = signal.getLeadName(lead);
            double score = quality.getLeadScore(name);
            boolean preferred = PREFERRED_LEAD.equals(name);
            if (score > bestScore || (score == bestScore && preferred)) {
                best = lead;
                bestScore = score;
            }
        }
        return best;
    }

    // ===== RHYTHM =====

    private boolean extractRhythm(double[] x, double fs, int[] peaks, FeatureSet.Builder features) {
        if (peaks.length < 2) {
            return false;
        }
        double[] rr = new double[peaks.length - 1];
        for (int i = 1; i < peaks.length; i++) {
            rr[i - 1] = (peaks[i] - peaks[i - 1]) * 1000.0 / fs;
        }
        double rrMean = SignalMath.mean(rr);
        double heartRate = 60000.0 / rrMean;
        if (heartRate < MIN_HEART_RATE || heartRate > MAX_HEART_RATE) {
            return false;
        }
        double rrStd = SignalMath.std(rr);
        double rrCv = rrStd / rrMean;

        features.put(FeatureSet.HEART_RATE, heartRate);
        features.put(FeatureSet.RR_MEAN, rrMean);
        features.put(FeatureSet.RR_STD, rrStd);
        features.put(FeatureSet.RR_CV, rrCv);
        features.put(FeatureSet.RR_MIN, SignalMath.min(rr));
        features.put(FeatureSet.RR_MAX, SignalMath.max(rr));
        features.flag(FeatureSet.IRREGULAR_RHYTHM, rrCv > irregularRhythmCv);
        features.put(FeatureSet.HRV_SDNN, rrStd);

        double[] successive = SignalMath.diff(rr);
        if (successive.length > 0) {
            double squares = 0.0;
            int over50 = 0;
            for (double d : successive) {
                squares += d * d;
                if (Math.abs(d) > 50.0) {
                    over50++;
                }
            }
            features.put(FeatureSet.HRV_RMSSD, Math.sqrt(squares / successive.length));
            features.put(FeatureSet.HRV_PNN50, 100.0 * over50 / rr.length);
        }

        double amplitude = 0.0;
        for (int peak : peaks) {
            amplitude += x[peak];
        }
        features.put(FeatureSet.R_PEAK_AMPLITUDE_MEAN, amplitude / peaks.length);
        return true;
    }

    // ===== INTERVALS =====

    private List<String> extractIntervals(List<BeatFiducials> beats, double fs, FeatureSet.Builder features) {
        List<Double> pr = new ArrayList<>();
        List<Double> qrs = new ArrayList<>();
        List<Double> qt = new ArrayList<>();
        for (BeatFiducials beat : beats) {
            if (beat.hasQrs()) {
                addIfPlausible(qrs, (beat.qrsOffset - beat.qrsOnset) * 1000.0 / fs, MIN_QRS, MAX_QRS);
            }
            if (beat.hasP()) {
                addIfPlausible(pr, (beat.qrsOnset - beat.pOnset) * 1000.0 / fs, MIN_PR, MAX_PR);
            }
            if (beat.hasT()) {
                addIfPlausible(qt, (beat.tEnd - beat.qrsOnset) * 1000.0 / fs, MIN_QT, MAX_QT);
            }
        }

        List<String> unmeasured = new ArrayList<>();
        putMedian(FeatureSet.PR_INTERVAL, pr, features, unmeasured);
        putMedian(FeatureSet.QRS_DURATION, qrs, features, unmeasured);
        putMedian(FeatureSet.QT_INTERVAL, qt, features, unmeasured);
        return unmeasured;
    }

    private static void addIfPlausible(List<Double> values, double value, double min, double max) {
        if (value >= min && value <= max) {
            values.add(value);
        }
    }

    private static void putMedian(String name, List<Double> values, FeatureSet.Builder features, List<String> unmeasured) {
        if (values.isEmpty()) {
            unmeasured.add(name);
            return;
        }
        features.put(name, SignalMath.median(values.stream().mapToDouble(Double::doubleValue).toArray()));
    }

    // ===== ST SEGMENT =====

    /**
     * Median ST deviation per lead at J + offset relative to the PR segment.
     * Elevation is flagged when enough leads exceed the threshold; a recording
     * with fewer leads than the configured minimum needs all of them.
     */
    private boolean extractStDeviation(WaveformMatrix waveform, double fs, List<BeatFiducials> beats,
            FeatureSet.Builder features) {
        int offset = (int) Math.round(stMeasurementOffsetSeconds * fs);
        int elevatedLeads = 0;
        double maxDeviation = Double.NEGATIVE_INFINITY;
        boolean measured = false;

        for (int lead = 0; lead < waveform.getLeadCount(); lead++) {
            double[] x = waveform.getLead(lead);
            List<Double> deviations = new ArrayList<>();
            for (BeatFiducials beat : beats) {
                int j = beat.qrsOffset + offset;
                if (beat.hasQrs() && j < x.length) {
                    deviations.add(x[j] - delineator.isoelectricLevel(x, fs, beat.qrsOnset));
                }
            }
            if (deviations.isEmpty()) {
                continue;
            }
            measured = true;
            double deviation = SignalMath.median(deviations.stream().mapToDouble(Double::doubleValue).toArray());
            maxDeviation = Math.max(maxDeviation, deviation);
            if (deviation > stElevationThreshold) {
                elevatedLeads++;
            }
        }
        if (!measured) {
            return false;
        }
        int required = Math.min(stElevationMinLeads, waveform.getLeadCount());
        features.flag(FeatureSet.ST_ELEVATION, elevatedLeads >= required);
        features.put(FeatureSet.ST_DEVIATION_MAX, maxDeviation);
        return true;
    }
}
