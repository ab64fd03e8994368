package org.cardiocore.features;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.cardiocore.base.PipelineArtifact;

/**
 * Named numeric ECG features. Every name in {@link #DEFAULTS} is always present:
 * a measurement that could not be made carries its documented default and is
 * listed in {@link #getDefaultedFeatures()}. Flags are encoded as 0.0 / 1.0.
 */
public final class FeatureSet implements PipelineArtifact {

    public static final String HEART_RATE = "heart_rate";
    public static final String RR_MEAN = "rr_mean";
    public static final String RR_STD = "rr_std";
    public static final String RR_CV = "rr_cv";
    public static final String RR_MIN = "rr_min";
    public static final String RR_MAX = "rr_max";
    public static final String PR_INTERVAL = "pr_interval";
    public static final String QRS_DURATION = "qrs_duration";
    public static final String QT_INTERVAL = "qt_interval";
    public static final String QTC = "qtc";
    public static final String IRREGULAR_RHYTHM = "irregular_rhythm";
    public static final String ST_ELEVATION = "st_elevation";
    public static final String ST_DEVIATION_MAX = "st_deviation_max";
    public static final String HRV_RMSSD = "hrv_rmssd";
    public static final String HRV_SDNN = "hrv_sdnn";
    public static final String HRV_PNN50 = "hrv_pnn50";
    public static final String SPECTRAL_ENTROPY = "spectral_entropy";
    public static final String DOMINANT_FREQUENCY = "dominant_frequency";
    public static final String BEAT_COUNT = "beat_count";
    public static final String R_PEAK_AMPLITUDE_MEAN = "r_peak_amplitude_mean";
    public static final String SIGNAL_AMPLITUDE_RANGE = "signal_amplitude_range";
    public static final String SIGNAL_STD = "signal_std";

    public static final double DEFAULT_HEART_RATE = 70.0;
    public static final double DEFAULT_RR_STD = 50.0;
    public static final double DEFAULT_PR_INTERVAL = 160.0;
    public static final double DEFAULT_QRS_DURATION = 100.0;
    public static final double DEFAULT_QT_INTERVAL = 400.0;

    /** Documented fallback values, in reporting order */
    public static final Map<String, Double> DEFAULTS;

    static {
        Map<String, Double> defaults = new LinkedHashMap<>();
        double rrMean = 60000.0 / DEFAULT_HEART_RATE;
        defaults.put(HEART_RATE, DEFAULT_HEART_RATE);
        defaults.put(RR_MEAN, rrMean);
        defaults.put(RR_STD, DEFAULT_RR_STD);
        defaults.put(RR_CV, DEFAULT_RR_STD / rrMean);
        defaults.put(RR_MIN, rrMean);
        defaults.put(RR_MAX, rrMean);
        defaults.put(PR_INTERVAL, DEFAULT_PR_INTERVAL);
        defaults.put(QRS_DURATION, DEFAULT_QRS_DURATION);
        defaults.put(QT_INTERVAL, DEFAULT_QT_INTERVAL);
        defaults.put(QTC, bazett(DEFAULT_QT_INTERVAL, rrMean));
        defaults.put(IRREGULAR_RHYTHM, 0.0);
        defaults.put(ST_ELEVATION, 0.0);
        defaults.put(ST_DEVIATION_MAX, 0.0);
        defaults.put(HRV_RMSSD, 0.0);
        defaults.put(HRV_SDNN, 0.0);
        defaults.put(HRV_PNN50, 0.0);
        defaults.put(SPECTRAL_ENTROPY, 0.0);
        defaults.put(DOMINANT_FREQUENCY, 0.0);
        defaults.put(BEAT_COUNT, 0.0);
        defaults.put(R_PEAK_AMPLITUDE_MEAN, 0.0);
        defaults.put(SIGNAL_AMPLITUDE_RANGE, 0.0);
        defaults.put(SIGNAL_STD, 0.0);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, Double> values;
    private final Set<String> defaultedFeatures;
    private final int[] rPeakIndices;
    private final String analysisLead;

    private FeatureSet(Map<String, Double> values, Set<String> defaultedFeatures, int[] rPeakIndices,
            String analysisLead) {
        this.values = Collections.unmodifiableMap(values);
        this.defaultedFeatures = Collections.unmodifiableSet(defaultedFeatures);
        this.rPeakIndices = rPeakIndices.clone();
        this.analysisLead = analysisLead;
    }

    /**
     * Feature set where every measurement is its default
     */
    public static FeatureSet defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Bazett correction, intervals in milliseconds
     */
    public static double bazett(double qtMillis, double rrMillis) {
        return qtMillis / Math.sqrt(rrMillis / 1000.0);
    }

    // ===== ACCESSORS =====

    public double get(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown feature: " + name);
        }
        return value;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public boolean isFlagSet(String name) {
        return has(name) && get(name) >= 0.5;
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public Set<String> getDefaultedFeatures() {
        return defaultedFeatures;
    }

    public boolean isDefaulted(String name) {
        return defaultedFeatures.contains(name);
    }

    public int[] getRPeakIndices() {
        return rPeakIndices.clone();
    }

    public String getAnalysisLead() {
        return analysisLead;
    }

    @Override
    public Map<String, Object> toJsonFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("values", values);
        fields.put("defaulted", new ArrayList<>(defaultedFeatures));
        fields.put("analysis_lead", analysisLead);
        List<Integer> peaks = new ArrayList<>();
        for (int peak : rPeakIndices) {
            peaks.add(peak);
        }
        fields.put("r_peaks", peaks);
        return fields;
    }

    @Override
    public String getSummary() {
        return String.format("hr=%.1f, rr_std=%.1f, pr=%.0f, qrs=%.0f, qt=%.0f, qtc=%.0f, irregular=%s, st=%s",
            get(HEART_RATE), get(RR_STD), get(PR_INTERVAL), get(QRS_DURATION), get(QT_INTERVAL), get(QTC),
            isFlagSet(IRREGULAR_RHYTHM), isFlagSet(ST_ELEVATION));
    }

    @Override
    public String toString() {
        return "FeatureSet{" + getSummary() + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FeatureSet that = (FeatureSet) o;
        return values.equals(that.values) && Arrays.equals(rPeakIndices, that.rPeakIndices);
    }

    @Override
    public int hashCode() {
        return values.hashCode() * 31 + Arrays.hashCode(rPeakIndices);
    }

    /**
     * Collects measured values; {@link #build()} fills the gaps.
     *
     * Derived gaps are filled from what was measured before falling back to
     * constants: rr_mean from heart_rate (and the reverse), rr_cv from rr_std and
     * rr_mean, qtc from qt_interval and rr_mean.
     */
    public static class Builder {
        private final Map<String, Double> measured = new LinkedHashMap<>();
        private int[] rPeakIndices = new int[0];
        private String analysisLead;

        public Builder put(String name, double value) {
            if (Double.isFinite(value)) {
                measured.put(name, value);
            }
            return this;
        }

        public Builder flag(String name, boolean set) {
            measured.put(name, set ? 1.0 : 0.0);
            return this;
        }

        public Builder rPeakIndices(int[] indices) {
            this.rPeakIndices = indices.clone();
            return this;
        }

        public Builder analysisLead(String lead) {
            this.analysisLead = lead;
            return this;
        }

        public FeatureSet build() {
            Map<String, Double> values = new LinkedHashMap<>();
            Set<String> defaulted = new LinkedHashSet<>();

            Double heartRate = measured.get(HEART_RATE);
            Double rrMean = measured.get(RR_MEAN);
            if (rrMean == null && heartRate != null && heartRate > 0) {
                rrMean = 60000.0 / heartRate;
            }
            if (heartRate == null && rrMean != null && rrMean > 0) {
                heartRate = 60000.0 / rrMean;
            }
            derive(HEART_RATE, heartRate);
            derive(RR_MEAN, rrMean);

            Double rrStd = measured.get(RR_STD);
            if (!measured.containsKey(RR_CV) && rrStd != null && rrMean != null && rrMean > 0) {
                measured.put(RR_CV, rrStd / rrMean);
            }
            Double qt = measured.get(QT_INTERVAL);
            if (!measured.containsKey(QTC) && qt != null && rrMean != null && rrMean > 0) {
                measured.put(QTC, bazett(qt, rrMean));
            }

            for (Map.Entry<String, Double> entry : DEFAULTS.entrySet()) {
                String name = entry.getKey();
                Double value = measured.get(name);
                if (value == null) {
                    values.put(name, entry.getValue());
                    defaulted.add(name);
                } else {
                    values.put(name, value);
                }
            }
            if (defaulted.contains(QTC)) {
                values.put(QTC, bazett(values.get(QT_INTERVAL), values.get(RR_MEAN)));
            }
            // extra measurements keep their insertion order after the standard ones
            for (Map.Entry<String, Double> entry : measured.entrySet()) {
                values.putIfAbsent(entry.getKey(), entry.getValue());
            }
            return new FeatureSet(values, defaulted, rPeakIndices, analysisLead);
        }

        private void derive(String name, Double value) {
            if (value != null && !measured.containsKey(name)) {
                measured.put(name, value);
            }
        }
    }
}
