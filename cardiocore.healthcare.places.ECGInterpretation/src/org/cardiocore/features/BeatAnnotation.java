package org.cardiocore.features;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.cardiocore.base.PipelineArtifact;

/**
 * One detected beat, in the form the reporting layer stores as an annotation
 */
public final class BeatAnnotation implements PipelineArtifact {

    public static final String LABEL = "R_peak";
    public static final String SOURCE = "algorithm";
    public static final double DETECTION_CONFIDENCE = 0.95;

    public final int sampleIndex;
    public final double timeMillis;
    public final double amplitude;

    public BeatAnnotation(int sampleIndex, double timeMillis, double amplitude) {
        this.sampleIndex = sampleIndex;
        this.timeMillis = timeMillis;
        this.amplitude = amplitude;
    }

    public static List<BeatAnnotation> fromPeaks(int[] peaks, double[] lead, double sampleRate) {
        List<BeatAnnotation> annotations = new ArrayList<>();
        for (int peak : peaks) {
            annotations.add(new BeatAnnotation(peak, peak * 1000.0 / sampleRate, lead[peak]));
        }
        return annotations;
    }

    @Override
    public Map<String, Object> toJsonFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("label", LABEL);
        fields.put("sample_index", sampleIndex);
        fields.put("time_ms", timeMillis);
        fields.put("amplitude", amplitude);
        fields.put("confidence", DETECTION_CONFIDENCE);
        fields.put("source", SOURCE);
        return fields;
    }

    @Override
    public String getSummary() {
        return String.format("%s at %.1f ms", LABEL, timeMillis);
    }

    @Override
    public String toString() {
        return String.format("BeatAnnotation{index=%d, time=%.1fms, amplitude=%.3f}", sampleIndex, timeMillis, amplitude);
    }
}
