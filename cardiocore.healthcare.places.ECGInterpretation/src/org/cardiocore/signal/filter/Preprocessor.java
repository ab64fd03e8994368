package org.cardiocore.signal.filter;

import java.util.List;

import org.apache.log4j.Logger;
import org.cardiocore.base.BasePipelineStage;
import org.cardiocore.config.PipelineSettings;
import org.cardiocore.signal.EcgSignal;
import org.cardiocore.signal.WaveformMatrix;
import org.cardiocore.utils.SignalMath;

/**
 * Preprocessor
 *
 * Per-lead cleaning that never changes the waveform shape:
 * 1. moving-average baseline removal
 * 2. powerline notch at each configured mains frequency below Nyquist
 * 3. Butterworth high-pass and low-pass sections
 * 4. optional amplitude normalization
 *
 * IIR sections run forward and backward so waves keep their timing.
 * A lead whose filtered output is not finite keeps its original samples.
 */
public class Preprocessor extends BasePipelineStage<EcgSignal, EcgSignal> {

    private static final Logger logger = Logger.getLogger(Preprocessor.class);

    public static final String STAGE_NAME = "PREPROCESSOR";

    /** Highest usable cutoff as a fraction of the sample rate */
    private static final double MAX_CUTOFF_FRACTION = 0.45;

    private final double baselineWindowSeconds;
    private final double highpassCutoffHz;
    private final double lowpassCutoffHz;
    private final double[] powerlineFrequenciesHz;
    private final double notchQuality;
    private final boolean normalizeLeads;

    public Preprocessor(PipelineSettings settings) {
        super(STAGE_NAME);
        this.baselineWindowSeconds = settings.getPositiveDouble("baselineWindowSeconds");
        this.highpassCutoffHz = settings.getPositiveDouble("highpassCutoffHz");
        this.lowpassCutoffHz = settings.getPositiveDouble("lowpassCutoffHz");
        this.powerlineFrequenciesHz = settings.getDoubleList("powerlineFrequenciesHz");
        this.notchQuality = settings.getPositiveDouble("notchQuality");
        this.normalizeLeads = settings.getBoolean("normalizeLeads");
    }

    @Override
    protected EcgSignal processStageSpecific(String analysisId, EcgSignal signal, List<String> warnings) {
        double fs = signal.getSampleRate();
        WaveformMatrix raw = signal.waveform;
        int padLength = (int) Math.round(fs);

        boolean applyHighpass = highpassCutoffHz < MAX_CUTOFF_FRACTION * fs;
        boolean applyLowpass = lowpassCutoffHz < MAX_CUTOFF_FRACTION * fs;
        if (!applyLowpass) {
            warnings.add(String.format("Low-pass cutoff %.1f Hz not usable at %.1f Hz sampling, skipped",
                lowpassCutoffHz, fs));
        }
        if (!applyHighpass) {
            warnings.add(String.format("High-pass cutoff %.1f Hz not usable at %.1f Hz sampling, skipped",
                highpassCutoffHz, fs));
        }

        double[][] cleaned = new double[raw.getLeadCount()][];
        for (int lead = 0; lead < raw.getLeadCount(); lead++) {
            double[] original = raw.getLead(lead);
            double[] x = DigitalFilters.removeBaseline(original, fs, baselineWindowSeconds);

            for (double mains : powerlineFrequenciesHz) {
                if (mains < 0.5 * fs) {
                    x = DigitalFilters.filtfilt(Biquad.notch(fs, mains, notchQuality), x, padLength);
                }
            }
            if (applyHighpass) {
                x = DigitalFilters.filtfilt(Biquad.highpass(fs, highpassCutoffHz), x, padLength);
            }
            if (applyLowpass) {
                x = DigitalFilters.filtfilt(Biquad.lowpass(fs, lowpassCutoffHz), x, padLength);
            }
            if (normalizeLeads) {
                x = normalize(x);
            }

            if (SignalMath.allFinite(x)) {
                cleaned[lead] = x;
            } else {
                String leadName = signal.getLeadName(lead);
                logger.warn("Lead " + leadName + " produced non-finite samples after filtering");
                warnings.add("Lead " + leadName + ": filtering produced non-finite values, original samples kept");
                cleaned[lead] = original;
            }
        }
        return signal.withCleanedWaveform(new WaveformMatrix(cleaned));
    }

    /**
     * Unfiltered signal: the shape is already right, only the cleaning is missing.
     */
    @Override
    protected EcgSignal createFallback(String analysisId, EcgSignal signal) {
        return signal;
    }

    private static double[] normalize(double[] x) {
        double std = SignalMath.std(x);
        if (std == 0) {
            return x;
        }
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = x[i] / (2 * std);
        }
        return out;
    }
}
