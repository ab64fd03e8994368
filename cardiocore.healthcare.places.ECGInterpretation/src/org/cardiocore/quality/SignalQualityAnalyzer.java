package org.cardiocore.quality;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;
import org.cardiocore.base.BasePipelineStage;
import org.cardiocore.config.PipelineSettings;
import org.cardiocore.exceptions.StageDegradationException;
import org.cardiocore.signal.EcgSignal;
import org.cardiocore.signal.WaveformMatrix;
import org.cardiocore.signal.filter.Biquad;
import org.cardiocore.signal.filter.DigitalFilters;
import org.cardiocore.signal.spectral.PowerSpectrum;
import org.cardiocore.signal.spectral.SpectralAnalysis;
import org.cardiocore.utils.SignalMath;

/**
 * Quality Analyzer
 *
 * Scores the cleaned waveform handed on by the preprocessor, the same matrix
 * the feature stage measures.
 *
 * Per lead:
 * - std below the flat-line threshold: score 0, FLAT_LINE, no further checks
 * - |x| above the saturation ceiling: SATURATION
 * - variance above the noise ceiling: HIGH_NOISE
 * - score = 1 - 0.3 (high variance) - 0.2 (near saturation) - 0.2 (near flat), clipped to [0,1]
 *
 * Aggregate, over leads that are not flat:
 * - noise level     Welch power above the noise cutoff / total
 * - baseline wander Welch power below the wander cutoff / total
 * - snr             10 log10(var(x) / var(high-pass residual))
 */
public class SignalQualityAnalyzer extends BasePipelineStage<EcgSignal, QualityReport> {

    private static final Logger logger = Logger.getLogger(SignalQualityAnalyzer.class);

    public static final String STAGE_NAME = "QUALITY";

    public static final String POOR_QUALITY_ISSUE = "Poor overall signal quality";
    public static final String HIGH_NOISE_ISSUE = "High noise level";
    public static final String BASELINE_WANDER_ISSUE = "Significant baseline wander";
    public static final String LOW_SNR_ISSUE = "Low signal-to-noise ratio";

    private static final double MAX_SNR_DB = 100.0;

    private final double flatLineStd;
    private final double saturationAmplitude;
    private final double nearSaturationAmplitude;
    private final double nearFlatAmplitude;
    private final double highVariance;
    private final double noiseVariance;
    private final double noiseCutoffHz;
    private final double wanderCutoffHz;
    private final double snrHighpassCutoffHz;
    private final int welchSegmentLength;
    private final double poorQualityScore;
    private final double highNoiseRatio;
    private final double wanderRatio;
    private final double lowSnrDb;

    public SignalQualityAnalyzer(PipelineSettings settings) {
        super(STAGE_NAME);
        this.flatLineStd = settings.getPositiveDouble("flatLineStd");
        this.saturationAmplitude = settings.getPositiveDouble("saturationAmplitude");
        this.nearSaturationAmplitude = settings.getPositiveDouble("nearSaturationAmplitude");
        this.nearFlatAmplitude = settings.getPositiveDouble("nearFlatAmplitude");
        this.highVariance = settings.getPositiveDouble("highVariance");
        this.noiseVariance = settings.getPositiveDouble("noiseVariance");
        this.noiseCutoffHz = settings.getPositiveDouble("noiseCutoffHz");
        this.wanderCutoffHz = settings.getPositiveDouble("wanderCutoffHz");
        this.snrHighpassCutoffHz = settings.getPositiveDouble("snrHighpassCutoffHz");
        this.welchSegmentLength = settings.getPositiveInt("welchSegmentLength");
        this.poorQualityScore = settings.getPositiveDouble("poorQualityScore");
        this.highNoiseRatio = settings.getPositiveDouble("highNoiseRatio");
        this.wanderRatio = settings.getPositiveDouble("wanderRatio");
        this.lowSnrDb = settings.getPositiveDouble("lowSnrDb");
    }

    @Override
    protected QualityReport processStageSpecific(String analysisId, EcgSignal signal, List<String> warnings)
            throws StageDegradationException {
        WaveformMatrix cleaned = signal.waveform;
        double fs = signal.getSampleRate();

        Map<String, Double> leadScores = new LinkedHashMap<>();
        Map<String, Set<ArtifactKind>> leadArtifacts = new LinkedHashMap<>();
        Set<ArtifactKind> artifacts = EnumSet.noneOf(ArtifactKind.class);
        List<String> issues = new ArrayList<>();

        double noiseSum = 0.0;
        double wanderSum = 0.0;
        double snrSum = 0.0;
        int measuredLeads = 0;

        for (int lead = 0; lead < cleaned.getLeadCount(); lead++) {
            String name = signal.getLeadName(lead);
            double[] x = cleaned.getLead(lead);
            Set<ArtifactKind> found = EnumSet.noneOf(ArtifactKind.class);
            double score = scoreLead(x, found);

            if (!Double.isFinite(score)) {
                throw new StageDegradationException(STAGE_NAME, analysisId, "Non-finite quality score for lead " + name);
            }
            leadScores.put(name, score);
            leadArtifacts.put(name, found);
            artifacts.addAll(found);
            for (ArtifactKind kind : found) {
                issues.add(name + ": " + kind.getIssue());
            }

            if (!found.contains(ArtifactKind.FLAT_LINE)) {
                PowerSpectrum spectrum = SpectralAnalysis.welch(x, fs, welchSegmentLength);
                // strictly above the noise cutoff, strictly below the wander cutoff
                noiseSum += spectrum.bandFraction(Math.nextUp(noiseCutoffHz), Double.POSITIVE_INFINITY);
                wanderSum += spectrum.bandFraction(0.0, wanderCutoffHz);
                snrSum += signalToNoise(x, fs);
                measuredLeads++;
            }
        }

        double overall = SignalMath.clip(SignalMath.mean(toArray(leadScores)), 0.0, 1.0);
        double noise = measuredLeads > 0 ? noiseSum / measuredLeads : 0.0;
        double wander = measuredLeads > 0 ? wanderSum / measuredLeads : 0.0;
        double snr = measuredLeads > 0 ? snrSum / measuredLeads : 0.0;
        if (!Double.isFinite(noise) || !Double.isFinite(wander) || !Double.isFinite(snr)) {
            throw new StageDegradationException(STAGE_NAME, analysisId, "Spectral quality metrics are not finite");
        }

        if (overall < poorQualityScore) {
            issues.add(POOR_QUALITY_ISSUE);
        }
        if (noise > highNoiseRatio) {
            issues.add(HIGH_NOISE_ISSUE);
            artifacts.add(ArtifactKind.HIGH_NOISE);
        }
        if (wander > wanderRatio) {
            issues.add(BASELINE_WANDER_ISSUE);
        }
        if (snr < lowSnrDb) {
            issues.add(LOW_SNR_ISSUE);
        }

        QualityReport report = new QualityReport(overall, leadScores, noise, wander, snr, artifacts, leadArtifacts,
            issues, false);
        logger.info("Quality assessed: " + report.getSummary());
        return report;
    }

    @Override
    protected QualityReport createFallback(String analysisId, EcgSignal signal) {
        return QualityReport.neutral(signal.metadata.leadNames);
    }

    // ===== PER-LEAD RULES =====

    double scoreLead(double[] x, Set<ArtifactKind> found) {
        if (SignalMath.std(x) < flatLineStd) {
            found.add(ArtifactKind.FLAT_LINE);
            return 0.0;
        }
        double maxAbs = SignalMath.maxAbs(x);
        double variance = SignalMath.variance(x);
        if (maxAbs > saturationAmplitude) {
            found.add(ArtifactKind.SATURATION);
        }
        if (variance > noiseVariance) {
            found.add(ArtifactKind.HIGH_NOISE);
        }

        double score = 1.0;
        if (variance > highVariance) {
            score -= 0.3;
        }
        if (maxAbs > nearSaturationAmplitude) {
            score -= 0.2;
        }
        if (maxAbs < nearFlatAmplitude) {
            score -= 0.2;
        }
        return SignalMath.clip(score, 0.0, 1.0);
    }

    private double signalToNoise(double[] x, double fs) {
        double signalPower = SignalMath.variance(x);
        if (snrHighpassCutoffHz >= 0.45 * fs) {
            return MAX_SNR_DB;
        }
        double[] residual = DigitalFilters.filtfilt(Biquad.highpass(fs, snrHighpassCutoffHz), x, (int) Math.round(fs));
        double noisePower = SignalMath.variance(residual);
        if (noisePower <= signalPower * Math.pow(10, -MAX_SNR_DB / 10)) {
            return MAX_SNR_DB;
        }
        return Math.min(MAX_SNR_DB, 10 * Math.log10(signalPower / noisePower));
    }

    private static double[] toArray(Map<String, Double> scores) {
        double[] values = new double[scores.size()];
        int i = 0;
        for (double v : scores.values()) {
            values[i++] = v;
        }
        return values;
    }
}
