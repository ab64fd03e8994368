package org.cardiocore.classifier;

import java.util.ArrayList;
import java.util.List;

import org.cardiocore.features.FeatureSet;

/**
 * Additive screening scores for atrial fibrillation and long QT.
 */
public class RhythmScreening {

    public static final String ATRIAL_FIBRILLATION = "atrial_fibrillation";
    public static final String LONG_QT_SYNDROME = "long_qt_syndrome";

    private static final double AF_RR_CV = 0.3;
    private static final double AF_RMSSD = 50.0;
    private static final double AF_ENTROPY = 0.8;
    private static final double LONG_QTC = 460.0;

    public List<ScreeningFinding> screen(FeatureSet features) {
        List<ScreeningFinding> findings = new ArrayList<>();
        findings.add(new ScreeningFinding(ATRIAL_FIBRILLATION, atrialFibrillationScore(features),
                "Irregular RR intervals, absent P waves"));
        findings.add(new ScreeningFinding(LONG_QT_SYNDROME, longQtScore(features),
                "QTc > 450ms (men) or > 460ms (women)"));
        return findings;
    }

    double atrialFibrillationScore(FeatureSet features) {
        double score = 0.0;
        if (features.get(FeatureSet.RR_CV) > AF_RR_CV) {
            score += 0.4;
        }
        if (features.get(FeatureSet.HRV_RMSSD) > AF_RMSSD) {
            score += 0.3;
        }
        if (features.get(FeatureSet.SPECTRAL_ENTROPY) > AF_ENTROPY) {
            score += 0.3;
        }
        return Math.min(score, 1.0);
    }

    double longQtScore(FeatureSet features) {
        double qtc = features.get(FeatureSet.QTC);
        if (qtc > LONG_QTC) {
            return Math.min((qtc - LONG_QTC) / 100.0, 1.0);
        }
        return 0.0;
    }
}
