package org.cardiocore.explain;

import java.util.Objects;

import org.cardiocore.classifier.ClassificationResult;
import org.cardiocore.classifier.DiagnosisCategory;
import org.cardiocore.classifier.DiagnosisFinding;
import org.cardiocore.classifier.ClinicalUrgency;
import org.cardiocore.features.FeatureSet;
import org.cardiocore.signal.EcgSignal;

/**
 * Input of the explanation stage: the cleaned signal, its features and the top
 * prediction.
 */
public final class ExplanationRequest {

    public final EcgSignal signal;
    public final FeatureSet features;
    public final String primaryDiagnosis;
    public final double confidence;
    public final ClinicalUrgency urgency;

    public ExplanationRequest(EcgSignal signal, FeatureSet features, String primaryDiagnosis, double confidence,
            ClinicalUrgency urgency) {
        this.signal = Objects.requireNonNull(signal, "signal");
        this.features = Objects.requireNonNull(features, "features");
        this.primaryDiagnosis = Objects.requireNonNull(primaryDiagnosis, "primaryDiagnosis");
        this.confidence = confidence;
        this.urgency = Objects.requireNonNull(urgency, "urgency");
    }

    /**
     * The top prediction is the first Level 3 entry. Without one, the Level 2
     * category stands in with the Level 2 confidence.
     */
    public static ExplanationRequest of(EcgSignal signal, FeatureSet features, ClassificationResult classification) {
        DiagnosisFinding primary = classification.getPrimaryDiagnosis();
        if (primary != null) {
            return new ExplanationRequest(signal, features, primary.getLabel(), primary.confidence,
                    classification.urgency);
        }
        DiagnosisCategory category = classification.level2.category;
        return new ExplanationRequest(signal, features, category.getDisplayName(), classification.level2.confidence,
                classification.urgency);
    }
}
