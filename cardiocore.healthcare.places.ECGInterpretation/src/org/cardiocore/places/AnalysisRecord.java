package org.cardiocore.places;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.cardiocore.classifier.ClassificationResult;
import org.cardiocore.classifier.ClinicalUrgency;
import org.cardiocore.explain.ExplanationResult;
import org.cardiocore.features.BeatAnnotation;
import org.cardiocore.features.FeatureSet;
import org.cardiocore.json.JsonRecordBuilder;
import org.cardiocore.quality.QualityReport;
import org.cardiocore.signal.AcquisitionMetadata;

/**
 * The one structured result of an analysis, handed to the persistence,
 * notification and reporting layers. Immutable.
 *
 * Contains no timings or timestamps of its own, so byte-identical input and
 * hint (including the analysis id) render to byte-identical JSON.
 */
public final class AnalysisRecord {

    public final String analysisId;
    public final AcquisitionMetadata metadata;
    public final QualityReport quality;
    public final FeatureSet features;
    public final ClassificationResult classification;
    public final ExplanationResult explanation;
    public final double qualityAdjustedConfidence;
    public final List<BeatAnnotation> beatAnnotations;
    public final List<String> warnings;

    public AnalysisRecord(String analysisId, AcquisitionMetadata metadata, QualityReport quality, FeatureSet features,
            ClassificationResult classification, ExplanationResult explanation, double qualityAdjustedConfidence,
            List<BeatAnnotation> beatAnnotations, List<String> warnings) {
        this.analysisId = Objects.requireNonNull(analysisId, "analysisId");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.quality = Objects.requireNonNull(quality, "quality");
        this.features = Objects.requireNonNull(features, "features");
        this.classification = Objects.requireNonNull(classification, "classification");
        this.explanation = Objects.requireNonNull(explanation, "explanation");
        this.qualityAdjustedConfidence = qualityAdjustedConfidence;
        this.beatAnnotations = Collections.unmodifiableList(new ArrayList<>(beatAnnotations));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public ClinicalUrgency getUrgency() {
        return classification.urgency;
    }

    /** Urgency of HIGH or above is picked up by the notification layer. */
    public boolean requiresNotification() {
        return classification.urgency.requiresNotification();
    }

    public boolean requiresImmediateAttention() {
        return classification.urgency == ClinicalUrgency.CRITICAL;
    }

    public String toJson() {
        return new JsonRecordBuilder()
                .put("analysis_id", analysisId)
                .put("status", "COMPLETED")
                .put("metadata", metadata)
                .put("quality", quality)
                .put("features", features)
                .put("classification", classification)
                .put("clinical_urgency", classification.urgency)
                .put("requires_notification", requiresNotification())
                .put("requires_immediate_attention", requiresImmediateAttention())
                .put("quality_adjusted_confidence", qualityAdjustedConfidence)
                .put("explanation", explanation)
                .put("annotations", beatAnnotations)
                .put("warnings", warnings)
                .toJson();
    }

    @Override
    public String toString() {
        return String.format("AnalysisRecord{id=%s, %s, urgency=%s, warnings=%d}",
                analysisId, classification.level3.getSummary(), classification.urgency, warnings.size());
    }
}
