package org.cardiocore.classifier;

import java.util.Map;
import java.util.Objects;

import org.cardiocore.base.PipelineArtifact;
import org.cardiocore.json.JsonRecordBuilder;

/**
 * One Level 3 entry: a specific diagnosis, its confidence and the category
 * whose rule table produced it.
 */
public final class DiagnosisFinding implements PipelineArtifact {

    public final Diagnosis diagnosis;
    public final double confidence;
    public final DiagnosisCategory sourceCategory;

    public DiagnosisFinding(Diagnosis diagnosis, double confidence, DiagnosisCategory sourceCategory) {
        this.diagnosis = Objects.requireNonNull(diagnosis, "diagnosis");
        this.sourceCategory = Objects.requireNonNull(sourceCategory, "sourceCategory");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Confidence must be in [0,1]: " + confidence);
        }
        this.confidence = confidence;
    }

    public DiagnosisFinding(Diagnosis diagnosis, double confidence) {
        this(diagnosis, confidence, diagnosis.getCategory());
    }

    public String getLabel() {
        return diagnosis.getLabel();
    }

    @Override
    public Map<String, Object> toJsonFields() {
        return new JsonRecordBuilder()
                .put("diagnosis", diagnosis.getLabel())
                .put("confidence", confidence)
                .put("icd10_code", diagnosis.getIcd10Code())
                .put("scp_code", diagnosis.getScpCode())
                .put("source_category", sourceCategory)
                .build();
    }

    @Override
    public String getSummary() {
        return String.format("%s (%.2f)", diagnosis.getLabel(), confidence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiagnosisFinding)) return false;
        DiagnosisFinding other = (DiagnosisFinding) o;
        return diagnosis == other.diagnosis
                && Double.compare(confidence, other.confidence) == 0
                && sourceCategory == other.sourceCategory;
    }

    @Override
    public int hashCode() {
        return Objects.hash(diagnosis, confidence, sourceCategory);
    }

    @Override
    public String toString() {
        return "DiagnosisFinding{" + getSummary() + ", category=" + sourceCategory + "}";
    }
}
