package org.cardiocore.classifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.cardiocore.base.PipelineArtifact;
import org.cardiocore.json.JsonRecordBuilder;

/**
 * Level 1: normal versus abnormal.
 */
public final class Level1Result implements PipelineArtifact {

    public final boolean isNormal;
    public final double confidence;
    public final double abnormalityScore;
    public final List<String> featuresAnalyzed;

    public Level1Result(boolean isNormal, double confidence, double abnormalityScore, List<String> featuresAnalyzed) {
        this.isNormal = isNormal;
        this.confidence = confidence;
        this.abnormalityScore = abnormalityScore;
        this.featuresAnalyzed = Collections.unmodifiableList(new ArrayList<>(featuresAnalyzed));
    }

    /** Substituted when Level 1 faults: normal, neutral confidence, no features. */
    public static Level1Result conservativeDefault() {
        return new Level1Result(true, 0.5, 0.5, Collections.<String>emptyList());
    }

    @Override
    public Map<String, Object> toJsonFields() {
        return new JsonRecordBuilder()
                .put("is_normal", isNormal)
                .put("confidence", confidence)
                .put("abnormality_score", abnormalityScore)
                .put("features_analyzed", featuresAnalyzed)
                .build();
    }

    @Override
    public String getSummary() {
        return (isNormal ? "normal" : "abnormal") + String.format(" (%.2f)", confidence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Level1Result)) return false;
        Level1Result other = (Level1Result) o;
        return isNormal == other.isNormal
                && Double.compare(confidence, other.confidence) == 0
                && Double.compare(abnormalityScore, other.abnormalityScore) == 0
                && featuresAnalyzed.equals(other.featuresAnalyzed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(isNormal, confidence, abnormalityScore, featuresAnalyzed);
    }

    @Override
    public String toString() {
        return "Level1Result{" + getSummary() + "}";
    }
}
