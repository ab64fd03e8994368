package org.cardiocore.classifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.cardiocore.base.PipelineArtifact;
import org.cardiocore.json.JsonRecordBuilder;

/**
 * Level 2: exactly one diagnostic category. Rules do not blend, so the score
 * map carries only the winning category.
 */
public final class Level2Result implements PipelineArtifact {

    public final DiagnosisCategory category;
    public final double confidence;
    public final Map<DiagnosisCategory, Double> categoryScores;
    public final List<String> featuresUsed;

    public Level2Result(DiagnosisCategory category, double confidence, List<String> featuresUsed) {
        this.category = Objects.requireNonNull(category, "category");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Confidence must be in [0,1]: " + confidence);
        }
        this.confidence = confidence;
        Map<DiagnosisCategory, Double> scores = new EnumMap<>(DiagnosisCategory.class);
        scores.put(category, confidence);
        this.categoryScores = Collections.unmodifiableMap(scores);
        this.featuresUsed = Collections.unmodifiableList(new ArrayList<>(featuresUsed));
    }

    /** Substituted when Level 2 faults. */
    public static Level2Result conservativeDefault() {
        return new Level2Result(DiagnosisCategory.NORMAL, 0.5, Collections.<String>emptyList());
    }

    @Override
    public Map<String, Object> toJsonFields() {
        return new JsonRecordBuilder()
                .put("predicted_category", category)
                .put("confidence", confidence)
                .put("category_scores", categoryScores)
                .put("features_used", featuresUsed)
                .build();
    }

    @Override
    public String getSummary() {
        return category + String.format(" (%.2f)", confidence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Level2Result)) return false;
        Level2Result other = (Level2Result) o;
        return category == other.category
                && Double.compare(confidence, other.confidence) == 0
                && featuresUsed.equals(other.featuresUsed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, confidence, featuresUsed);
    }

    @Override
    public String toString() {
        return "Level2Result{" + getSummary() + "}";
    }
}
