package org.cardiocore.classifier;

import java.util.Map;
import java.util.Objects;

import org.cardiocore.base.PipelineArtifact;
import org.cardiocore.json.JsonRecordBuilder;

/**
 * Secondary screening score. Reported alongside the cascade, never fed into it.
 */
public final class ScreeningFinding implements PipelineArtifact {

    public static final double DETECTION_THRESHOLD = 0.5;

    public final String condition;
    public final double score;
    public final String criteria;

    public ScreeningFinding(String condition, double score, String criteria) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.score = score;
        this.criteria = Objects.requireNonNull(criteria, "criteria");
    }

    public boolean isDetected() {
        return score > DETECTION_THRESHOLD;
    }

    @Override
    public Map<String, Object> toJsonFields() {
        return new JsonRecordBuilder()
                .put("condition", condition)
                .put("detected", isDetected())
                .put("confidence", score)
                .put("criteria", criteria)
                .build();
    }

    @Override
    public String getSummary() {
        return String.format("%s %.2f%s", condition, score, isDetected() ? " (detected)" : "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScreeningFinding)) return false;
        ScreeningFinding other = (ScreeningFinding) o;
        return condition.equals(other.condition) && Double.compare(score, other.score) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, score);
    }

    @Override
    public String toString() {
        return "ScreeningFinding{" + getSummary() + "}";
    }
}
