package org.cardiocore.classifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.cardiocore.base.PipelineArtifact;
import org.cardiocore.json.JsonRecordBuilder;

/**
 * Level 3: specific diagnoses ranked by descending confidence. Equal
 * confidences keep the order the rule tables produced them in. An empty list
 * is a valid "no actionable finding" result.
 */
public final class Level3Result implements PipelineArtifact {

    private static final Comparator<DiagnosisFinding> BY_CONFIDENCE_DESCENDING =
            Comparator.comparingDouble((DiagnosisFinding f) -> f.confidence).reversed();

    public final List<DiagnosisFinding> diagnoses;
    public final List<DiagnosisCategory> categoriesEvaluated;

    public Level3Result(List<DiagnosisFinding> diagnoses, List<DiagnosisCategory> categoriesEvaluated) {
        List<DiagnosisFinding> ranked = new ArrayList<>(diagnoses);
        ranked.sort(BY_CONFIDENCE_DESCENDING);
        this.diagnoses = Collections.unmodifiableList(ranked);
        this.categoriesEvaluated = Collections.unmodifiableList(new ArrayList<>(categoriesEvaluated));
    }

    public static Level3Result empty() {
        return new Level3Result(Collections.<DiagnosisFinding>emptyList(), Collections.<DiagnosisCategory>emptyList());
    }

    /** @return the highest-confidence finding, or null when the list is empty */
    public DiagnosisFinding getPrimaryDiagnosis() {
        return diagnoses.isEmpty() ? null : diagnoses.get(0);
    }

    public int getTotalDiagnoses() {
        return diagnoses.size();
    }

    public boolean isEmpty() {
        return diagnoses.isEmpty();
    }

    @Override
    public Map<String, Object> toJsonFields() {
        return new JsonRecordBuilder()
                .put("specific_diagnoses", diagnoses)
                .put("primary_diagnosis", getPrimaryDiagnosis())
                .put("total_diagnoses", diagnoses.size())
                .put("categories_evaluated", categoriesEvaluated)
                .build();
    }

    @Override
    public String getSummary() {
        DiagnosisFinding primary = getPrimaryDiagnosis();
        return primary == null ? "no specific diagnosis" : primary.getSummary();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Level3Result)) return false;
        Level3Result other = (Level3Result) o;
        return diagnoses.equals(other.diagnoses) && categoriesEvaluated.equals(other.categoriesEvaluated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(diagnoses, categoriesEvaluated);
    }

    @Override
    public String toString() {
        return "Level3Result{" + diagnoses + "}";
    }
}
