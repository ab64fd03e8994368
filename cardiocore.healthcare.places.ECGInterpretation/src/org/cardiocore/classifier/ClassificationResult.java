package org.cardiocore.classifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.cardiocore.base.PipelineArtifact;
import org.cardiocore.json.JsonRecordBuilder;

/**
 * All three classification levels, the derived urgency and the secondary
 * screening scores for one analysis.
 */
public final class ClassificationResult implements PipelineArtifact {

    public final Level1Result level1;
    public final Level2Result level2;
    public final Level3Result level3;
    public final ClinicalUrgency urgency;
    public final List<ScreeningFinding> screenings;

    public ClassificationResult(Level1Result level1, Level2Result level2, Level3Result level3,
            ClinicalUrgency urgency, List<ScreeningFinding> screenings) {
        this.level1 = Objects.requireNonNull(level1, "level1");
        this.level2 = Objects.requireNonNull(level2, "level2");
        this.level3 = Objects.requireNonNull(level3, "level3");
        this.urgency = Objects.requireNonNull(urgency, "urgency");
        this.screenings = Collections.unmodifiableList(new ArrayList<>(screenings));
    }

    public static ClassificationResult conservativeDefault() {
        return new ClassificationResult(Level1Result.conservativeDefault(), Level2Result.conservativeDefault(),
                Level3Result.empty(), ClinicalUrgency.LOW, Collections.<ScreeningFinding>emptyList());
    }

    public DiagnosisFinding getPrimaryDiagnosis() {
        return level3.getPrimaryDiagnosis();
    }

    @Override
    public Map<String, Object> toJsonFields() {
        return new JsonRecordBuilder()
                .put("level1", level1)
                .put("level2", level2)
                .put("level3", level3)
                .put("clinical_urgency", urgency)
                .put("screenings", screenings)
                .build();
    }

    @Override
    public String getSummary() {
        return String.format("L1=%s, L2=%s, L3=%s, urgency=%s",
                level1.getSummary(), level2.getSummary(), level3.getSummary(), urgency);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassificationResult)) return false;
        ClassificationResult other = (ClassificationResult) o;
        return level1.equals(other.level1) && level2.equals(other.level2) && level3.equals(other.level3)
                && urgency == other.urgency && screenings.equals(other.screenings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level1, level2, level3, urgency, screenings);
    }

    @Override
    public String toString() {
        return "ClassificationResult{" + getSummary() + "}";
    }
}
