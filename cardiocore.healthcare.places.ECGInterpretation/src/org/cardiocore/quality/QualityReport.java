package org.cardiocore.quality;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.cardiocore.base.PipelineArtifact;

/**
 * Per-lead and aggregate signal quality for one analysis
 */
public final class QualityReport implements PipelineArtifact {

    public static final double NEUTRAL_SCORE = 0.5;

    public final double overallScore;
    public final Map<String, Double> leadScores;
    public final double noiseLevel;
    public final double baselineWander;
    public final double snrDb;
    public final Set<ArtifactKind> artifacts;
    public final Map<String, Set<ArtifactKind>> leadArtifacts;
    public final List<String> issues;
    public final boolean neutralDefault;

    public QualityReport(double overallScore, Map<String, Double> leadScores, double noiseLevel, double baselineWander,
            double snrDb, Set<ArtifactKind> artifacts, Map<String, Set<ArtifactKind>> leadArtifacts,
            List<String> issues, boolean neutralDefault) {
        if (!(overallScore >= 0.0 && overallScore <= 1.0)) {
            throw new IllegalArgumentException("overallScore must be within [0,1]: " + overallScore);
        }
        this.overallScore = overallScore;
        this.leadScores = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(leadScores)));
        this.noiseLevel = noiseLevel;
        this.baselineWander = baselineWander;
        this.snrDb = snrDb;
        this.artifacts = Collections.unmodifiableSet(artifacts.isEmpty()
            ? EnumSet.noneOf(ArtifactKind.class) : EnumSet.copyOf(artifacts));
        Map<String, Set<ArtifactKind>> perLead = new LinkedHashMap<>();
        for (Map.Entry<String, Set<ArtifactKind>> entry : leadArtifacts.entrySet()) {
            perLead.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue().isEmpty()
                ? EnumSet.noneOf(ArtifactKind.class) : EnumSet.copyOf(entry.getValue())));
        }
        this.leadArtifacts = Collections.unmodifiableMap(perLead);
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
        this.neutralDefault = neutralDefault;
    }

    /**
     * Neutral report used when quality scoring itself fails: score 0.5 everywhere, no issues.
     */
    public static QualityReport neutral(List<String> leadNames) {
        Map<String, Double> scores = new LinkedHashMap<>();
        Map<String, Set<ArtifactKind>> perLead = new LinkedHashMap<>();
        for (String lead : leadNames) {
            scores.put(lead, NEUTRAL_SCORE);
            perLead.put(lead, EnumSet.noneOf(ArtifactKind.class));
        }
        return new QualityReport(NEUTRAL_SCORE, scores, 0.0, 0.0, 0.0,
            EnumSet.noneOf(ArtifactKind.class), perLead, new ArrayList<>(), true);
    }

    public double getLeadScore(String lead) {
        Double score = leadScores.get(lead);
        return score == null ? 0.0 : score;
    }

    public boolean hasArtifact(ArtifactKind kind) {
        return artifacts.contains(kind);
    }

    @Override
    public Map<String, Object> toJsonFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("overall_score", overallScore);
        fields.put("lead_scores", leadScores);
        fields.put("noise_level", noiseLevel);
        fields.put("baseline_wander", baselineWander);
        fields.put("snr_db", snrDb);
        fields.put("artifacts", new ArrayList<>(artifacts));
        fields.put("lead_artifacts", leadArtifacts);
        fields.put("issues", issues);
        fields.put("neutral_default", neutralDefault);
        return fields;
    }

    @Override
    public String getSummary() {
        return String.format("quality=%.2f, noise=%.3f, wander=%.3f, snr=%.1fdB, artifacts=%s",
            overallScore, noiseLevel, baselineWander, snrDb, artifacts);
    }

    @Override
    public String toString() {
        return "QualityReport{" + getSummary() + ", issues=" + issues + "}";
    }
}
