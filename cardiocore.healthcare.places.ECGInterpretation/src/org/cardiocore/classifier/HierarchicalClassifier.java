package org.cardiocore.classifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.cardiocore.base.BasePipelineStage;
import org.cardiocore.features.FeatureSet;

/**
 * Hierarchical Multi-Pathology Classifier
 *
 * RESPONSIBILITY: normal/abnormal screen, category, specific diagnoses and urgency
 *
 * ARCHITECTURAL CONTRACT:
 * - Levels run in sequence over the same FeatureSet; Level 3 only sees the
 *   Level 2 category
 * - Each level absorbs its own faults and substitutes its conservative
 *   default (normal / NORMAL / empty list / LOW) with a warning, so a degraded
 *   level never stops the next one
 * - Holds no per-analysis state; one instance serves concurrent analyses
 */
public class HierarchicalClassifier extends BasePipelineStage<FeatureSet, ClassificationResult> {

    private static final Logger logger = Logger.getLogger(HierarchicalClassifier.class);

    public static final String STAGE_NAME = "CLASSIFIER";

    private final ClassificationRules rules;
    private final RhythmScreening screening;

    public HierarchicalClassifier() {
        this(ClassificationRules.standard());
    }

    public HierarchicalClassifier(ClassificationRules rules) {
        super(STAGE_NAME);
        this.rules = rules;
        this.screening = new RhythmScreening();
    }

    // ===== STAGE IMPLEMENTATION =====

    @Override
    protected ClassificationResult processStageSpecific(String analysisId, FeatureSet features, List<String> warnings) {
        Level1Result level1;
        try {
            level1 = classifyLevel1(features);
        } catch (RuntimeException e) {
            level1 = Level1Result.conservativeDefault();
            recordLevelFault("Level 1", analysisId, e, warnings);
        }

        Level2Result level2;
        try {
            level2 = classifyLevel2(features);
        } catch (RuntimeException e) {
            level2 = Level2Result.conservativeDefault();
            recordLevelFault("Level 2", analysisId, e, warnings);
        }

        Level3Result level3;
        try {
            level3 = classifyLevel3(features, Collections.singletonList(level2.category));
        } catch (RuntimeException e) {
            level3 = Level3Result.empty();
            recordLevelFault("Level 3", analysisId, e, warnings);
        }

        ClinicalUrgency urgency;
        try {
            urgency = deriveUrgency(level3.diagnoses);
        } catch (RuntimeException e) {
            urgency = ClinicalUrgency.LOW;
            recordLevelFault("Urgency", analysisId, e, warnings);
        }

        List<ScreeningFinding> screenings;
        try {
            screenings = screening.screen(features);
        } catch (RuntimeException e) {
            screenings = Collections.emptyList();
            recordLevelFault("Rhythm screening", analysisId, e, warnings);
        }

        ClassificationResult result = new ClassificationResult(level1, level2, level3, urgency, screenings);
        logger.info("Classification: " + result.getSummary());
        return result;
    }

    @Override
    protected ClassificationResult createFallback(String analysisId, FeatureSet features) {
        return ClassificationResult.conservativeDefault();
    }

    // ===== LEVELS =====

    public Level1Result classifyLevel1(FeatureSet features) {
        return rules.getLevel1().firstMatch(features).outcome;
    }

    public Level2Result classifyLevel2(FeatureSet features) {
        return rules.getLevel2().firstMatch(features).outcome;
    }

    /**
     * Specific diagnoses for each requested category, first matching rule per
     * category. Categories without a table contribute nothing.
     */
    public Level3Result classifyLevel3(FeatureSet features, List<DiagnosisCategory> categories) {
        List<DiagnosisFinding> findings = new ArrayList<>();
        for (DiagnosisCategory category : categories) {
            DecisionTable<FeatureSet, DiagnosisFinding> table = rules.getLevel3(category);
            if (table == null) {
                continue;
            }
            DecisionRule<FeatureSet, DiagnosisFinding> match = table.firstMatch(features);
            if (match != null) {
                logger.debug("Level 3 rule " + match.name + " matched in " + category);
                findings.add(match.outcome);
            }
        }
        return new Level3Result(findings, categories);
    }

    /**
     * Precedence scan: the highest-priority urgency rule matched by any finding
     * wins regardless of where that finding sits in the list.
     */
    public ClinicalUrgency deriveUrgency(List<DiagnosisFinding> diagnoses) {
        DecisionRule<DiagnosisFinding, ClinicalUrgency> match = rules.getUrgency().firstMatchAmong(diagnoses);
        return match == null ? ClinicalUrgency.LOW : match.outcome;
    }

    private void recordLevelFault(String level, String analysisId, RuntimeException e, List<String> warnings) {
        logger.warn(level + " classification failed for " + analysisId + ", conservative default used", e);
        warnings.add(level + " classification degraded, conservative default used: " + e.getMessage());
    }
}
