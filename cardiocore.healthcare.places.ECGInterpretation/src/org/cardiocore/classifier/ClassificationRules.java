package org.cardiocore.classifier;

import static org.cardiocore.features.FeatureSet.HEART_RATE;
import static org.cardiocore.features.FeatureSet.IRREGULAR_RHYTHM;
import static org.cardiocore.features.FeatureSet.PR_INTERVAL;
import static org.cardiocore.features.FeatureSet.QRS_DURATION;
import static org.cardiocore.features.FeatureSet.QT_INTERVAL;
import static org.cardiocore.features.FeatureSet.RR_STD;
import static org.cardiocore.features.FeatureSet.ST_ELEVATION;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.cardiocore.exceptions.ConfigurationException;
import org.cardiocore.features.FeatureSet;

/**
 * Reference rule tables for the classification cascade
 *
 * ARCHITECTURAL CONTRACT:
 * - Every level is an ordered decision table; the first matching rule wins
 * - Thresholds and confidences are clinical behavior, not tuning parameters.
 *   Changing any of them needs clinical validation
 * - Tables are immutable and built once; {@link #standard()} is shared by all
 *   concurrent analyses
 *
 * Level 1 and Level 2 tables end in a catch-all rule so they always produce an
 * outcome. Level 3 tables are scoped per category and may match nothing.
 */
public final class ClassificationRules {

    public static final List<String> LEVEL1_FEATURES =
            Collections.unmodifiableList(Arrays.asList(HEART_RATE, RR_STD, QT_INTERVAL));
    public static final List<String> LEVEL2_FEATURES =
            Collections.unmodifiableList(Arrays.asList(HEART_RATE, RR_STD, PR_INTERVAL, QRS_DURATION, ST_ELEVATION));

    private static final Set<Diagnosis> CRITICAL_DIAGNOSES = Collections.unmodifiableSet(
            EnumSet.of(Diagnosis.STEMI, Diagnosis.VENTRICULAR_FIBRILLATION, Diagnosis.VENTRICULAR_TACHYCARDIA));
    private static final Set<Diagnosis> MODERATE_DIAGNOSES = Collections.unmodifiableSet(
            EnumSet.of(Diagnosis.ATRIAL_FIBRILLATION, Diagnosis.FIRST_DEGREE_AV_BLOCK, Diagnosis.NSTEMI));
    private static final double HIGH_URGENCY_CONFIDENCE = 0.8;

    private static final ClassificationRules STANDARD = new ClassificationRules(
            buildLevel1(), buildLevel2(), buildLevel3(), buildUrgency());

    private final DecisionTable<FeatureSet, Level1Result> level1;
    private final DecisionTable<FeatureSet, Level2Result> level2;
    private final Map<DiagnosisCategory, DecisionTable<FeatureSet, DiagnosisFinding>> level3;
    private final DecisionTable<DiagnosisFinding, ClinicalUrgency> urgency;

    public ClassificationRules(DecisionTable<FeatureSet, Level1Result> level1,
            DecisionTable<FeatureSet, Level2Result> level2,
            Map<DiagnosisCategory, DecisionTable<FeatureSet, DiagnosisFinding>> level3,
            DecisionTable<DiagnosisFinding, ClinicalUrgency> urgency) {
        if (level1 == null || level2 == null || level3 == null || urgency == null) {
            throw new ConfigurationException("Classification rules require all four tables");
        }
        for (Map.Entry<DiagnosisCategory, DecisionTable<FeatureSet, DiagnosisFinding>> entry : level3.entrySet()) {
            for (DecisionRule<FeatureSet, DiagnosisFinding> rule : entry.getValue().getRules()) {
                if (rule.outcome.sourceCategory != entry.getKey()) {
                    throw new ConfigurationException(entry.getValue().getTableName(),
                            "Rule " + rule.name + " produces a " + rule.outcome.sourceCategory
                                    + " finding in the " + entry.getKey() + " table");
                }
            }
        }
        this.level1 = level1;
        this.level2 = level2;
        Map<DiagnosisCategory, DecisionTable<FeatureSet, DiagnosisFinding>> copy = new EnumMap<>(DiagnosisCategory.class);
        copy.putAll(level3);
        this.level3 = Collections.unmodifiableMap(copy);
        this.urgency = urgency;
    }

    public static ClassificationRules standard() {
        return STANDARD;
    }

    public DecisionTable<FeatureSet, Level1Result> getLevel1() {
        return level1;
    }

    public DecisionTable<FeatureSet, Level2Result> getLevel2() {
        return level2;
    }

    /** @return the category's table, or null for categories without specific diagnoses */
    public DecisionTable<FeatureSet, DiagnosisFinding> getLevel3(DiagnosisCategory category) {
        return level3.get(category);
    }

    public DecisionTable<DiagnosisFinding, ClinicalUrgency> getUrgency() {
        return urgency;
    }

    // ===== STANDARD TABLES =====

    private static DecisionTable<FeatureSet, Level1Result> buildLevel1() {
        return DecisionTable.<FeatureSet, Level1Result>builder("level1")
                .rule("normal_ranges",
                        f -> f.get(HEART_RATE) >= 60 && f.get(HEART_RATE) <= 100
                                && f.get(RR_STD) < 100
                                && f.get(QT_INTERVAL) >= 350 && f.get(QT_INTERVAL) <= 450,
                        new Level1Result(true, 0.9, 0.1, LEVEL1_FEATURES))
                .rule("outside_normal_ranges", f -> true,
                        new Level1Result(false, 0.8, 0.8, LEVEL1_FEATURES))
                .build();
    }

    private static DecisionTable<FeatureSet, Level2Result> buildLevel2() {
        return DecisionTable.<FeatureSet, Level2Result>builder("level2")
                .rule("marked_tachycardia", f -> f.get(HEART_RATE) > 150,
                        new Level2Result(DiagnosisCategory.ARRHYTHMIA, 0.9, LEVEL2_FEATURES))
                .rule("marked_bradycardia", f -> f.get(HEART_RATE) < 50,
                        new Level2Result(DiagnosisCategory.CONDUCTION_ABNORMALITY, 0.85, LEVEL2_FEATURES))
                .rule("high_rr_variability", f -> f.get(RR_STD) > 200,
                        new Level2Result(DiagnosisCategory.ARRHYTHMIA, 0.8, LEVEL2_FEATURES))
                .rule("prolonged_conduction", f -> f.get(PR_INTERVAL) > 200 || f.get(QRS_DURATION) > 120,
                        new Level2Result(DiagnosisCategory.CONDUCTION_ABNORMALITY, 0.8, LEVEL2_FEATURES))
                .rule("st_elevation", f -> f.isFlagSet(ST_ELEVATION),
                        new Level2Result(DiagnosisCategory.ISCHEMIC_CHANGE, 0.9, LEVEL2_FEATURES))
                .rule("no_category_rule", f -> true,
                        new Level2Result(DiagnosisCategory.NORMAL, 0.85, LEVEL2_FEATURES))
                .build();
    }

    private static Map<DiagnosisCategory, DecisionTable<FeatureSet, DiagnosisFinding>> buildLevel3() {
        Map<DiagnosisCategory, DecisionTable<FeatureSet, DiagnosisFinding>> tables = new EnumMap<>(DiagnosisCategory.class);

        tables.put(DiagnosisCategory.ARRHYTHMIA, DecisionTable.<FeatureSet, DiagnosisFinding>builder("level3.arrhythmia")
                .rule("irregular_tachycardia", f -> f.get(HEART_RATE) > 150 && f.isFlagSet(IRREGULAR_RHYTHM),
                        new DiagnosisFinding(Diagnosis.ATRIAL_FIBRILLATION, 0.85))
                .rule("regular_tachycardia", f -> f.get(HEART_RATE) > 150,
                        new DiagnosisFinding(Diagnosis.SINUS_TACHYCARDIA, 0.8))
                .rule("moderate_tachycardia", f -> f.get(HEART_RATE) > 100,
                        new DiagnosisFinding(Diagnosis.SUPRAVENTRICULAR_TACHYCARDIA, 0.75))
                .build());

        tables.put(DiagnosisCategory.CONDUCTION_ABNORMALITY,
                DecisionTable.<FeatureSet, DiagnosisFinding>builder("level3.conduction")
                .rule("bradycardia", f -> f.get(HEART_RATE) < 50,
                        new DiagnosisFinding(Diagnosis.SINUS_BRADYCARDIA, 0.8))
                .rule("prolonged_pr", f -> f.get(PR_INTERVAL) > 200,
                        new DiagnosisFinding(Diagnosis.FIRST_DEGREE_AV_BLOCK, 0.85))
                .build());

        tables.put(DiagnosisCategory.ISCHEMIC_CHANGE, DecisionTable.<FeatureSet, DiagnosisFinding>builder("level3.ischemia")
                .rule("st_elevation", f -> f.isFlagSet(ST_ELEVATION),
                        new DiagnosisFinding(Diagnosis.STEMI, 0.9))
                .rule("ischemia_without_st_elevation", f -> true,
                        new DiagnosisFinding(Diagnosis.NSTEMI, 0.8))
                .build());

        tables.put(DiagnosisCategory.HYPERTROPHY, DecisionTable.<FeatureSet, DiagnosisFinding>builder("level3.hypertrophy")
                .rule("hypertrophy", f -> true,
                        new DiagnosisFinding(Diagnosis.LEFT_VENTRICULAR_HYPERTROPHY, 0.75))
                .build());

        return tables;
    }

    private static DecisionTable<DiagnosisFinding, ClinicalUrgency> buildUrgency() {
        return DecisionTable.<DiagnosisFinding, ClinicalUrgency>builder("urgency")
                .rule("critical_diagnosis", d -> CRITICAL_DIAGNOSES.contains(d.diagnosis), ClinicalUrgency.CRITICAL)
                .rule("confident_tachyarrhythmia",
                        d -> d.diagnosis.isTachyarrhythmia() && d.confidence > HIGH_URGENCY_CONFIDENCE,
                        ClinicalUrgency.HIGH)
                .rule("moderate_diagnosis", d -> MODERATE_DIAGNOSES.contains(d.diagnosis), ClinicalUrgency.MEDIUM)
                .build();
    }
}
