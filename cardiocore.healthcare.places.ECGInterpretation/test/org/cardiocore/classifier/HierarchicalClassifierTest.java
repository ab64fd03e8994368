package org.cardiocore.classifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.cardiocore.base.StageResult;
import org.cardiocore.exceptions.ConfigurationException;
import org.cardiocore.features.FeatureSet;
import org.junit.jupiter.api.Test;

class HierarchicalClassifierTest {

    private final HierarchicalClassifier classifier = new HierarchicalClassifier();

    private static FeatureSet.Builder features() {
        return FeatureSet.builder();
    }

    // ===== WORKED CASES =====

    @Test
    void fastIrregularRhythmIsAtrialFibrillationWithHighUrgency() {
        FeatureSet features = features()
                .put(FeatureSet.HEART_RATE, 180)
                .flag(FeatureSet.IRREGULAR_RHYTHM, true)
                .build();

        StageResult<ClassificationResult> result = classifier.execute("ECG-C1", features);

        ClassificationResult classification = result.getValue();
        assertFalse(result.isDegraded());
        assertTrue(result.getWarnings().isEmpty());
        assertFalse(classification.level1.isNormal);
        assertEquals(DiagnosisCategory.ARRHYTHMIA, classification.level2.category);
        assertEquals(0.9, classification.level2.confidence);
        assertEquals(Diagnosis.ATRIAL_FIBRILLATION, classification.getPrimaryDiagnosis().diagnosis);
        assertEquals(0.85, classification.getPrimaryDiagnosis().confidence);
        assertEquals(ClinicalUrgency.HIGH, classification.urgency);
    }

    @Test
    void stElevationIsCriticalInfarction() {
        FeatureSet features = features().flag(FeatureSet.ST_ELEVATION, true).build();

        ClassificationResult classification = classifier.execute("ECG-C2", features).getValue();

        assertEquals(DiagnosisCategory.ISCHEMIC_CHANGE, classification.level2.category);
        assertEquals(0.9, classification.level2.confidence);
        assertEquals("ST Elevation Myocardial Infarction", classification.getPrimaryDiagnosis().getLabel());
        assertEquals(0.9, classification.getPrimaryDiagnosis().confidence);
        assertEquals(ClinicalUrgency.CRITICAL, classification.urgency);
        assertTrue(classification.urgency.requiresNotification());
    }

    @Test
    void normalRangesGiveNormalCategoryAndLowUrgency() {
        FeatureSet features = features()
                .put(FeatureSet.HEART_RATE, 70)
                .put(FeatureSet.RR_STD, 20)
                .put(FeatureSet.QT_INTERVAL, 400)
                .build();

        ClassificationResult classification = classifier.execute("ECG-C3", features).getValue();

        assertTrue(classification.level1.isNormal);
        assertEquals(0.9, classification.level1.confidence);
        assertEquals(DiagnosisCategory.NORMAL, classification.level2.category);
        assertTrue(classification.level3.isEmpty());
        assertNull(classification.getPrimaryDiagnosis());
        assertEquals(ClinicalUrgency.LOW, classification.urgency);
    }

    // ===== LEVEL 1 =====

    @Test
    void levelOneIsNormalExactlyWhenAllRangesHold() {
        double[] heartRates = { 59.9, 60, 80, 100, 100.1 };
        double[] rrStds = { 20, 99.9, 100 };
        double[] qts = { 349.9, 350, 400, 450, 450.1 };
        for (double hr : heartRates) {
            for (double rrStd : rrStds) {
                for (double qt : qts) {
                    FeatureSet features = features()
                            .put(FeatureSet.HEART_RATE, hr)
                            .put(FeatureSet.RR_STD, rrStd)
                            .put(FeatureSet.QT_INTERVAL, qt)
                            .build();
                    boolean expected = hr >= 60 && hr <= 100 && rrStd < 100 && qt >= 350 && qt <= 450;
                    Level1Result level1 = classifier.classifyLevel1(features);
                    assertEquals(expected, level1.isNormal, "hr=" + hr + " rr_std=" + rrStd + " qt=" + qt);
                    assertEquals(expected ? 0.1 : 0.8, level1.abnormalityScore);
                }
            }
        }
    }

    // ===== LEVEL 2 =====

    @Test
    void levelTwoRulesApplyInPriorityOrder() {
        FeatureSet tachyAndSt = features()
                .put(FeatureSet.HEART_RATE, 160)
                .flag(FeatureSet.ST_ELEVATION, true)
                .build();
        FeatureSet bradyAndLongPr = features()
                .put(FeatureSet.HEART_RATE, 45)
                .put(FeatureSet.PR_INTERVAL, 240)
                .build();
        FeatureSet variableAndWideQrs = features()
                .put(FeatureSet.RR_STD, 250)
                .put(FeatureSet.QRS_DURATION, 140)
                .build();
        FeatureSet wideQrsOnly = features().put(FeatureSet.QRS_DURATION, 140).build();

        assertEquals(DiagnosisCategory.ARRHYTHMIA, classifier.classifyLevel2(tachyAndSt).category);
        assertEquals(DiagnosisCategory.CONDUCTION_ABNORMALITY, classifier.classifyLevel2(bradyAndLongPr).category);
        assertEquals(0.85, classifier.classifyLevel2(bradyAndLongPr).confidence);
        assertEquals(DiagnosisCategory.ARRHYTHMIA, classifier.classifyLevel2(variableAndWideQrs).category);
        assertEquals(0.8, classifier.classifyLevel2(variableAndWideQrs).confidence);
        assertEquals(DiagnosisCategory.CONDUCTION_ABNORMALITY, classifier.classifyLevel2(wideQrsOnly).category);
        assertEquals(DiagnosisCategory.NORMAL, classifier.classifyLevel2(FeatureSet.defaults()).category);
        assertEquals(0.85, classifier.classifyLevel2(FeatureSet.defaults()).confidence);
    }

    // ===== LEVEL 3 =====

    @Test
    void levelThreeReturnsFirstMatchPerCategorySortedByConfidence() {
        FeatureSet features = features()
                .put(FeatureSet.HEART_RATE, 120)
                .put(FeatureSet.PR_INTERVAL, 240)
                .flag(FeatureSet.ST_ELEVATION, true)
                .build();

        Level3Result level3 = classifier.classifyLevel3(features, Arrays.asList(
                DiagnosisCategory.ARRHYTHMIA, DiagnosisCategory.CONDUCTION_ABNORMALITY,
                DiagnosisCategory.ISCHEMIC_CHANGE, DiagnosisCategory.NORMAL));

        assertEquals(3, level3.getTotalDiagnoses());
        assertEquals(Diagnosis.STEMI, level3.diagnoses.get(0).diagnosis);
        assertEquals(Diagnosis.FIRST_DEGREE_AV_BLOCK, level3.diagnoses.get(1).diagnosis);
        assertEquals(Diagnosis.SUPRAVENTRICULAR_TACHYCARDIA, level3.diagnoses.get(2).diagnosis);
        for (int i = 1; i < level3.diagnoses.size(); i++) {
            assertTrue(level3.diagnoses.get(i - 1).confidence >= level3.diagnoses.get(i).confidence);
        }
    }

    @Test
    void regularTachycardiaAndHypertrophy() {
        FeatureSet regularFast = features().put(FeatureSet.HEART_RATE, 170).build();

        Level3Result arrhythmia = classifier.classifyLevel3(regularFast,
                Collections.singletonList(DiagnosisCategory.ARRHYTHMIA));
        Level3Result hypertrophy = classifier.classifyLevel3(regularFast,
                Collections.singletonList(DiagnosisCategory.HYPERTROPHY));

        assertEquals(Diagnosis.SINUS_TACHYCARDIA, arrhythmia.getPrimaryDiagnosis().diagnosis);
        assertEquals(0.8, arrhythmia.getPrimaryDiagnosis().confidence);
        assertEquals(Diagnosis.LEFT_VENTRICULAR_HYPERTROPHY, hypertrophy.getPrimaryDiagnosis().diagnosis);
        assertEquals(0.75, hypertrophy.getPrimaryDiagnosis().confidence);
    }

    @Test
    void arrhythmiaCategoryWithoutMatchingRuleIsEmpty() {
        FeatureSet slowButVariable = features().put(FeatureSet.HEART_RATE, 80).put(FeatureSet.RR_STD, 250).build();

        ClassificationResult classification = classifier.execute("ECG-C4", slowButVariable).getValue();

        assertEquals(DiagnosisCategory.ARRHYTHMIA, classification.level2.category);
        assertTrue(classification.level3.isEmpty());
        assertEquals(ClinicalUrgency.LOW, classification.urgency);
    }

    // ===== URGENCY =====

    @Test
    void urgencyUsesRulePrecedenceNotListOrder() {
        List<DiagnosisFinding> findings = Arrays.asList(
                new DiagnosisFinding(Diagnosis.FIRST_DEGREE_AV_BLOCK, 0.85),
                new DiagnosisFinding(Diagnosis.SUPRAVENTRICULAR_TACHYCARDIA, 0.9),
                new DiagnosisFinding(Diagnosis.VENTRICULAR_FIBRILLATION, 0.5));

        assertEquals(ClinicalUrgency.CRITICAL, classifier.deriveUrgency(findings));
        assertEquals(ClinicalUrgency.HIGH, classifier.deriveUrgency(findings.subList(0, 2)));
        assertEquals(ClinicalUrgency.MEDIUM, classifier.deriveUrgency(findings.subList(0, 1)));
        assertEquals(ClinicalUrgency.LOW, classifier.deriveUrgency(Collections.<DiagnosisFinding>emptyList()));
    }

    @Test
    void tachyarrhythmiaNeedsConfidenceAboveThreshold() {
        assertEquals(ClinicalUrgency.LOW, classifier.deriveUrgency(Collections.singletonList(
                new DiagnosisFinding(Diagnosis.SINUS_TACHYCARDIA, 0.8))));
        assertEquals(ClinicalUrgency.MEDIUM, classifier.deriveUrgency(Collections.singletonList(
                new DiagnosisFinding(Diagnosis.ATRIAL_FIBRILLATION, 0.8))));
        assertEquals(ClinicalUrgency.HIGH, classifier.deriveUrgency(Collections.singletonList(
                new DiagnosisFinding(Diagnosis.ATRIAL_FIBRILLATION, 0.81))));
        assertEquals(ClinicalUrgency.CRITICAL, classifier.deriveUrgency(Collections.singletonList(
                new DiagnosisFinding(Diagnosis.VENTRICULAR_TACHYCARDIA, 0.3))));
    }

    @Test
    void urgencyOrderingHelpers() {
        assertTrue(ClinicalUrgency.CRITICAL.isAtLeast(ClinicalUrgency.HIGH));
        assertFalse(ClinicalUrgency.MEDIUM.isAtLeast(ClinicalUrgency.HIGH));
        assertTrue(ClinicalUrgency.HIGH.requiresNotification());
        assertFalse(ClinicalUrgency.MEDIUM.requiresNotification());
    }

    // ===== FAULT ISOLATION =====

    @Test
    void faultingLevelOneDoesNotStopLaterLevels() {
        ClassificationRules standard = ClassificationRules.standard();
        DecisionTable<FeatureSet, Level1Result> broken = DecisionTable.<FeatureSet, Level1Result>builder("level1")
                .rule("explodes", f -> {
                    throw new IllegalStateException("rule evaluation failed");
                }, Level1Result.conservativeDefault())
                .build();
        Map<DiagnosisCategory, DecisionTable<FeatureSet, DiagnosisFinding>> level3 =
                new EnumMap<>(DiagnosisCategory.class);
        for (DiagnosisCategory category : DiagnosisCategory.values()) {
            if (standard.getLevel3(category) != null) {
                level3.put(category, standard.getLevel3(category));
            }
        }
        HierarchicalClassifier partlyBroken = new HierarchicalClassifier(
                new ClassificationRules(broken, standard.getLevel2(), level3, standard.getUrgency()));

        FeatureSet features = features().flag(FeatureSet.ST_ELEVATION, true).build();
        StageResult<ClassificationResult> result = partlyBroken.execute("ECG-C5", features);

        assertFalse(result.isDegraded());
        assertEquals(Level1Result.conservativeDefault(), result.getValue().level1);
        assertEquals(DiagnosisCategory.ISCHEMIC_CHANGE, result.getValue().level2.category);
        assertEquals(ClinicalUrgency.CRITICAL, result.getValue().urgency);
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).startsWith("Level 1 classification degraded"));
    }

    @Test
    void missingFeaturesDegradeEachLevelToItsDefault() {
        StageResult<ClassificationResult> result = classifier.execute("ECG-C6", null);

        ClassificationResult classification = result.getValue();
        assertTrue(classification.level1.isNormal);
        assertEquals(DiagnosisCategory.NORMAL, classification.level2.category);
        assertTrue(classification.level3.isEmpty());
        assertEquals(ClinicalUrgency.LOW, classification.urgency);
        assertTrue(classification.screenings.isEmpty());
        assertEquals(3, result.getWarnings().size());
    }

    @Test
    void stageFallbackIsConservativeDefault() {
        ClassificationResult fallback = classifier.createFallback("ECG-C8", FeatureSet.defaults());

        assertEquals(ClassificationResult.conservativeDefault(), fallback);
        assertTrue(fallback.level1.isNormal);
        assertEquals(0.5, fallback.level2.confidence);
    }

    // ===== TABLE VALIDATION =====

    @Test
    void malformedTablesAreRejected() {
        assertThrows(ConfigurationException.class,
                () -> DecisionTable.<FeatureSet, Level1Result>builder("empty").build());
        assertThrows(ConfigurationException.class,
                () -> DecisionTable.<FeatureSet, Level1Result>builder("dupes")
                        .rule("a", f -> true, Level1Result.conservativeDefault())
                        .rule("a", f -> false, Level1Result.conservativeDefault())
                        .build());
        assertThrows(ConfigurationException.class,
                () -> DecisionTable.<FeatureSet, Level1Result>builder("incomplete")
                        .rule("no_outcome", f -> true, null)
                        .build());
        assertThrows(ConfigurationException.class,
                () -> DecisionTable.<FeatureSet, Level1Result>builder(" ")
                        .rule("a", f -> true, Level1Result.conservativeDefault())
                        .build());
    }

    @Test
    void levelThreeRuleInWrongCategoryTableIsRejected() {
        ClassificationRules standard = ClassificationRules.standard();
        Map<DiagnosisCategory, DecisionTable<FeatureSet, DiagnosisFinding>> level3 =
                new EnumMap<>(DiagnosisCategory.class);
        level3.put(DiagnosisCategory.HYPERTROPHY, DecisionTable.<FeatureSet, DiagnosisFinding>builder("misplaced")
                .rule("stemi", f -> true, new DiagnosisFinding(Diagnosis.STEMI, 0.9))
                .build());

        assertThrows(ConfigurationException.class, () -> new ClassificationRules(
                standard.getLevel1(), standard.getLevel2(), level3, standard.getUrgency()));
    }

    @Test
    void findingConfidenceMustBeAProbability() {
        assertThrows(IllegalArgumentException.class, () -> new DiagnosisFinding(Diagnosis.STEMI, 1.2));
        assertThrows(IllegalArgumentException.class, () -> new DiagnosisFinding(Diagnosis.STEMI, Double.NaN));
    }

    // ===== SCREENING =====

    @Test
    void screeningReportsAtrialFibrillationAndLongQt() {
        FeatureSet features = features()
                .put(FeatureSet.HEART_RATE, 60)
                .put(FeatureSet.RR_STD, 400)
                .put(FeatureSet.HRV_RMSSD, 120)
                .put(FeatureSet.SPECTRAL_ENTROPY, 0.9)
                .put(FeatureSet.QT_INTERVAL, 520)
                .build();

        ClassificationResult classification = classifier.execute("ECG-C7", features).getValue();

        assertEquals(2, classification.screenings.size());
        ScreeningFinding af = classification.screenings.get(0);
        ScreeningFinding longQt = classification.screenings.get(1);
        assertEquals(RhythmScreening.ATRIAL_FIBRILLATION, af.condition);
        assertEquals(1.0, af.score, 1e-12);
        assertTrue(af.isDetected());
        assertEquals(RhythmScreening.LONG_QT_SYNDROME, longQt.condition);
        assertEquals(0.6, longQt.score, 1e-9);
        assertTrue(longQt.isDetected());
        // screening never changes the cascade
        assertEquals(DiagnosisCategory.ARRHYTHMIA, classification.level2.category);
    }

    @Test
    void defaultFeaturesScreenNegative() {
        RhythmScreening screening = new RhythmScreening();

        assertEquals(0.0, screening.atrialFibrillationScore(FeatureSet.defaults()));
        assertEquals(0.0, screening.longQtScore(FeatureSet.defaults()));
    }
}
