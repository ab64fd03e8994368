package org.cardiocore.explain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.cardiocore.classifier.ClinicalUrgency;

/**
 * Narrative, criteria, risk-factor and recommendation templates.
 * Static reference data, shared read-only.
 */
public final class ClinicalKnowledgeBase {

    public static final String BASELINE_RISK_FACTOR = "Age-related factors considered";
    public static final String BASELINE_RECOMMENDATION = "Continue monitoring as clinically indicated";
    public static final String LOW_CONFIDENCE_RECOMMENDATION = "Seek additional clinical correlation";
    public static final String CRITICAL_RECOMMENDATION = "Immediate medical attention required";

    public static final double LOW_CONFIDENCE = 0.7;
    public static final double HEMODYNAMIC_RISK_HEART_RATE = 120.0;

    private static final Map<DiagnosisFamily, String> NARRATIVES = new EnumMap<>(DiagnosisFamily.class);
    private static final Map<DiagnosisFamily, List<String>> CRITERIA = new EnumMap<>(DiagnosisFamily.class);

    static {
        NARRATIVES.put(DiagnosisFamily.TACHYCARDIA,
                "ECG analysis shows %s with heart rate of %d bpm, indicating rapid cardiac rhythm requiring clinical attention.");
        NARRATIVES.put(DiagnosisFamily.BRADYCARDIA,
                "ECG analysis shows %s with heart rate of %d bpm, indicating slow cardiac rhythm that may require monitoring.");
        NARRATIVES.put(DiagnosisFamily.FIBRILLATION,
                "ECG analysis shows %s, indicating irregular cardiac rhythm with potential thromboembolic risk.");
        NARRATIVES.put(DiagnosisFamily.DEFAULT,
                "ECG analysis shows %s with heart rate of %d bpm within expected parameters.");

        CRITERIA.put(DiagnosisFamily.TACHYCARDIA,
                list("Heart rate > 100 bpm", "Regular rhythm pattern", "Normal QRS morphology"));
        CRITERIA.put(DiagnosisFamily.BRADYCARDIA,
                list("Heart rate < 60 bpm", "Regular rhythm pattern", "Normal P-wave morphology"));
        CRITERIA.put(DiagnosisFamily.FIBRILLATION,
                list("Irregular R-R intervals", "Absence of P waves", "Fibrillatory waves present"));
        CRITERIA.put(DiagnosisFamily.DEFAULT,
                list("Standard ECG criteria applied", "Normal rhythm parameters", "Within reference ranges"));
    }

    private ClinicalKnowledgeBase() {
    }

    public static String narrative(String diagnosis, double heartRate) {
        DiagnosisFamily family = DiagnosisFamily.of(diagnosis);
        String template = NARRATIVES.get(family);
        if (family == DiagnosisFamily.FIBRILLATION) {
            return String.format(Locale.ROOT, template, diagnosis);
        }
        return String.format(Locale.ROOT, template, diagnosis, Math.round(heartRate));
    }

    public static List<String> diagnosticCriteria(String diagnosis) {
        return CRITERIA.get(DiagnosisFamily.of(diagnosis));
    }

    public static List<String> riskFactors(String diagnosis, double heartRate) {
        List<String> factors = new ArrayList<>();
        factors.add(BASELINE_RISK_FACTOR);
        if (DiagnosisFamily.of(diagnosis) == DiagnosisFamily.FIBRILLATION) {
            factors.add("Thromboembolic risk");
            factors.add("Stroke risk assessment needed");
        }
        if (heartRate > HEMODYNAMIC_RISK_HEART_RATE) {
            factors.add("Hemodynamic compromise risk");
        }
        return factors;
    }

    public static List<String> recommendations(String diagnosis, double confidence, ClinicalUrgency urgency) {
        List<String> recommendations = new ArrayList<>();
        if (urgency == ClinicalUrgency.CRITICAL) {
            recommendations.add(CRITICAL_RECOMMENDATION);
        }
        recommendations.add(BASELINE_RECOMMENDATION);
        if (confidence < LOW_CONFIDENCE) {
            recommendations.add(LOW_CONFIDENCE_RECOMMENDATION);
        }
        if (DiagnosisFamily.of(diagnosis) == DiagnosisFamily.FIBRILLATION) {
            recommendations.add("Anticoagulation assessment recommended");
            recommendations.add("Cardiology consultation advised");
        }
        return recommendations;
    }

    private static List<String> list(String... items) {
        return Collections.unmodifiableList(Arrays.asList(items));
    }
}
