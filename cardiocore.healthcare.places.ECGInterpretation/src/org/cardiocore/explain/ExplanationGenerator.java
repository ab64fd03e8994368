package org.cardiocore.explain;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.cardiocore.base.BasePipelineStage;
import org.cardiocore.features.FeatureSet;

/**
 * Interpretability / Explanation Generator
 *
 * RESPONSIBILITY: turn features and the top prediction into a reviewable bundle
 *
 * ARCHITECTURAL CONTRACT:
 * - Text comes from {@link ClinicalKnowledgeBase} templates keyed by diagnosis family
 * - Feature importance uses fixed relative weights over {@link #EXPLAINED_FEATURES}
 * - Attention and attributions come from the configured {@link AttributionSource}
 * - Never fails the analysis; any fault yields the generic bundle at neutral confidence
 */
public class ExplanationGenerator extends BasePipelineStage<ExplanationRequest, ExplanationResult> {

    private static final Logger logger = Logger.getLogger(ExplanationGenerator.class);

    public static final String STAGE_NAME = "EXPLAINER";
    public static final double NEUTRAL_CONFIDENCE = 0.5;

    public static final List<String> EXPLAINED_FEATURES = Collections.unmodifiableList(Arrays.asList(
            FeatureSet.HEART_RATE, FeatureSet.RR_MEAN, FeatureSet.RR_STD, FeatureSet.RR_CV,
            FeatureSet.PR_INTERVAL, FeatureSet.QRS_DURATION, FeatureSet.QT_INTERVAL, FeatureSet.QTC));

    private final AttributionSource attributionSource;

    public ExplanationGenerator() {
        this(new RuleWeightAttributionSource());
    }

    public ExplanationGenerator(AttributionSource attributionSource) {
        super(STAGE_NAME);
        this.attributionSource = attributionSource;
    }

    @Override
    protected ExplanationResult processStageSpecific(String analysisId, ExplanationRequest request, List<String> warnings) {
        String diagnosis = request.primaryDiagnosis;
        double heartRate = request.features.get(FeatureSet.HEART_RATE);

        ExplanationResult result = ExplanationResult.builder()
                .clinicalExplanation(ClinicalKnowledgeBase.narrative(diagnosis, heartRate))
                .diagnosticCriteria(ClinicalKnowledgeBase.diagnosticCriteria(diagnosis))
                .riskFactors(ClinicalKnowledgeBase.riskFactors(diagnosis, heartRate))
                .recommendations(ClinicalKnowledgeBase.recommendations(diagnosis, request.confidence, request.urgency))
                .featureImportance(featureImportance(request.features))
                .attentionSequences(attributionSource.attentionSequences(request.signal))
                .attributions(attributionSource.getSourceName(),
                        attributionSource.attributions(request.features, EXPLAINED_FEATURES))
                .primaryDiagnosis(diagnosis, request.confidence)
                .build();

        logger.debug("Explanation built: " + result.getSummary());
        return result;
    }

    /**
     * Generic bundle used when explanation assembly faults.
     */
    @Override
    protected ExplanationResult createFallback(String analysisId, ExplanationRequest request) {
        Map<String, Double> importance = new LinkedHashMap<>();
        importance.put(FeatureSet.HEART_RATE, 0.3);
        importance.put(FeatureSet.QT_INTERVAL, 0.2);

        return ExplanationResult.builder()
                .clinicalExplanation("ECG analysis completed with standard interpretation")
                .diagnosticCriteria(Collections.singletonList("Standard ECG criteria applied"))
                .riskFactors(Collections.singletonList(ClinicalKnowledgeBase.BASELINE_RISK_FACTOR))
                .recommendations(Collections.singletonList(ClinicalKnowledgeBase.BASELINE_RECOMMENDATION))
                .featureImportance(importance)
                .primaryDiagnosis(request != null ? request.primaryDiagnosis : "Normal ECG", NEUTRAL_CONFIDENCE)
                .genericFallback(true)
                .build();
    }

    Map<String, Double> featureImportance(FeatureSet features) {
        Map<String, Double> importance = new LinkedHashMap<>();
        for (String name : EXPLAINED_FEATURES) {
            if (features.has(name)) {
                importance.put(name, importanceWeight(name));
            }
        }
        return importance;
    }

    private static double importanceWeight(String feature) {
        switch (feature) {
            case FeatureSet.HEART_RATE:
                return 0.3;
            case FeatureSet.QT_INTERVAL:
                return 0.2;
            case FeatureSet.PR_INTERVAL:
                return 0.15;
            default:
                return 0.1;
        }
    }
}
