package org.cardiocore.explain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.cardiocore.base.PipelineArtifact;
import org.cardiocore.json.JsonRecordBuilder;

/**
 * Explanation bundle for the reporting layer.
 */
public final class ExplanationResult implements PipelineArtifact {

    public final String clinicalExplanation;
    public final List<String> diagnosticCriteria;
    public final List<String> riskFactors;
    public final List<String> recommendations;
    public final Map<String, Double> featureImportance;
    public final String primaryDiagnosis;
    public final double confidence;
    public final List<AttributionBlock> attributions;
    public final String attributionSource;
    public final boolean genericFallback;
    private final Map<String, double[]> attentionSequences;

    private ExplanationResult(Builder builder) {
        this.clinicalExplanation = Objects.requireNonNull(builder.clinicalExplanation, "clinicalExplanation");
        this.diagnosticCriteria = Collections.unmodifiableList(new ArrayList<>(builder.diagnosticCriteria));
        this.riskFactors = Collections.unmodifiableList(new ArrayList<>(builder.riskFactors));
        this.recommendations = Collections.unmodifiableList(new ArrayList<>(builder.recommendations));
        this.featureImportance = Collections.unmodifiableMap(new LinkedHashMap<>(builder.featureImportance));
        Map<String, double[]> attention = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : builder.attentionSequences.entrySet()) {
            attention.put(entry.getKey(), entry.getValue().clone());
        }
        this.attentionSequences = attention;
        this.primaryDiagnosis = Objects.requireNonNull(builder.primaryDiagnosis, "primaryDiagnosis");
        this.confidence = builder.confidence;
        this.attributions = Collections.unmodifiableList(new ArrayList<>(builder.attributions));
        this.attributionSource = builder.attributionSource;
        this.genericFallback = builder.genericFallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Copy of the attention sequence for one lead, or null when the lead is unknown. */
    public double[] getAttentionSequence(String lead) {
        double[] sequence = attentionSequences.get(lead);
        return sequence == null ? null : sequence.clone();
    }

    public List<String> getAttentionLeads() {
        return Collections.unmodifiableList(new ArrayList<>(attentionSequences.keySet()));
    }

    @Override
    public Map<String, Object> toJsonFields() {
        return new JsonRecordBuilder()
                .put("clinical_explanation", clinicalExplanation)
                .put("diagnostic_criteria", diagnosticCriteria)
                .put("risk_factors", riskFactors)
                .put("recommendations", recommendations)
                .put("feature_importance", featureImportance)
                .put("attention_maps", attentionSequences)
                .put("primary_diagnosis", primaryDiagnosis)
                .put("confidence", confidence)
                .put("attribution_source", attributionSource)
                .put("attributions", attributions)
                .build();
    }

    @Override
    public String getSummary() {
        return String.format("%s (%.2f)%s", primaryDiagnosis, confidence, genericFallback ? " [generic]" : "");
    }

    @Override
    public String toString() {
        return "ExplanationResult{" + getSummary() + "}";
    }

    public static class Builder {
        private String clinicalExplanation;
        private List<String> diagnosticCriteria = Collections.emptyList();
        private List<String> riskFactors = Collections.emptyList();
        private List<String> recommendations = Collections.emptyList();
        private Map<String, Double> featureImportance = Collections.emptyMap();
        private Map<String, double[]> attentionSequences = Collections.emptyMap();
        private String primaryDiagnosis;
        private double confidence;
        private List<AttributionBlock> attributions = Collections.emptyList();
        private String attributionSource;
        private boolean genericFallback;

        public Builder clinicalExplanation(String text) {
            this.clinicalExplanation = text;
            return this;
        }

        public Builder diagnosticCriteria(List<String> criteria) {
            this.diagnosticCriteria = criteria;
            return this;
        }

        public Builder riskFactors(List<String> factors) {
            this.riskFactors = factors;
            return this;
        }

        public Builder recommendations(List<String> recommendations) {
            this.recommendations = recommendations;
            return this;
        }

        public Builder featureImportance(Map<String, Double> importance) {
            this.featureImportance = importance;
            return this;
        }

        public Builder attentionSequences(Map<String, double[]> sequences) {
            this.attentionSequences = sequences;
            return this;
        }

        public Builder primaryDiagnosis(String diagnosis, double confidence) {
            this.primaryDiagnosis = diagnosis;
            this.confidence = confidence;
            return this;
        }

        public Builder attributions(String source, List<AttributionBlock> blocks) {
            this.attributionSource = source;
            this.attributions = blocks;
            return this;
        }

        public Builder genericFallback(boolean generic) {
            this.genericFallback = generic;
            return this;
        }

        public ExplanationResult build() {
            return new ExplanationResult(this);
        }
    }
}
