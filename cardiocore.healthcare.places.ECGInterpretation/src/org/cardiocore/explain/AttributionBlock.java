package org.cardiocore.explain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.cardiocore.base.PipelineArtifact;
import org.cardiocore.json.JsonRecordBuilder;

/**
 * Per-feature value and weight from one attribution method, kept for the audit trail.
 */
public final class AttributionBlock implements PipelineArtifact {

    public final String method;
    public final Double baseValue;
    public final List<Contribution> contributions;

    public AttributionBlock(String method, Double baseValue, List<Contribution> contributions) {
        this.method = Objects.requireNonNull(method, "method");
        this.baseValue = baseValue;
        this.contributions = Collections.unmodifiableList(new ArrayList<>(contributions));
    }

    public Contribution getContribution(String feature) {
        for (Contribution contribution : contributions) {
            if (contribution.feature.equals(feature)) {
                return contribution;
            }
        }
        return null;
    }

    @Override
    public Map<String, Object> toJsonFields() {
        List<Map<String, Object>> features = new ArrayList<>();
        for (Contribution contribution : contributions) {
            features.add(new JsonRecordBuilder()
                    .put("feature", contribution.feature)
                    .put("value", contribution.value)
                    .put("weight", contribution.weight)
                    .build());
        }
        return new JsonRecordBuilder()
                .put("method", method)
                .putIfNotNull("base_value", baseValue)
                .put("features", features)
                .build();
    }

    @Override
    public String getSummary() {
        return method + " over " + contributions.size() + " features";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributionBlock)) return false;
        AttributionBlock other = (AttributionBlock) o;
        return method.equals(other.method) && Objects.equals(baseValue, other.baseValue)
                && contributions.equals(other.contributions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, baseValue, contributions);
    }

    @Override
    public String toString() {
        return "AttributionBlock{" + getSummary() + "}";
    }

    public static final class Contribution {
        public final String feature;
        public final double value;
        public final double weight;

        public Contribution(String feature, double value, double weight) {
            this.feature = Objects.requireNonNull(feature, "feature");
            this.value = value;
            this.weight = weight;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Contribution)) return false;
            Contribution other = (Contribution) o;
            return feature.equals(other.feature) && Double.compare(value, other.value) == 0
                    && Double.compare(weight, other.weight) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(feature, value, weight);
        }

        @Override
        public String toString() {
            return feature + "=" + value + " (w=" + weight + ")";
        }
    }
}
