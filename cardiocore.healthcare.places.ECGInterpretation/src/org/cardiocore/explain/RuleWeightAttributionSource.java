package org.cardiocore.explain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.cardiocore.features.FeatureSet;
import org.cardiocore.signal.EcgSignal;

/**
 * Fixed-weight placeholder attributions. Weights do not depend on the input;
 * they stand in until a model-backed source exists.
 *
 * - "shap": heart_rate 0.1, others 0.05, base value 0.5
 * - "lime": heart_rate 0.5, pr_interval 0.3, others 0.1
 * - attention: the same five-point bump on every lead
 */
public class RuleWeightAttributionSource implements AttributionSource {

    public static final String SOURCE_NAME = "rule_weights";

    private static final double[] ATTENTION_PROFILE = { 0.1, 0.2, 0.3, 0.2, 0.1 };

    @Override
    public String getSourceName() {
        return SOURCE_NAME;
    }

    @Override
    public Map<String, double[]> attentionSequences(EcgSignal signal) {
        Map<String, double[]> sequences = new LinkedHashMap<>();
        for (int lead = 0; lead < signal.metadata.getLeadCount(); lead++) {
            sequences.put(signal.getLeadName(lead), ATTENTION_PROFILE.clone());
        }
        return sequences;
    }

    @Override
    public List<AttributionBlock> attributions(FeatureSet features, List<String> featureNames) {
        List<AttributionBlock.Contribution> shap = new ArrayList<>();
        List<AttributionBlock.Contribution> lime = new ArrayList<>();
        for (String name : featureNames) {
            if (!features.has(name)) {
                continue;
            }
            double value = features.get(name);
            shap.add(new AttributionBlock.Contribution(name, value, FeatureSet.HEART_RATE.equals(name) ? 0.1 : 0.05));
            lime.add(new AttributionBlock.Contribution(name, value, limeWeight(name)));
        }
        List<AttributionBlock> blocks = new ArrayList<>();
        blocks.add(new AttributionBlock("shap", 0.5, shap));
        blocks.add(new AttributionBlock("lime", null, lime));
        return blocks;
    }

    private static double limeWeight(String feature) {
        if (FeatureSet.HEART_RATE.equals(feature)) {
            return 0.5;
        }
        if (FeatureSet.PR_INTERVAL.equals(feature)) {
            return 0.3;
        }
        return 0.1;
    }
}
