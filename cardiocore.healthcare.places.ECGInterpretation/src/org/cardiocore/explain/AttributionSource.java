package org.cardiocore.explain;

import java.util.List;
import java.util.Map;

import org.cardiocore.features.FeatureSet;
import org.cardiocore.signal.EcgSignal;

/**
 * Supplies attention sequences and feature attributions to the
 * {@link ExplanationGenerator}. A trained model can be plugged in here
 * without changing how the explanation bundle is assembled.
 *
 * Implementations must be thread-safe.
 */
public interface AttributionSource {

    String getSourceName();

    /**
     * One attention sequence per lead of the signal, keyed by lead name in lead order.
     */
    Map<String, double[]> attentionSequences(EcgSignal signal);

    /**
     * Attribution blocks over the given features, in the given order.
     * Features missing from the set are skipped.
     */
    List<AttributionBlock> attributions(FeatureSet features, List<String> featureNames);
}
