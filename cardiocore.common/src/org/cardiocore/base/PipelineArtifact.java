package org.cardiocore.base;

import java.util.Map;

/**
 * Base interface for every immutable value a pipeline stage hands on to the
 * analysis record (quality report, features, classification, explanation).
 */
public interface PipelineArtifact {

    /**
     * Ordered field map used when the record is rendered as JSON.
     * Values are strings, numbers, booleans, lists, maps or nested artifacts.
     */
    Map<String, Object> toJsonFields();

    /**
     * Get a brief summary of the artifact for logging
     */
    String getSummary();
}
