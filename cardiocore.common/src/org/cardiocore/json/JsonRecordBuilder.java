package org.cardiocore.json;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.cardiocore.base.PipelineArtifact;
import org.json.simple.JSONValue;

/**
 * Ordered JSON record builder
 *
 * Builds the JSON form of analysis records handed to the persistence,
 * notification and reporting collaborators. Field order is insertion order,
 * so the same record always renders to the same bytes.
 *
 * Accepted values:
 * - String, Boolean, Number (non-finite doubles render as null)
 * - enums (rendered by name)
 * - {@link PipelineArtifact} (rendered through toJsonFields())
 * - nested builders, maps, collections and double[]
 */
public class JsonRecordBuilder {

    private final Map<String, Object> fields = new LinkedHashMap<>();

    // ========== Builder Methods ==========

    public JsonRecordBuilder put(String key, Object value) {
        fields.put(key, normalize(value));
        return this;
    }

    public JsonRecordBuilder putIfNotNull(String key, Object value) {
        if (value != null) {
            put(key, value);
        }
        return this;
    }

    public JsonRecordBuilder putAll(Map<String, ?> values) {
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            put(entry.getKey(), entry.getValue());
        }
        return this;
    }

    public Map<String, Object> build() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String toJson() {
        return JSONValue.toJSONString(fields);
    }

    // ========== Static Helpers ==========

    /**
     * Create a minimal error record for a failed analysis
     */
    public static String createErrorRecord(String analysisId, String errorCode, String message) {
        return new JsonRecordBuilder()
                .put("analysis_id", analysisId)
                .put("status", "FAILED")
                .put("error_code", errorCode)
                .put("error", message)
                .toJson();
    }

    public static String toJson(PipelineArtifact artifact) {
        return new JsonRecordBuilder().putAll(artifact.toJsonFields()).toJson();
    }

    @SuppressWarnings("unchecked")
    private static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? Double.valueOf(d) : null;
        }
        if (value instanceof Number) {
            return value;
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        if (value instanceof PipelineArtifact) {
            return normalize(((PipelineArtifact) value).toJsonFields());
        }
        if (value instanceof JsonRecordBuilder) {
            return new LinkedHashMap<>(((JsonRecordBuilder) value).fields);
        }
        if (value instanceof Map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                nested.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
            }
            return nested;
        }
        if (value instanceof Collection) {
            List<Object> items = new ArrayList<>();
            for (Object item : (Collection<Object>) value) {
                items.add(normalize(item));
            }
            return items;
        }
        if (value instanceof double[]) {
            List<Object> items = new ArrayList<>();
            for (double d : (double[]) value) {
                items.add(normalize(d));
            }
            return items;
        }
        return value.toString();
    }
}
