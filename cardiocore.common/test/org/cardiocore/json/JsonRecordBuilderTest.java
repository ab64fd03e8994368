package org.cardiocore.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.cardiocore.base.PipelineArtifact;
import org.cardiocore.exceptions.JsonParsingException;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.junit.jupiter.api.Test;

class JsonRecordBuilderTest {

    private enum Level { LOW, HIGH }

    private static final PipelineArtifact ARTIFACT = new PipelineArtifact() {
        @Override
        public Map<String, Object> toJsonFields() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("score", 0.75);
            fields.put("level", Level.HIGH);
            return fields;
        }

        @Override
        public String getSummary() {
            return "test artifact";
        }
    };

    @Test
    void keepsInsertionOrder() {
        String json = new JsonRecordBuilder()
                .put("zeta", 1)
                .put("alpha", 2)
                .put("mid", 3)
                .toJson();

        assertEquals("{\"zeta\":1,\"alpha\":2,\"mid\":3}", json);
    }

    @Test
    void normalizesEnumsArtifactsArraysAndNonFiniteNumbers() throws JsonParsingException {
        String json = new JsonRecordBuilder()
                .put("urgency", Level.LOW)
                .put("artifact", ARTIFACT)
                .put("samples", new double[] { 1.5, Double.NaN })
                .put("ratio", Double.POSITIVE_INFINITY)
                .put("items", Arrays.asList("a", "b"))
                .putIfNotNull("absent", null)
                .toJson();

        JSONObject parsed = JsonValidator.parseObject(json);
        assertEquals("LOW", parsed.get("urgency"));
        assertEquals("HIGH", ((JSONObject) parsed.get("artifact")).get("level"));
        JSONArray samples = (JSONArray) parsed.get("samples");
        assertEquals(1.5, samples.get(0));
        assertNull(samples.get(1));
        assertTrue(parsed.containsKey("ratio"));
        assertNull(parsed.get("ratio"));
        assertFalse(parsed.containsKey("absent"));
    }

    @Test
    void sameContentRendersIdentically() {
        String first = JsonRecordBuilder.toJson(ARTIFACT);
        String second = JsonRecordBuilder.toJson(ARTIFACT);
        assertEquals(first, second);
    }

    @Test
    void errorRecordCarriesCodeAndMessage() {
        String json = JsonRecordBuilder.createErrorRecord("ECG_1", "DECODE_TRUNCATED_DATA", "short");
        assertTrue(JsonValidator.hasRequiredFields(json, "analysis_id", "status", "error_code", "error"));
    }

    @Test
    void validatorRejectsMalformedJson() {
        assertFalse(JsonValidator.isValidJson("{\"open\": "));
        assertFalse(JsonValidator.isValidJson(""));
        JsonParsingException e = assertThrows(JsonParsingException.class,
                () -> JsonValidator.parseObject("[1, 2]"));
        assertTrue(e.getMessage().contains("object"));
    }
}
