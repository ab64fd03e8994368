package org.cardiocore.signal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.cardiocore.exceptions.JsonParsingException;
import org.cardiocore.json.JsonValidator;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Caller-supplied hints accompanying raw signal bytes. Every field is optional;
 * values found in the signal's own header take precedence over hints.
 *
 * JSON form:
 * <pre>
 * {"analysis_id":"A-17","format":"csv","sample_rate":500,"lead_names":["I","II"],"file_name":"rest.csv"}
 * </pre>
 */
public final class MetadataHint {

    public static final MetadataHint EMPTY = builder().build();

    public final String analysisId;
    public final String format;
    public final Double sampleRate;
    public final List<String> leadNames;
    public final String fileName;

    private MetadataHint(Builder builder) {
        this.analysisId = builder.analysisId;
        this.format = builder.format;
        this.sampleRate = builder.sampleRate;
        this.leadNames = builder.leadNames == null ? null
            : Collections.unmodifiableList(new ArrayList<>(builder.leadNames));
        this.fileName = builder.fileName;
    }

    /** Callers may pass null for "no hints". */
    public static MetadataHint orEmpty(MetadataHint hint) {
        return hint == null ? EMPTY : hint;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MetadataHint fromJson(String json) throws JsonParsingException {
        JSONObject object = JsonValidator.parseObject(json);
        Builder builder = builder();
        try {
            builder.analysisId((String) object.get("analysis_id"));
            builder.format((String) object.get("format"));
            builder.fileName((String) object.get("file_name"));

            Object rate = object.get("sample_rate");
            if (rate != null) {
                builder.sampleRate(((Number) rate).doubleValue());
            }
            Object names = object.get("lead_names");
            if (names != null) {
                List<String> leadNames = new ArrayList<>();
                for (Object name : (JSONArray) names) {
                    leadNames.add((String) name);
                }
                builder.leadNames(leadNames);
            }
        } catch (ClassCastException e) {
            throw new JsonParsingException("Metadata hint field has the wrong type: " + e.getMessage(), e, json, -1);
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return String.format("MetadataHint{analysisId=%s, format=%s, sampleRate=%s, leads=%s, file=%s}",
            analysisId, format, sampleRate, leadNames, fileName);
    }

    public static class Builder {
        private String analysisId;
        private String format;
        private Double sampleRate;
        private List<String> leadNames;
        private String fileName;

        public Builder analysisId(String analysisId) {
            this.analysisId = analysisId;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder sampleRate(Double sampleRate) {
            this.sampleRate = sampleRate;
            return this;
        }

        public Builder leadNames(List<String> leadNames) {
            this.leadNames = leadNames;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public MetadataHint build() {
            return new MetadataHint(this);
        }
    }
}
