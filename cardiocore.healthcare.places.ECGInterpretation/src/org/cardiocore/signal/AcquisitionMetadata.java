package org.cardiocore.signal;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.cardiocore.base.PipelineArtifact;

/**
 * Acquisition metadata for one recording: sample rate, ordered distinct lead
 * names and derived duration, plus whatever device header the source carried.
 */
public final class AcquisitionMetadata implements PipelineArtifact {

    public static final List<String> STANDARD_12_LEADS = Collections.unmodifiableList(Arrays.asList(
        "I", "II", "III", "aVR", "aVL", "aVF", "V1", "V2", "V3", "V4", "V5", "V6"));

    public final double sampleRate;
    public final List<String> leadNames;
    public final int sampleCount;
    public final double durationSeconds;
    public final WaveformFormat sourceFormat;
    public final String amplitudeUnit;
    public final String acquisitionDate;
    public final String deviceManufacturer;
    public final String deviceModel;
    public final String deviceSerial;

    private AcquisitionMetadata(Builder builder) {
        if (!(builder.sampleRate > 0) || Double.isInfinite(builder.sampleRate)) {
            throw new IllegalArgumentException("Sample rate must be positive: " + builder.sampleRate);
        }
        Objects.requireNonNull(builder.leadNames, "leadNames cannot be null");
        if (new HashSet<>(builder.leadNames).size() != builder.leadNames.size()) {
            throw new IllegalArgumentException("Lead names must be distinct: " + builder.leadNames);
        }
        this.sampleRate = builder.sampleRate;
        this.leadNames = Collections.unmodifiableList(new ArrayList<>(builder.leadNames));
        this.sampleCount = builder.sampleCount;
        this.durationSeconds = builder.sampleCount / builder.sampleRate;
        this.sourceFormat = Objects.requireNonNull(builder.sourceFormat, "sourceFormat cannot be null");
        this.amplitudeUnit = builder.amplitudeUnit;
        this.acquisitionDate = builder.acquisitionDate;
        this.deviceManufacturer = builder.deviceManufacturer;
        this.deviceModel = builder.deviceModel;
        this.deviceSerial = builder.deviceSerial;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getLeadCount() {
        return leadNames.size();
    }

    public int indexOfLead(String name) {
        return leadNames.indexOf(name);
    }

    @Override
    public Map<String, Object> toJsonFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("sample_rate", sampleRate);
        fields.put("lead_names", leadNames);
        fields.put("sample_count", sampleCount);
        fields.put("duration_seconds", durationSeconds);
        fields.put("source_format", sourceFormat);
        fields.put("amplitude_unit", amplitudeUnit);
        if (acquisitionDate != null) fields.put("acquisition_date", acquisitionDate);
        if (deviceManufacturer != null) fields.put("device_manufacturer", deviceManufacturer);
        if (deviceModel != null) fields.put("device_model", deviceModel);
        if (deviceSerial != null) fields.put("device_serial", deviceSerial);
        return fields;
    }

    @Override
    public String getSummary() {
        return String.format("%d leads @ %.1f Hz, %.2f s (%s)", getLeadCount(), sampleRate, durationSeconds, sourceFormat);
    }

    @Override
    public String toString() {
        return "AcquisitionMetadata{" + getSummary() + ", leads=" + leadNames + "}";
    }

    public static class Builder {
        private double sampleRate;
        private List<String> leadNames;
        private int sampleCount;
        private WaveformFormat sourceFormat;
        private String amplitudeUnit = "mV";
        private String acquisitionDate;
        private String deviceManufacturer;
        private String deviceModel;
        private String deviceSerial;

        public Builder sampleRate(double sampleRate) {
            this.sampleRate = sampleRate;
            return this;
        }

        public Builder leadNames(List<String> leadNames) {
            this.leadNames = leadNames;
            return this;
        }

        public Builder sampleCount(int sampleCount) {
            this.sampleCount = sampleCount;
            return this;
        }

        public Builder sourceFormat(WaveformFormat sourceFormat) {
            this.sourceFormat = sourceFormat;
            return this;
        }

        public Builder amplitudeUnit(String amplitudeUnit) {
            this.amplitudeUnit = amplitudeUnit;
            return this;
        }

        public Builder acquisitionDate(String acquisitionDate) {
            this.acquisitionDate = acquisitionDate;
            return this;
        }

        public Builder device(String manufacturer, String model, String serial) {
            this.deviceManufacturer = manufacturer;
            this.deviceModel = model;
            this.deviceSerial = serial;
            return this;
        }

        public AcquisitionMetadata build() {
            return new AcquisitionMetadata(this);
        }
    }
}
