package org.cardiocore.signal;

import java.util.Objects;

/**
 * A waveform together with its acquisition metadata.
 *
 * The preprocessor hands on the cleaned waveform and keeps a reference to the
 * unfiltered one, so quality scoring can still see the artifacts filtering hides.
 * Both matrices are immutable.
 */
public final class EcgSignal {

    public final WaveformMatrix waveform;
    public final WaveformMatrix rawWaveform;
    public final AcquisitionMetadata metadata;

    public EcgSignal(WaveformMatrix waveform, AcquisitionMetadata metadata) {
        this(waveform, waveform, metadata);
    }

    private EcgSignal(WaveformMatrix waveform, WaveformMatrix rawWaveform, AcquisitionMetadata metadata) {
        this.waveform = Objects.requireNonNull(waveform, "waveform cannot be null");
        this.rawWaveform = Objects.requireNonNull(rawWaveform, "rawWaveform cannot be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata cannot be null");
        if (waveform.getLeadCount() != metadata.getLeadCount()) {
            throw new IllegalArgumentException("Lead count " + waveform.getLeadCount()
                + " does not match metadata " + metadata.leadNames);
        }
    }

    /**
     * Same recording with a processed waveform; the raw waveform is carried over.
     */
    public EcgSignal withCleanedWaveform(WaveformMatrix cleaned) {
        if (cleaned.getLeadCount() != waveform.getLeadCount() || cleaned.getSampleCount() != waveform.getSampleCount()) {
            throw new IllegalArgumentException("Processing must preserve the waveform shape");
        }
        return new EcgSignal(cleaned, rawWaveform, metadata);
    }

    public double getSampleRate() {
        return metadata.sampleRate;
    }

    public String getLeadName(int lead) {
        return metadata.leadNames.get(lead);
    }

    @Override
    public String toString() {
        return "EcgSignal{" + metadata.getSummary() + "}";
    }
}
