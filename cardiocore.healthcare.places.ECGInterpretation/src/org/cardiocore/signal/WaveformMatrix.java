package org.cardiocore.signal;

import java.util.Arrays;

/**
 * Immutable samples x leads amplitude matrix. Every lead has the same length.
 * Stages never mutate a matrix; {@link #withLead} returns a new one.
 */
public final class WaveformMatrix {

    private final double[][] leads;

    public WaveformMatrix(double[][] leads) {
        if (leads == null || leads.length == 0) {
            throw new IllegalArgumentException("A waveform needs at least one lead");
        }
        int length = leads[0].length;
        double[][] copy = new double[leads.length][];
        for (int i = 0; i < leads.length; i++) {
            if (leads[i].length != length) {
                throw new IllegalArgumentException(String.format(
                    "Lead %d has %d samples, expected %d", i, leads[i].length, length));
            }
            copy[i] = leads[i].clone();
        }
        this.leads = copy;
    }

    public int getLeadCount() {
        return leads.length;
    }

    public int getSampleCount() {
        return leads[0].length;
    }

    public double getSample(int lead, int index) {
        return leads[lead][index];
    }

    /**
     * Copy of one lead's samples
     */
    public double[] getLead(int lead) {
        return leads[lead].clone();
    }

    public double[][] toArray() {
        double[][] copy = new double[leads.length][];
        for (int i = 0; i < leads.length; i++) {
            copy[i] = leads[i].clone();
        }
        return copy;
    }

    public WaveformMatrix withLead(int lead, double[] samples) {
        double[][] copy = toArray();
        copy[lead] = samples;
        return new WaveformMatrix(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.deepEquals(leads, ((WaveformMatrix) o).leads);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(leads);
    }

    @Override
    public String toString() {
        return String.format("WaveformMatrix{leads=%d, samples=%d}", getLeadCount(), getSampleCount());
    }
}
