package org.cardiocore.signal.decoder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw decoder output before validation: lead-major samples plus whatever header
 * values the encoding carries. Absent header values are null.
 */
public class DecodedWaveform {

    public final double[][] leads;
    public final List<String> leadNames;
    public final Double sampleRate;
    public final String acquisitionDate;
    public final String deviceManufacturer;
    public final String deviceModel;
    public final String deviceSerial;

    public DecodedWaveform(double[][] leads, List<String> leadNames, Double sampleRate) {
        this(leads, leadNames, sampleRate, null, null, null, null);
    }

    public DecodedWaveform(double[][] leads, List<String> leadNames, Double sampleRate, String acquisitionDate,
            String deviceManufacturer, String deviceModel, String deviceSerial) {
        this.leads = leads;
        this.leadNames = leadNames == null ? null : Collections.unmodifiableList(new ArrayList<>(leadNames));
        this.sampleRate = sampleRate;
        this.acquisitionDate = acquisitionDate;
        this.deviceManufacturer = deviceManufacturer;
        this.deviceModel = deviceModel;
        this.deviceSerial = deviceSerial;
    }

    public int getLeadCount() {
        return leads.length;
    }

    /**
     * Transpose sample-major rows into lead-major arrays
     */
    static double[][] toLeadMajor(List<double[]> rows, int leadCount) {
        double[][] leads = new double[leadCount][rows.size()];
        for (int s = 0; s < rows.size(); s++) {
            double[] row = rows.get(s);
            for (int l = 0; l < leadCount; l++) {
                leads[l][s] = row[l];
            }
        }
        return leads;
    }
}
