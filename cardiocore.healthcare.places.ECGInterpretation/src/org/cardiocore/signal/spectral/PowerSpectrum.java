package org.cardiocore.signal.spectral;

/**
 * One-sided power spectral density estimate on a uniform frequency grid
 */
public final class PowerSpectrum {

    private final double[] frequencies;
    private final double[] power;

    PowerSpectrum(double[] frequencies, double[] power) {
        this.frequencies = frequencies;
        this.power = power;
    }

    public int size() {
        return power.length;
    }

    public double frequencyAt(int bin) {
        return frequencies[bin];
    }

    public double powerAt(int bin) {
        return power[bin];
    }

    public double totalPower() {
        double total = 0.0;
        for (double p : power) {
            total += p;
        }
        return total;
    }

    /**
     * Power in bins with lowHz <= f < highHz
     */
    public double bandPower(double lowHz, double highHz) {
        double sum = 0.0;
        for (int i = 0; i < power.length; i++) {
            if (frequencies[i] >= lowHz && frequencies[i] < highHz) {
                sum += power[i];
            }
        }
        return sum;
    }

    /**
     * Share of total power inside the band, 0 when the spectrum is empty
     */
    public double bandFraction(double lowHz, double highHz) {
        double total = totalPower();
        return total > 0 ? bandPower(lowHz, highHz) / total : 0.0;
    }

    /**
     * Frequency of the strongest bin inside the band, 0 when the band is empty
     */
    public double dominantFrequency(double lowHz, double highHz) {
        int best = -1;
        for (int i = 0; i < power.length; i++) {
            if (frequencies[i] >= lowHz && frequencies[i] <= highHz && (best < 0 || power[i] > power[best])) {
                best = i;
            }
        }
        return best < 0 ? 0.0 : frequencies[best];
    }

    /**
     * Shannon entropy of the normalized spectrum divided by log(bins), so a flat
     * spectrum scores 1 and a pure tone scores near 0.
     */
    public double normalizedEntropy() {
        double total = totalPower();
        if (total <= 0 || power.length < 2) {
            return 0.0;
        }
        double entropy = 0.0;
        for (double p : power) {
            double share = p / total;
            if (share > 0) {
                entropy -= share * Math.log(share);
            }
        }
        return entropy / Math.log(power.length);
    }
}
