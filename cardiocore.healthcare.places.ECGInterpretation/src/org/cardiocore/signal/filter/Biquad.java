package org.cardiocore.signal.filter;

/**
 * Second-order IIR section (audio-EQ cookbook designs), normalized so a0 = 1.
 * Instances are immutable; filtering state lives on the stack of {@link #apply}.
 */
public final class Biquad {

    private static final double BUTTERWORTH_Q = 1.0 / Math.sqrt(2.0);

    private final double b0, b1, b2, a1, a2;

    private Biquad(double b0, double b1, double b2, double a0, double a1, double a2) {
        this.b0 = b0 / a0;
        this.b1 = b1 / a0;
        this.b2 = b2 / a0;
        this.a1 = a1 / a0;
        this.a2 = a2 / a0;
    }

    public static Biquad lowpass(double sampleRate, double cutoffHz) {
        double w0 = 2 * Math.PI * cutoffHz / sampleRate;
        double alpha = Math.sin(w0) / (2 * BUTTERWORTH_Q);
        double cos = Math.cos(w0);
        return new Biquad((1 - cos) / 2, 1 - cos, (1 - cos) / 2, 1 + alpha, -2 * cos, 1 - alpha);
    }

    public static Biquad highpass(double sampleRate, double cutoffHz) {
        double w0 = 2 * Math.PI * cutoffHz / sampleRate;
        double alpha = Math.sin(w0) / (2 * BUTTERWORTH_Q);
        double cos = Math.cos(w0);
        return new Biquad((1 + cos) / 2, -(1 + cos), (1 + cos) / 2, 1 + alpha, -2 * cos, 1 - alpha);
    }

    public static Biquad notch(double sampleRate, double centerHz, double q) {
        double w0 = 2 * Math.PI * centerHz / sampleRate;
        double alpha = Math.sin(w0) / (2 * q);
        double cos = Math.cos(w0);
        return new Biquad(1, -2 * cos, 1, 1 + alpha, -2 * cos, 1 - alpha);
    }

    /**
     * Gain at 0 Hz
     */
    public double dcGain() {
        return (b0 + b1 + b2) / (1 + a1 + a2);
    }

    /**
     * Direct form II transposed. The state starts at the steady state for a
     * constant input equal to x[0], so a DC offset does not ring.
     */
    public double[] apply(double[] x) {
        double[] y = new double[x.length];
        if (x.length == 0) {
            return y;
        }
        double gain = dcGain();
        double z2 = (b2 - a2 * gain) * x[0];
        double z1 = (b1 - a1 * gain) * x[0] + z2;
        for (int n = 0; n < x.length; n++) {
            double in = x[n];
            double out = b0 * in + z1;
            z1 = b1 * in - a1 * out + z2;
            z2 = b2 * in - a2 * out;
            y[n] = out;
        }
        return y;
    }
}
