package org.cardiocore.signal;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import org.cardiocore.config.PipelineSettings;

/**
 * Test fixture: beat trains built from Gaussian P, Q, R, S and T waves, in mV.
 *
 * Beat morphology relative to the R peak:
 * P -160 ms (0.12, 20 ms), Q -25 ms (-0.1, 8 ms), R 0 (1.0, 10 ms),
 * S +25 ms (-0.2, 8 ms), T +min(280 ms, 0.4 RR) (0.3, 40 ms).
 */
public final class SyntheticEcg {

    public static final double SAMPLE_RATE = 500.0;
    public static final double FIRST_BEAT_SECONDS = 0.4;

    private SyntheticEcg() {
    }

    public static PipelineSettings settings() {
        return PipelineSettings.load(PipelineSettings.DEFAULT_RESOURCE, new Properties());
    }

    /** Regular rhythm at the given rate. */
    public static double[] regularLead(double heartRate, double seconds, double scale) {
        return lead(new double[] { 60.0 / heartRate }, seconds, scale, 0.0);
    }

    /**
     * Beat train whose R-R intervals repeat the given cycle (seconds).
     * stElevation lifts the segment between the S wave and the T wave.
     */
    public static double[] lead(double[] rrCycle, double seconds, double scale, double stElevation) {
        int n = (int) Math.round(seconds * SAMPLE_RATE);
        double[] x = new double[n];
        double r = FIRST_BEAT_SECONDS;
        int beat = 0;
        while (r < seconds + 0.5) {
            double rr = rrCycle[beat % rrCycle.length];
            double tOffset = Math.min(0.28, 0.4 * rr);
            for (int i = 0; i < n; i++) {
                double t = i / SAMPLE_RATE - r;
                if (t < -0.4 || t > 0.6) {
                    continue;
                }
                double v = gauss(t, -0.160, 0.12, 0.020)
                        + gauss(t, -0.025, -0.10, 0.008)
                        + gauss(t, 0.0, 1.0, 0.010)
                        + gauss(t, 0.025, -0.20, 0.008)
                        + gauss(t, tOffset, 0.30, 0.040);
                if (stElevation != 0.0) {
                    v += stElevation * plateau(t, 0.040, tOffset);
                }
                x[i] += scale * v;
            }
            r += rr;
            beat++;
        }
        return x;
    }

    public static EcgSignal signal(double[][] leads, List<String> names) {
        AcquisitionMetadata metadata = AcquisitionMetadata.builder()
                .sampleRate(SAMPLE_RATE)
                .leadNames(names)
                .sampleCount(leads[0].length)
                .sourceFormat(WaveformFormat.CSV)
                .build();
        return new EcgSignal(new WaveformMatrix(leads), metadata);
    }

    public static EcgSignal regularSignal(double heartRate, double seconds, String... names) {
        double[][] leads = new double[names.length][];
        for (int i = 0; i < names.length; i++) {
            leads[i] = regularLead(heartRate, seconds, 1.0 - 0.1 * i);
        }
        return signal(leads, Arrays.asList(names));
    }

    public static String toCsv(double[][] leads, List<String> names) {
        StringBuilder csv = new StringBuilder();
        if (names != null) {
            csv.append(String.join(",", names)).append('\n');
        }
        for (int s = 0; s < leads[0].length; s++) {
            List<String> row = new ArrayList<>();
            for (double[] lead : leads) {
                row.add(String.format(Locale.ROOT, "%.6f", lead[s]));
            }
            csv.append(String.join(",", row)).append('\n');
        }
        return csv.toString();
    }

    public static byte[] csvBytes(double[][] leads, List<String> names) {
        return toCsv(leads, names).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Binary acquisition format with 1000 nV (1 uV) per count.
     */
    public static byte[] toBinary(double[][] leads, List<String> names, int sampleRate, int declaredSamples) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeBytes("ECG1");
            out.writeShort(1);
            out.writeShort(leads.length);
            out.writeInt(sampleRate);
            out.writeInt(declaredSamples);
            out.writeInt(1000);
            for (String name : names) {
                out.writeByte(name.length());
                out.writeBytes(name);
            }
            for (int s = 0; s < leads[0].length; s++) {
                for (double[] lead : leads) {
                    out.writeShort((int) Math.round(lead[s] * 1000.0));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    private static double gauss(double t, double center, double amplitude, double sigma) {
        double d = (t - center) / sigma;
        return amplitude * Math.exp(-0.5 * d * d);
    }

    /** Smooth step up at from and down at to, with 10 ms and 20 ms edges. */
    private static double plateau(double t, double from, double to) {
        return sigmoid((t - from) / 0.010) * sigmoid((to - t) / 0.020);
    }

    private static double sigmoid(double z) {
        return 1.0 / (1.0 + Math.exp(-z));
    }
}
