package org.cardiocore.signal.filter;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.cardiocore.base.StageResult;
import org.cardiocore.signal.AcquisitionMetadata;
import org.cardiocore.signal.EcgSignal;
import org.cardiocore.signal.SyntheticEcg;
import org.cardiocore.signal.WaveformFormat;
import org.cardiocore.signal.WaveformMatrix;
import org.cardiocore.utils.SignalMath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PreprocessorTest {

    private Preprocessor preprocessor;

    @BeforeEach
    void setUp() {
        preprocessor = new Preprocessor(SyntheticEcg.settings());
    }

    @Test
    void cleaningPreservesShapeAndKeepsRawWaveform() {
        EcgSignal signal = SyntheticEcg.regularSignal(72, 5.0, "I", "II", "V1");

        StageResult<EcgSignal> result = preprocessor.execute("ECG-T1", signal);

        EcgSignal cleaned = result.getValue();
        assertFalse(result.isDegraded());
        assertEquals(3, cleaned.waveform.getLeadCount());
        assertEquals(signal.waveform.getSampleCount(), cleaned.waveform.getSampleCount());
        assertEquals(signal.metadata, cleaned.metadata);
        assertArrayEquals(signal.waveform.getLead(1), cleaned.rawWaveform.getLead(1));
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void powerlineInterferenceIsSuppressed() {
        int n = 5000;
        double[] hum = new double[n];
        for (int i = 0; i < n; i++) {
            hum[i] = 0.5 * Math.sin(2 * Math.PI * 50.0 * i / SyntheticEcg.SAMPLE_RATE);
        }
        EcgSignal signal = SyntheticEcg.signal(new double[][] { hum }, Collections.singletonList("II"));

        double[] cleaned = preprocessor.execute("ECG-T2", signal).getValue().waveform.getLead(0);

        double[] middle = Arrays.copyOfRange(cleaned, 1000, 4000);
        assertTrue(SignalMath.std(middle) < 0.05, "residual hum std " + SignalMath.std(middle));
    }

    @Test
    void baselineOffsetIsRemoved() {
        double[] lead = SyntheticEcg.regularLead(60, 6.0, 1.0);
        for (int i = 0; i < lead.length; i++) {
            lead[i] += 2.0;
        }
        EcgSignal signal = SyntheticEcg.signal(new double[][] { lead }, Collections.singletonList("II"));

        double[] cleaned = preprocessor.execute("ECG-T3", signal).getValue().waveform.getLead(0);

        assertTrue(Math.abs(SignalMath.median(cleaned)) < 0.2);
    }

    @Test
    void nonFiniteLeadKeepsOriginalSamplesWithWarning() {
        double[] good = SyntheticEcg.regularLead(72, 3.0, 1.0);
        double[] broken = SyntheticEcg.regularLead(72, 3.0, 1.0);
        broken[700] = Double.NaN;
        EcgSignal signal = SyntheticEcg.signal(new double[][] { good, broken }, Arrays.asList("I", "II"));

        StageResult<EcgSignal> result = preprocessor.execute("ECG-T4", signal);

        assertFalse(result.isDegraded());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).startsWith("Lead II:"));
        double[] kept = result.getValue().waveform.getLead(1);
        assertTrue(Double.isNaN(kept[700]));
        assertEquals(broken[10], kept[10]);
        assertTrue(SignalMath.allFinite(result.getValue().waveform.getLead(0)));
    }

    @Test
    void lowSampleRateSkipsUnusableLowpass() {
        double sampleRate = 80.0;
        int n = (int) (sampleRate * 4);
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = Math.sin(2 * Math.PI * 1.2 * i / sampleRate);
        }
        AcquisitionMetadata metadata = AcquisitionMetadata.builder()
                .sampleRate(sampleRate)
                .leadNames(Collections.singletonList("II"))
                .sampleCount(n)
                .sourceFormat(WaveformFormat.CSV)
                .build();

        StageResult<EcgSignal> result = preprocessor.execute("ECG-T5",
                new EcgSignal(new WaveformMatrix(new double[][] { x }), metadata));

        assertFalse(result.isDegraded());
        assertTrue(result.getWarnings().stream().anyMatch(w -> w.startsWith("Low-pass cutoff")));
    }

    @Test
    void fallbackIsTheInputSignal() {
        EcgSignal signal = SyntheticEcg.regularSignal(72, 2.0, "II");
        assertSame(signal, preprocessor.createFallback("ECG-T6", signal));
    }
}
