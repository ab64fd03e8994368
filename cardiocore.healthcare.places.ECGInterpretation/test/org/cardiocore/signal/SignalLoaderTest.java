package org.cardiocore.signal;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.cardiocore.base.StageResult;
import org.cardiocore.exceptions.DecodeException;
import org.cardiocore.exceptions.JsonParsingException;
import org.cardiocore.signal.decoder.BinaryWaveformDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SignalLoaderTest {

    private static final List<String> LIMB_LEADS = Arrays.asList("I", "II", "III");

    private SignalLoader loader;

    @BeforeEach
    void setUp() {
        loader = new SignalLoader(SyntheticEcg.settings());
    }

    private static double[][] threeLeads(double seconds) {
        return new double[][] {
            SyntheticEcg.regularLead(72, seconds, 1.0),
            SyntheticEcg.regularLead(72, seconds, 0.9),
            SyntheticEcg.regularLead(72, seconds, 0.8)
        };
    }

    private static MetadataHint hint(String format, Double sampleRate) {
        return MetadataHint.builder().format(format).sampleRate(sampleRate).build();
    }

    /** Fixed 20-byte binary header with no lead table or samples. */
    private static byte[] binaryHeader(int leadCount, int sampleCount) {
        ByteBuffer header = ByteBuffer.allocate(BinaryWaveformDecoder.FIXED_HEADER_BYTES);
        header.put("ECG1".getBytes(StandardCharsets.US_ASCII));
        header.putShort((short) 1);
        header.putShort((short) leadCount);
        header.putInt(500);
        header.putInt(sampleCount);
        header.putInt(1000);
        return header.array();
    }

    // ===== FORMATS =====

    @Test
    void csvWithHeaderKeepsLeadNamesAndShape() throws Exception {
        double[][] leads = threeLeads(2.0);
        StageResult<EcgSignal> result = loader.load(SyntheticEcg.csvBytes(leads, LIMB_LEADS), hint(null, 500.0));

        EcgSignal signal = result.getValue();
        assertEquals(LIMB_LEADS, signal.metadata.leadNames);
        assertEquals(3, signal.waveform.getLeadCount());
        assertEquals(1000, signal.waveform.getSampleCount());
        assertEquals(WaveformFormat.CSV, signal.metadata.sourceFormat);
        assertEquals(2.0, signal.metadata.durationSeconds, 1e-9);
        assertEquals(leads[1][250], signal.waveform.getSample(1, 250), 1e-6);
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void headerlessCsvWithoutHintGetsGenericNamesAndDefaultRateWarning() throws Exception {
        byte[] csv = SyntheticEcg.csvBytes(threeLeads(2.0), null);

        StageResult<EcgSignal> result = loader.load(csv, MetadataHint.EMPTY);

        assertEquals(Arrays.asList("Lead_1", "Lead_2", "Lead_3"), result.getValue().metadata.leadNames);
        assertEquals(500.0, result.getValue().getSampleRate());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).startsWith("Sample rate not declared"));
    }

    @Test
    void hintedLeadNamesApplyWhenCountMatches() throws Exception {
        byte[] csv = SyntheticEcg.csvBytes(threeLeads(2.0), null);
        MetadataHint hint = MetadataHint.builder().sampleRate(500.0).leadNames(Arrays.asList("V1", "V2", "V3")).build();

        EcgSignal signal = loader.load(csv, hint).getValue();

        assertEquals(Arrays.asList("V1", "V2", "V3"), signal.metadata.leadNames);
    }

    @Test
    void textFormatIsSniffedFromWhitespaceRows() throws Exception {
        StringBuilder text = new StringBuilder("# exported rhythm strip\n");
        double[] lead = SyntheticEcg.regularLead(60, 1.5, 1.0);
        for (double v : lead) {
            text.append(v).append(' ').append(-v).append('\n');
        }

        EcgSignal signal = loader.load(text.toString().getBytes(StandardCharsets.UTF_8), hint(null, 500.0)).getValue();

        assertEquals(WaveformFormat.TEXT, signal.metadata.sourceFormat);
        assertEquals(2, signal.waveform.getLeadCount());
        assertEquals(-lead[100], signal.waveform.getSample(1, 100), 1e-12);
    }

    @Test
    void singleColumnExportWithLeadLabelKeepsTheLabel() throws Exception {
        double[] lead = SyntheticEcg.regularLead(72, 2.0, 1.0);
        byte[] data = SyntheticEcg.csvBytes(new double[][] { lead }, Arrays.asList("II"));

        EcgSignal signal = loader.load(data, hint(null, 500.0)).getValue();

        assertEquals(Arrays.asList("II"), signal.metadata.leadNames);
        assertEquals(lead.length, signal.waveform.getSampleCount());
        assertEquals(lead[10], signal.waveform.getSample(0, 10), 1e-6);
    }

    @Test
    void xmlCarriesRateNamesAndDevice() throws Exception {
        double[] lead = SyntheticEcg.regularLead(60, 1.2, 1.0);
        StringBuilder samples = new StringBuilder();
        for (double v : lead) {
            samples.append(v).append(' ');
        }
        String xml = "<ecg><sampleRate>500</sampleRate><acquisitionDate>2024-03-01T10:15:00</acquisitionDate>"
                + "<device><manufacturer>Acme</manufacturer><model>R12</model><serialNumber>SN-7</serialNumber></device>"
                + "<waveform><lead name=\"II\">" + samples + "</lead><lead name=\"V5\">" + samples + "</lead></waveform></ecg>";

        EcgSignal signal = loader.load(xml.getBytes(StandardCharsets.UTF_8), MetadataHint.EMPTY).getValue();

        assertEquals(WaveformFormat.XML, signal.metadata.sourceFormat);
        assertEquals(Arrays.asList("II", "V5"), signal.metadata.leadNames);
        assertEquals(500.0, signal.getSampleRate());
        assertEquals("Acme", signal.metadata.deviceManufacturer);
        assertEquals("2024-03-01T10:15:00", signal.metadata.acquisitionDate);
    }

    @Test
    void binaryHeaderRateWinsOverHint() throws Exception {
        double[][] leads = threeLeads(2.0);
        byte[] data = SyntheticEcg.toBinary(leads, LIMB_LEADS, 500, leads[0].length);

        StageResult<EcgSignal> result = loader.load(data, hint(null, 250.0));

        EcgSignal signal = result.getValue();
        assertEquals(WaveformFormat.PROPRIETARY, signal.metadata.sourceFormat);
        assertEquals(500.0, signal.getSampleRate());
        assertEquals(LIMB_LEADS, signal.metadata.leadNames);
        assertEquals(Math.round(leads[0][200] * 1000.0) / 1000.0, signal.waveform.getSample(0, 200), 1e-9);
    }

    @Test
    void loadsFromPathUsingFileExtension(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("strip.csv");
        Files.write(file, SyntheticEcg.csvBytes(threeLeads(2.0), LIMB_LEADS));

        EcgSignal signal = loader.load(file, hint(null, 500.0)).getValue();

        assertEquals(WaveformFormat.CSV, signal.metadata.sourceFormat);
        assertEquals(3, signal.metadata.getLeadCount());
    }

    // ===== FAILURES =====

    @Test
    void emptyCsvIsMalformedHeader() {
        DecodeException e = assertThrows(DecodeException.class,
                () -> loader.load(new byte[0], hint("csv", null)));
        assertEquals(DecodeException.Kind.MALFORMED_HEADER, e.getKind());
    }

    @Test
    void headerOnlyCsvIsTruncated() {
        byte[] csv = "I,II,III\n".getBytes(StandardCharsets.UTF_8);
        DecodeException e = assertThrows(DecodeException.class, () -> loader.load(csv, hint("csv", 500.0)));
        assertEquals(DecodeException.Kind.TRUNCATED_DATA, e.getKind());
    }

    @Test
    void duplicateLeadNamesAreMalformed() {
        byte[] csv = SyntheticEcg.csvBytes(threeLeads(2.0), Arrays.asList("I", "II", "I"));
        DecodeException e = assertThrows(DecodeException.class, () -> loader.load(csv, hint(null, 500.0)));
        assertEquals(DecodeException.Kind.MALFORMED_HEADER, e.getKind());
    }

    @Test
    void recordingShorterThanMinimumIsTruncated() {
        byte[] csv = SyntheticEcg.csvBytes(threeLeads(0.5), LIMB_LEADS);
        DecodeException e = assertThrows(DecodeException.class, () -> loader.load(csv, hint(null, 500.0)));
        assertEquals(DecodeException.Kind.TRUNCATED_DATA, e.getKind());
    }

    @Test
    void raggedCsvRowIsTruncated() {
        byte[] csv = "I,II\n0.1,0.2\n0.3\n".getBytes(StandardCharsets.UTF_8);
        DecodeException e = assertThrows(DecodeException.class, () -> loader.load(csv, hint(null, 500.0)));
        assertEquals(DecodeException.Kind.TRUNCATED_DATA, e.getKind());
    }

    @Test
    void shortBinarySampleBlockIsTruncated() {
        double[][] leads = threeLeads(2.0);
        byte[] data = SyntheticEcg.toBinary(leads, LIMB_LEADS, 500, leads[0].length + 100);

        DecodeException e = assertThrows(DecodeException.class, () -> loader.load(data, MetadataHint.EMPTY));
        assertEquals(DecodeException.Kind.TRUNCATED_DATA, e.getKind());
    }

    @Test
    void binaryHeaderWithoutLeadsIsMalformed() {
        byte[] data = binaryHeader(0, 0xFFFFFFFF);

        DecodeException e = assertThrows(DecodeException.class, () -> loader.load(data, MetadataHint.EMPTY));
        assertEquals(DecodeException.Kind.MALFORMED_HEADER, e.getKind());
    }

    @Test
    void binarySampleCountBeyondArrayRangeIsMalformed() {
        byte[] data = binaryHeader(1, 0x80000000);

        DecodeException e = assertThrows(DecodeException.class, () -> loader.load(data, MetadataHint.EMPTY));
        assertEquals(DecodeException.Kind.MALFORMED_HEADER, e.getKind());
    }

    @Test
    void declaredBinaryWithoutSignatureIsUnsupported() {
        byte[] csv = SyntheticEcg.csvBytes(threeLeads(2.0), LIMB_LEADS);
        DecodeException e = assertThrows(DecodeException.class, () -> loader.load(csv, hint("proprietary", null)));
        assertEquals(DecodeException.Kind.UNSUPPORTED_FORMAT, e.getKind());
    }

    @Test
    void unknownDeclaredFormatIsUnsupported() {
        DecodeException e = assertThrows(DecodeException.class,
                () -> loader.load(new byte[] { 1, 2, 3 }, hint("edf", null)));
        assertEquals(DecodeException.Kind.UNSUPPORTED_FORMAT, e.getKind());
    }

    @Test
    void nonNumericSampleIsReported() {
        byte[] csv = "I,II\n0.1,0.2\n0.3,abc\n".getBytes(StandardCharsets.UTF_8);
        assertThrows(DecodeException.class, () -> loader.load(csv, hint(null, 500.0)));
    }

    // ===== METADATA HINTS =====

    @Test
    void missingHintBehavesLikeEmptyHint() throws Exception {
        byte[] csv = SyntheticEcg.csvBytes(threeLeads(2.0), LIMB_LEADS);

        StageResult<EcgSignal> result = loader.load(csv, null);

        assertEquals(LIMB_LEADS, result.getValue().metadata.leadNames);
        assertEquals(500.0, result.getValue().getSampleRate());
        assertEquals(1, result.getWarnings().size());
    }

    @Test
    void hintParsesFromJson() throws Exception {
        MetadataHint hint = MetadataHint.fromJson(
                "{\"analysis_id\":\"ECG-42\",\"format\":\"csv\",\"sample_rate\":360,\"lead_names\":[\"I\",\"II\"]}");

        assertEquals("ECG-42", hint.analysisId);
        assertEquals("csv", hint.format);
        assertEquals(360.0, hint.sampleRate);
        assertEquals(Arrays.asList("I", "II"), hint.leadNames);
        assertNull(hint.fileName);
    }

    @Test
    void hintWithWrongFieldTypeIsRejected() {
        assertThrows(JsonParsingException.class, () -> MetadataHint.fromJson("{\"sample_rate\":\"fast\"}"));
    }

    @Test
    void loadedLeadsAreCopies() throws Exception {
        double[][] leads = threeLeads(2.0);
        EcgSignal signal = loader.load(SyntheticEcg.csvBytes(leads, LIMB_LEADS), hint(null, 500.0)).getValue();

        double[] copy = signal.waveform.getLead(0);
        copy[0] = 99.0;

        assertFalse(signal.waveform.getSample(0, 0) == 99.0);
        assertArrayEquals(signal.waveform.getLead(2), signal.waveform.toArray()[2]);
    }
}
