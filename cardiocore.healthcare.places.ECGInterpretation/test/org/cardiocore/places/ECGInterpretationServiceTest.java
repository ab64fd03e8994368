package org.cardiocore.places;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.log4j.MDC;
import org.cardiocore.classifier.ClinicalUrgency;
import org.cardiocore.classifier.Diagnosis;
import org.cardiocore.classifier.DiagnosisCategory;
import org.cardiocore.classifier.HierarchicalClassifier;
import org.cardiocore.classifier.Level1Result;
import org.cardiocore.exceptions.AnalysisCancelledException;
import org.cardiocore.exceptions.DecodeException;
import org.cardiocore.explain.ExplanationGenerator;
import org.cardiocore.features.FeatureSet;
import org.cardiocore.handlers.CancellationToken;
import org.cardiocore.json.JsonValidator;
import org.cardiocore.logger.PipelineEventLogger;
import org.cardiocore.signal.MetadataHint;
import org.cardiocore.signal.SyntheticEcg;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ECGInterpretationServiceTest {

    private static final List<String> LEADS = Arrays.asList("I", "II", "V5");
    private static final double[] IRREGULAR_CYCLE = { 0.26, 0.42, 0.28, 0.40, 0.305 };

    private ECGInterpretationService service;

    @BeforeEach
    void setUp() {
        service = new ECGInterpretationService(SyntheticEcg.settings());
    }

    private static MetadataHint hint(String analysisId) {
        return MetadataHint.builder().analysisId(analysisId).sampleRate(SyntheticEcg.SAMPLE_RATE).build();
    }

    private static byte[] regularCsv() {
        double[][] leads = {
            SyntheticEcg.regularLead(72, 10.0, 1.0),
            SyntheticEcg.regularLead(72, 10.0, 0.9),
            SyntheticEcg.regularLead(72, 10.0, 0.8)
        };
        return SyntheticEcg.csvBytes(leads, LEADS);
    }

    private static byte[] irregularFastCsv() {
        double[][] leads = {
            SyntheticEcg.lead(IRREGULAR_CYCLE, 10.0, 1.0, 0.0),
            SyntheticEcg.lead(IRREGULAR_CYCLE, 10.0, 0.9, 0.0),
            SyntheticEcg.lead(IRREGULAR_CYCLE, 10.0, 0.8, 0.0)
        };
        return SyntheticEcg.csvBytes(leads, LEADS);
    }

    // ===== END TO END =====

    @Test
    void normalRecordingIsLowUrgencyNormalEcg() throws Exception {
        AnalysisRecord record = service.analyze(regularCsv(), hint("ECG-S1"));

        assertEquals("ECG-S1", record.analysisId);
        assertTrue(record.classification.level1.isNormal);
        assertEquals(DiagnosisCategory.NORMAL, record.classification.level2.category);
        assertEquals(ClinicalUrgency.LOW, record.getUrgency());
        assertFalse(record.requiresNotification());
        assertEquals("Normal ECG", record.explanation.primaryDiagnosis);
        assertEquals(72.0, record.features.get(FeatureSet.HEART_RATE), 2.0);
        assertEquals(12, record.beatAnnotations.size());
        assertTrue(record.quality.overallScore > 0.9);
        assertEquals(record.explanation.confidence, record.qualityAdjustedConfidence, 1e-12);
    }

    @Test
    void fastIrregularRecordingIsAtrialFibrillationWithHighUrgency() throws Exception {
        AnalysisRecord record = service.analyze(irregularFastCsv(), hint("ECG-S2"));

        assertEquals(DiagnosisCategory.ARRHYTHMIA, record.classification.level2.category);
        assertEquals(Diagnosis.ATRIAL_FIBRILLATION, record.classification.getPrimaryDiagnosis().diagnosis);
        assertEquals(ClinicalUrgency.HIGH, record.getUrgency());
        assertTrue(record.requiresNotification());
        assertFalse(record.requiresImmediateAttention());
        assertEquals("Atrial Fibrillation", record.explanation.primaryDiagnosis);
    }

    @Test
    void sameInputAndIdGiveIdenticalRecords() throws Exception {
        byte[] data = regularCsv();

        String first = service.analyze(data, hint("ECG-S3")).toJson();
        String second = service.analyze(data, hint("ECG-S3")).toJson();

        assertEquals(first, second);
    }

    @Test
    void recordRendersAsValidJson() throws Exception {
        String json = service.analyze(regularCsv(), hint("ECG-S4")).toJson();

        assertTrue(JsonValidator.isValidJson(json));
        Map<?, ?> parsed = JsonValidator.parseObject(json);
        assertEquals("ECG-S4", parsed.get("analysis_id"));
        assertEquals("COMPLETED", parsed.get("status"));
        assertEquals("LOW", parsed.get("clinical_urgency"));
        assertTrue(parsed.containsKey("explanation"));
        assertTrue(parsed.containsKey("annotations"));
    }

    @Test
    void generatedIdWhenHintHasNone() throws Exception {
        AnalysisRecord record = service.analyze(regularCsv(), MetadataHint.builder().sampleRate(500.0).build());

        assertTrue(record.analysisId.startsWith(ECGInterpretationService.ANALYSIS_ID_PREFIX));
        assertNull(MDC.get(PipelineEventLogger.MDC_ANALYSIS_ID));
    }

    @Test
    void missingHintRunsWithDefaults() throws Exception {
        AnalysisRecord record = service.analyze(regularCsv(), null);

        assertTrue(record.analysisId.startsWith(ECGInterpretationService.ANALYSIS_ID_PREFIX));
        assertEquals(500.0, record.metadata.sampleRate);
        assertEquals(ClinicalUrgency.LOW, record.getUrgency());
    }

    @Test
    void analyzesFromPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("resting.csv");
        Files.write(file, regularCsv());

        AnalysisRecord record = service.analyze(file, hint("ECG-S5"));

        assertEquals(3, record.metadata.getLeadCount());
        assertEquals(ClinicalUrgency.LOW, record.getUrgency());
    }

    // ===== DEGRADATION =====

    @Test
    void poorQualityRecordingReducesConfidenceWithWarning() throws Exception {
        double[][] leads = {
            SyntheticEcg.regularLead(72, 10.0, 1.0),
            new double[5000],
            new double[5000]
        };

        AnalysisRecord record = service.analyze(SyntheticEcg.csvBytes(leads, LEADS), hint("ECG-S6"));

        assertTrue(record.quality.overallScore < 0.5);
        assertTrue(record.warnings.contains(ECGInterpretationService.LOW_QUALITY_WARNING));
        double expected = record.explanation.confidence * (0.5 + record.quality.overallScore);
        assertEquals(expected, record.qualityAdjustedConfidence, 1e-12);
        assertTrue(record.qualityAdjustedConfidence < record.explanation.confidence);
    }

    // ===== FAILURES =====

    @Test
    void emptyInputFailsBeforeAnyStageRuns() {
        long stagesBefore = PipelineEventLogger.getInstance().getEventCount("STAGE_START");

        DecodeException e = assertThrows(DecodeException.class, () -> service.analyze(new byte[0],
                MetadataHint.builder().analysisId("ECG-S7").format("csv").build()));

        assertEquals(DecodeException.Kind.MALFORMED_HEADER, e.getKind());
        assertEquals(stagesBefore, PipelineEventLogger.getInstance().getEventCount("STAGE_START"));
        assertNull(MDC.get(PipelineEventLogger.MDC_ANALYSIS_ID));
    }

    @Test
    void cancelledTokenStopsBeforeLoading() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        AnalysisCancelledException e = assertThrows(AnalysisCancelledException.class,
                () -> service.analyze(regularCsv(), hint("ECG-S8"), token));

        assertEquals("ECG-S8", e.getAnalysisId());
        assertEquals("LOADER", e.getStageName());
    }

    @Test
    void cancellationDuringClassificationStopsAtNextBoundary() {
        CancellationToken token = new CancellationToken();
        HierarchicalClassifier cancelling = new HierarchicalClassifier() {
            @Override
            public Level1Result classifyLevel1(FeatureSet features) {
                token.cancel();
                return super.classifyLevel1(features);
            }
        };
        ECGInterpretationService cancellable = new ECGInterpretationService(SyntheticEcg.settings(), cancelling,
                new ExplanationGenerator());

        AnalysisCancelledException e = assertThrows(AnalysisCancelledException.class,
                () -> cancellable.analyze(regularCsv(), hint("ECG-S9"), token));

        assertEquals(ExplanationGenerator.STAGE_NAME, e.getStageName());
    }
}
