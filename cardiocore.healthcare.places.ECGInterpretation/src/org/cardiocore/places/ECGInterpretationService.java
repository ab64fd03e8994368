package org.cardiocore.places;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.cardiocore.base.StageResult;
import org.cardiocore.classifier.ClassificationResult;
import org.cardiocore.classifier.HierarchicalClassifier;
import org.cardiocore.config.PipelineSettings;
import org.cardiocore.exceptions.AnalysisCancelledException;
import org.cardiocore.exceptions.DecodeException;
import org.cardiocore.explain.ExplanationGenerator;
import org.cardiocore.explain.ExplanationRequest;
import org.cardiocore.explain.ExplanationResult;
import org.cardiocore.features.BeatAnnotation;
import org.cardiocore.features.FeatureExtractor;
import org.cardiocore.features.FeatureSet;
import org.cardiocore.handlers.CancellationToken;
import org.cardiocore.logger.PipelineEventLogger;
import org.cardiocore.quality.AssessedSignal;
import org.cardiocore.quality.QualityReport;
import org.cardiocore.quality.SignalQualityAnalyzer;
import org.cardiocore.signal.EcgSignal;
import org.cardiocore.signal.MetadataHint;
import org.cardiocore.signal.SignalLoader;
import org.cardiocore.signal.filter.Preprocessor;
import org.cardiocore.utils.SequenceUtils;

/**
 * ECGInterpretationService - THE ORCHESTRATOR
 *
 * RESPONSIBILITY: run one analysis end to end and assemble its AnalysisRecord
 *
 * ARCHITECTURAL CONTRACT:
 * - Stages run strictly in order: Loader, Preprocessor, Quality, Features,
 *   Classifier, Explainer. Each stage's only input is the previous output
 * - One analysis id is threaded through every stage and bound to the log4j MDC
 * - Only a {@link DecodeException} from the Loader fails the analysis; every
 *   other stage degrades to its default and reports a warning
 * - Cancellation is honored between stages, never inside one
 * - Holds no per-analysis state; one instance serves concurrent analyses
 */
public class ECGInterpretationService {

    private static final Logger logger = Logger.getLogger(ECGInterpretationService.class);

    public static final String ANALYSIS_ID_PREFIX = "ECG";
    public static final String LOW_QUALITY_WARNING = "Low signal quality reduces diagnostic confidence";
    private static final double LOW_QUALITY_SCORE = 0.5;

    // ===== STAGES =====

    private final SignalLoader loader;
    private final Preprocessor preprocessor;
    private final SignalQualityAnalyzer qualityAnalyzer;
    private final FeatureExtractor featureExtractor;
    private final HierarchicalClassifier classifier;
    private final ExplanationGenerator explanationGenerator;
    private final PipelineEventLogger eventLogger;

    // ===== CONSTRUCTORS =====

    public ECGInterpretationService() {
        this(PipelineSettings.load());
    }

    public ECGInterpretationService(PipelineSettings settings) {
        this(settings, new HierarchicalClassifier(), new ExplanationGenerator());
    }

    public ECGInterpretationService(PipelineSettings settings, HierarchicalClassifier classifier,
            ExplanationGenerator explanationGenerator) {
        this.loader = new SignalLoader(settings);
        this.preprocessor = new Preprocessor(settings);
        this.qualityAnalyzer = new SignalQualityAnalyzer(settings);
        this.featureExtractor = new FeatureExtractor(settings);
        this.classifier = classifier;
        this.explanationGenerator = explanationGenerator;
        this.eventLogger = PipelineEventLogger.getInstance();
        logger.info("=== ECG INTERPRETATION SERVICE READY ===");
    }

    // ===== PUBLIC API =====

    public AnalysisRecord analyze(byte[] data, MetadataHint hint) throws DecodeException {
        try {
            return analyze(data, hint, new CancellationToken());
        } catch (AnalysisCancelledException e) {
            // a fresh token is never cancelled
            throw new IllegalStateException(e);
        }
    }

    public AnalysisRecord analyze(Path path, MetadataHint hint) throws DecodeException {
        try {
            return analyze(path, hint, new CancellationToken());
        } catch (AnalysisCancelledException e) {
            throw new IllegalStateException(e);
        }
    }

    public AnalysisRecord analyze(Path path, MetadataHint hint, CancellationToken token)
            throws DecodeException, AnalysisCancelledException {
        String analysisId = resolveAnalysisId(hint);
        eventLogger.logAnalysisStarted(analysisId, path.toString());
        try {
            checkpoint(token, analysisId, SignalLoader.STAGE_NAME);
            return runPipeline(analysisId, loader.load(path, hint), token);
        } catch (DecodeException | AnalysisCancelledException e) {
            eventLogger.logAnalysisFailed(analysisId, e);
            throw e;
        } finally {
            eventLogger.clearAnalysisContext();
        }
    }

    /**
     * Main entry point. A null hint runs the analysis with no hints.
     *
     * @throws DecodeException the input could not be decoded; no other stage ran
     * @throws AnalysisCancelledException the token was cancelled before a stage started
     */
    public AnalysisRecord analyze(byte[] data, MetadataHint hint, CancellationToken token)
            throws DecodeException, AnalysisCancelledException {
        String analysisId = resolveAnalysisId(hint);
        eventLogger.logAnalysisStarted(analysisId, data.length + " bytes");
        try {
            checkpoint(token, analysisId, SignalLoader.STAGE_NAME);
            return runPipeline(analysisId, loader.load(data, hint), token);
        } catch (DecodeException | AnalysisCancelledException e) {
            eventLogger.logAnalysisFailed(analysisId, e);
            throw e;
        } finally {
            eventLogger.clearAnalysisContext();
        }
    }

    // ===== PIPELINE =====

    private AnalysisRecord runPipeline(String analysisId, StageResult<EcgSignal> loaded, CancellationToken token)
            throws AnalysisCancelledException {
        List<String> warnings = new ArrayList<>(loaded.warnings);

        checkpoint(token, analysisId, preprocessor.getStageName());
        StageResult<EcgSignal> cleaned = preprocessor.execute(analysisId, loaded.value);
        warnings.addAll(cleaned.warnings);
        EcgSignal signal = cleaned.value;

        checkpoint(token, analysisId, qualityAnalyzer.getStageName());
        StageResult<QualityReport> quality = qualityAnalyzer.execute(analysisId, signal);
        warnings.addAll(quality.warnings);

        checkpoint(token, analysisId, featureExtractor.getStageName());
        StageResult<FeatureSet> features = featureExtractor.execute(analysisId, new AssessedSignal(signal, quality.value));
        warnings.addAll(features.warnings);

        checkpoint(token, analysisId, classifier.getStageName());
        StageResult<ClassificationResult> classification = classifier.execute(analysisId, features.value);
        warnings.addAll(classification.warnings);

        checkpoint(token, analysisId, explanationGenerator.getStageName());
        ExplanationRequest request = ExplanationRequest.of(signal, features.value, classification.value);
        StageResult<ExplanationResult> explanation = explanationGenerator.execute(analysisId, request);
        warnings.addAll(explanation.warnings);

        double overallQuality = quality.value.overallScore;
        double adjustedConfidence = request.confidence * Math.min(1.0, 0.5 + overallQuality);
        if (overallQuality < LOW_QUALITY_SCORE) {
            warnings.add(LOW_QUALITY_WARNING);
        }

        AnalysisRecord record = new AnalysisRecord(analysisId, signal.metadata, quality.value, features.value,
                classification.value, explanation.value, adjustedConfidence,
                annotate(signal, features.value), warnings);

        eventLogger.logAnalysisCompleted(analysisId, record.getUrgency().name(), warnings.size());
        return record;
    }

    private void checkpoint(CancellationToken token, String analysisId, String nextStage)
            throws AnalysisCancelledException {
        if (token.isCancelled()) {
            logger.info("Analysis " + analysisId + " cancelled before " + nextStage);
            throw new AnalysisCancelledException(analysisId, nextStage);
        }
    }

    private static List<BeatAnnotation> annotate(EcgSignal signal, FeatureSet features) {
        String lead = features.getAnalysisLead();
        int index = lead == null ? -1 : signal.metadata.indexOfLead(lead);
        if (index < 0) {
            return Collections.emptyList();
        }
        return BeatAnnotation.fromPeaks(features.getRPeakIndices(), signal.waveform.getLead(index),
                signal.getSampleRate());
    }

    private static String resolveAnalysisId(MetadataHint hint) {
        if (hint != null && hint.analysisId != null && !hint.analysisId.trim().isEmpty()) {
            return hint.analysisId;
        }
        return SequenceUtils.generateAnalysisId(ANALYSIS_ID_PREFIX);
    }
}
