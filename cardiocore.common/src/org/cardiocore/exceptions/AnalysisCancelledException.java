package org.cardiocore.exceptions;

/**
 * Raised at a stage boundary when the caller cancelled the analysis.
 */
public class AnalysisCancelledException extends ServiceProcessingException {

    public AnalysisCancelledException(String analysisId, String nextStage) {
        super("Analysis cancelled before stage " + nextStage, nextStage, analysisId, "CANCELLED");
    }
}
