package org.cardiocore.exceptions;

/**
 * Non-fatal stage failure. The stage that raises it substitutes its documented
 * default and the analysis continues with a warning.
 */
public class StageDegradationException extends ServiceProcessingException {

    public StageDegradationException(String stageName, String analysisId, String message) {
        super(message, stageName, analysisId, "STAGE_DEGRADED");
    }

    public StageDegradationException(String stageName, String analysisId, String message, Throwable cause) {
        super(message, cause, stageName, analysisId, "STAGE_DEGRADED");
    }
}
