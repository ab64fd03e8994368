package org.cardiocore.exceptions;

/**
 * Base exception for all pipeline processing errors.
 * Carries the stage that raised it, the analysis it belongs to and a stable error code.
 */
public class ServiceProcessingException extends Exception {

    private final String stageName;
    private final String analysisId;
    private final String errorCode;

    public ServiceProcessingException(String message, String stageName, String analysisId, String errorCode) {
        super(message);
        this.stageName = stageName;
        this.analysisId = analysisId;
        this.errorCode = errorCode;
    }

    public ServiceProcessingException(String message, Throwable cause, String stageName, String analysisId, String errorCode) {
        super(message, cause);
        this.stageName = stageName;
        this.analysisId = analysisId;
        this.errorCode = errorCode;
    }

    public ServiceProcessingException(String message) {
        this(message, null, null, "GENERAL_ERROR");
    }

    public ServiceProcessingException(String message, Throwable cause) {
        this(message, cause, null, null, "GENERAL_ERROR");
    }

    // Getters
    public String getStageName() {
        return stageName;
    }

    public String getAnalysisId() {
        return analysisId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        if (stageName != null) {
            sb.append(" [").append(stageName);
            if (analysisId != null) {
                sb.append(":").append(analysisId);
            }
            if (errorCode != null) {
                sb.append(" - ").append(errorCode);
            }
            sb.append("]");
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
