package org.cardiocore.exceptions;

/**
 * Raised by the signal loader when raw input cannot be turned into a waveform.
 * This is the only pipeline failure that aborts an analysis.
 */
public class DecodeException extends ServiceProcessingException {

    public enum Kind {
        MALFORMED_HEADER,
        TRUNCATED_DATA,
        UNSUPPORTED_FORMAT
    }

    private final Kind kind;

    public DecodeException(Kind kind, String message) {
        super(message, "LOADER", null, "DECODE_" + kind.name());
        this.kind = kind;
    }

    public DecodeException(Kind kind, String message, Throwable cause) {
        super(message, cause, "LOADER", null, "DECODE_" + kind.name());
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Get detailed error message for logging
     */
    public String getDetailedErrorMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Decode error (").append(kind).append("): ").append(getMessage());
        if (getCause() != null) {
            sb.append(" | Caused by: ").append(getCause().getMessage());
        }
        return sb.toString();
    }
}
