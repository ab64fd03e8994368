package org.cardiocore.exceptions;

/**
 * Raised when caller-supplied JSON (metadata hints) cannot be parsed
 */
public class JsonParsingException extends ServiceProcessingException {

    private final String invalidJson;
    private final int errorPosition;

    public JsonParsingException(String message, String invalidJson) {
        this(message, null, invalidJson, -1);
    }

    public JsonParsingException(String message, Throwable cause, String invalidJson, int errorPosition) {
        super(message, cause, null, null, "JSON_PARSE_ERROR");
        this.invalidJson = invalidJson;
        this.errorPosition = errorPosition;
    }

    public String getInvalidJson() {
        return invalidJson;
    }

    public int getErrorPosition() {
        return errorPosition;
    }

    /**
     * Snippet of the input around the error position, or null when unknown
     */
    public String getJsonSnippet() {
        if (invalidJson == null || errorPosition < 0) {
            return null;
        }
        int start = Math.max(0, errorPosition - 30);
        int end = Math.min(invalidJson.length(), errorPosition + 30);

        StringBuilder snippet = new StringBuilder();
        if (start > 0) snippet.append("...");
        snippet.append(invalidJson, start, end);
        if (end < invalidJson.length()) snippet.append("...");
        return snippet.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("JsonParsingException: ").append(getMessage());
        if (errorPosition >= 0) {
            sb.append(" at position ").append(errorPosition);
        }
        return sb.toString();
    }
}
