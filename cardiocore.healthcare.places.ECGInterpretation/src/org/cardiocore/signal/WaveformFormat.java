package org.cardiocore.signal;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.cardiocore.exceptions.DecodeException;

/**
 * Supported raw waveform encodings
 */
public enum WaveformFormat {

    CSV("csv"),
    TEXT("txt", "dat"),
    XML("xml"),
    PROPRIETARY("ecg");

    /** Leading bytes of the binary acquisition format */
    public static final byte[] PROPRIETARY_MAGIC = "ECG1".getBytes(StandardCharsets.US_ASCII);

    private final String[] extensions;

    WaveformFormat(String... extensions) {
        this.extensions = extensions;
    }

    /**
     * Resolve a caller-declared format name such as "csv" or "proprietary"
     */
    public static WaveformFormat fromName(String name) throws DecodeException {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("TXT".equals(normalized)) {
            return TEXT;
        }
        if ("BINARY".equals(normalized)) {
            return PROPRIETARY;
        }
        for (WaveformFormat format : values()) {
            if (format.name().equals(normalized)) {
                return format;
            }
        }
        throw new DecodeException(DecodeException.Kind.UNSUPPORTED_FORMAT, "Unsupported waveform format: " + name);
    }

    /**
     * Format implied by a file name extension, or null when unknown
     */
    public static WaveformFormat fromFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return null;
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (WaveformFormat format : values()) {
            for (String candidate : format.extensions) {
                if (candidate.equals(extension)) {
                    return format;
                }
            }
        }
        return null;
    }

    /**
     * Guess the format from content: binary magic, then markup, then delimiters.
     */
    public static WaveformFormat sniff(byte[] data) {
        if (startsWithMagic(data)) {
            return PROPRIETARY;
        }
        String text = new String(data, 0, Math.min(data.length, 4096), StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("<")) {
            return XML;
        }
        for (String line : trimmed.split("\\r?\\n")) {
            if (!line.trim().isEmpty()) {
                return line.indexOf(',') >= 0 ? CSV : TEXT;
            }
        }
        return TEXT;
    }

    private static boolean startsWithMagic(byte[] data) {
        if (data.length < PROPRIETARY_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < PROPRIETARY_MAGIC.length; i++) {
            if (data[i] != PROPRIETARY_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }
}
