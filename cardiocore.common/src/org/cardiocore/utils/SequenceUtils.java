package org.cardiocore.utils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Utility class for generating analysis identifiers
 */
public class SequenceUtils {

    private static final DateTimeFormatter ID_TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    /**
     * Generate a unique analysis ID
     * Format: PREFIX_yyyyMMddHHmmss_NNNN
     */
    public static String generateAnalysisId(String prefix) {
        String timestamp = LocalDateTime.now().format(ID_TIMESTAMP_FORMAT);
        int random = ThreadLocalRandom.current().nextInt(1000, 9999);
        return String.format("%s_%s_%d", prefix, timestamp, random);
    }
}
