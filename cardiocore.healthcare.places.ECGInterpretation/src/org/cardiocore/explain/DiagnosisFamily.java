package org.cardiocore.explain;

import java.util.Locale;

/**
 * Template key for a diagnosis label, matched by keyword in declaration order.
 */
public enum DiagnosisFamily {
    TACHYCARDIA("tachycardia"),
    BRADYCARDIA("bradycardia"),
    FIBRILLATION("fibrillation"),
    DEFAULT(null);

    private final String keyword;

    DiagnosisFamily(String keyword) {
        this.keyword = keyword;
    }

    public static DiagnosisFamily of(String diagnosisLabel) {
        if (diagnosisLabel == null) {
            return DEFAULT;
        }
        String label = diagnosisLabel.toLowerCase(Locale.ROOT);
        for (DiagnosisFamily family : values()) {
            if (family.keyword != null && label.contains(family.keyword)) {
                return family;
            }
        }
        return DEFAULT;
    }
}
