package org.cardiocore.classifier;

/**
 * Level 2 diagnostic categories, after the SCP-ECG superclasses.
 */
public enum DiagnosisCategory {
    NORMAL("Normal ECG"),
    ARRHYTHMIA("Arrhythmia"),
    CONDUCTION_ABNORMALITY("Conduction Abnormality"),
    ISCHEMIC_CHANGE("Ischemic Change"),
    HYPERTROPHY("Hypertrophy");

    private final String displayName;

    DiagnosisCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
