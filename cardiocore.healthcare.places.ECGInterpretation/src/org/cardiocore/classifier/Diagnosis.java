package org.cardiocore.classifier;

/**
 * Specific diagnoses the Level 3 tables can produce, with their coding.
 *
 * Ventricular fibrillation and ventricular tachycardia are not produced by the
 * rule tables. They are listed so urgency derivation recognizes them when a
 * finding arrives from another source.
 */
public enum Diagnosis {

    ATRIAL_FIBRILLATION("Atrial Fibrillation", "I48.9", "AFIB", DiagnosisCategory.ARRHYTHMIA, true),
    SINUS_TACHYCARDIA("Sinus Tachycardia", "R00.0", "NORM", DiagnosisCategory.ARRHYTHMIA, true),
    SUPRAVENTRICULAR_TACHYCARDIA("Supraventricular Tachycardia", "I47.1", "SVT", DiagnosisCategory.ARRHYTHMIA, true),
    VENTRICULAR_TACHYCARDIA("Ventricular Tachycardia", "I47.2", "VT", DiagnosisCategory.ARRHYTHMIA, true),
    VENTRICULAR_FIBRILLATION("Ventricular Fibrillation", "I49.01", "VF", DiagnosisCategory.ARRHYTHMIA, false),
    SINUS_BRADYCARDIA("Sinus Bradycardia", "R00.1", "NORM", DiagnosisCategory.CONDUCTION_ABNORMALITY, false),
    FIRST_DEGREE_AV_BLOCK("First Degree AV Block", "I44.0", "CD", DiagnosisCategory.CONDUCTION_ABNORMALITY, false),
    STEMI("ST Elevation Myocardial Infarction", "I21.9", "STEMI", DiagnosisCategory.ISCHEMIC_CHANGE, false),
    NSTEMI("Non-ST Elevation Myocardial Infarction", "I21.4", "NSTEMI", DiagnosisCategory.ISCHEMIC_CHANGE, false),
    LEFT_VENTRICULAR_HYPERTROPHY("Left Ventricular Hypertrophy", "I51.7", "HYP", DiagnosisCategory.HYPERTROPHY, false);

    private final String label;
    private final String icd10Code;
    private final String scpCode;
    private final DiagnosisCategory category;
    private final boolean tachyarrhythmia;

    Diagnosis(String label, String icd10Code, String scpCode, DiagnosisCategory category, boolean tachyarrhythmia) {
        this.label = label;
        this.icd10Code = icd10Code;
        this.scpCode = scpCode;
        this.category = category;
        this.tachyarrhythmia = tachyarrhythmia;
    }

    public String getLabel() {
        return label;
    }

    public String getIcd10Code() {
        return icd10Code;
    }

    public String getScpCode() {
        return scpCode;
    }

    public DiagnosisCategory getCategory() {
        return category;
    }

    public boolean isTachyarrhythmia() {
        return tachyarrhythmia;
    }
}
