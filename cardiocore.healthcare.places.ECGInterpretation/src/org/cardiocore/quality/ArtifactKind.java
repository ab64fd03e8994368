package org.cardiocore.quality;

/**
 * Non-physiological anomalies the quality analyzer recognizes
 */
public enum ArtifactKind {

    FLAT_LINE("Possible electrode disconnection"),
    SATURATION("Signal saturation detected"),
    HIGH_NOISE("High noise level");

    private final String issue;

    ArtifactKind(String issue) {
        this.issue = issue;
    }

    /**
     * Issue text reported when a lead shows this artifact
     */
    public String getIssue() {
        return issue;
    }
}
