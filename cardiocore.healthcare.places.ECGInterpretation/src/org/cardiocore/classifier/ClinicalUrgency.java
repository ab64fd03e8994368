package org.cardiocore.classifier;

/**
 * Coarse clinical priority, ordered from least to most urgent.
 */
public enum ClinicalUrgency {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(ClinicalUrgency other) {
        return compareTo(other) >= 0;
    }

    /** HIGH and CRITICAL results are routed to the notification layer. */
    public boolean requiresNotification() {
        return isAtLeast(HIGH);
    }
}
