package org.cardiocore.quality;

import java.util.Objects;

import org.cardiocore.signal.EcgSignal;

/**
 * Cleaned signal paired with its quality report, as handed to feature extraction
 */
public final class AssessedSignal {

    public final EcgSignal signal;
    public final QualityReport quality;

    public AssessedSignal(EcgSignal signal, QualityReport quality) {
        this.signal = Objects.requireNonNull(signal, "signal cannot be null");
        this.quality = Objects.requireNonNull(quality, "quality cannot be null");
    }
}
