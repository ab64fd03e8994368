package org.cardiocore.base;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of one pipeline stage: the value handed to the next stage, the warnings
 * the stage raised and whether the value is the stage's documented default.
 */
public class StageResult<T> {

    public final T value;
    public final List<String> warnings;
    public final boolean degraded;

    public StageResult(T value, List<String> warnings, boolean degraded) {
        this.value = Objects.requireNonNull(value, "value cannot be null");
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings != null ? warnings : new ArrayList<>()));
        this.degraded = degraded;
    }

    public T getValue() {
        return value;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean isDegraded() {
        return degraded;
    }

    @Override
    public String toString() {
        return String.format("StageResult{value=%s, warnings=%d, degraded=%s}",
                value.getClass().getSimpleName(), warnings.size(), degraded);
    }
}
