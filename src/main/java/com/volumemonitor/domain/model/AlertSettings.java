package com.volumemonitor.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Alert thresholds captured when monitoring starts.
 *
 * <p>Thresholds are fractions: 0.05 means a 5% move from baseline. A stability duration
 * of zero promotes the first stable observation after an alert straight to baseline.
 */
@Value
@Builder(toBuilder = true)
public class AlertSettings {

    public static final long DEFAULT_COOLDOWN_SECONDS = 300;

    double buyThreshold;
    double sellThreshold;

    @Builder.Default
    long cooldownSeconds = DEFAULT_COOLDOWN_SECONDS;

    double stabilityThreshold;
    long stabilityDurationSeconds;

    /** Returns a human-readable list of invalid fields, empty when the settings are usable. */
    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (!(buyThreshold >= 0)) {
            violations.add("buyThreshold must be >= 0 but was " + buyThreshold);
        }
        if (!(sellThreshold >= 0)) {
            violations.add("sellThreshold must be >= 0 but was " + sellThreshold);
        }
        if (cooldownSeconds < 0) {
            violations.add("cooldownSeconds must be >= 0 but was " + cooldownSeconds);
        }
        if (!(stabilityThreshold >= 0)) {
            violations.add("stabilityThreshold must be >= 0 but was " + stabilityThreshold);
        }
        if (stabilityDurationSeconds < 0) {
            violations.add("stabilityDurationSeconds must be >= 0 but was " + stabilityDurationSeconds);
        }
        return violations;
    }
}
