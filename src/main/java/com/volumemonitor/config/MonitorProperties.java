package com.volumemonitor.config;

import com.volumemonitor.domain.model.AlertSettings;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Polling and alerting configuration.
 *
 * <p>Reads from application.yml:
 * <pre>
 * monitor.poll-interval-seconds=5
 * monitor.paused-idle-seconds=10
 * monitor.batch-size=200
 * monitor.buy-threshold=0.05
 * monitor.sell-threshold=0.05
 * monitor.cooldown-seconds=300
 * monitor.stability-threshold=0.02
 * monitor.stability-duration-seconds=60
 * monitor.stop-grace-seconds=5
 * </pre>
 *
 * <p>Thresholds are fractions (0.05 = 5%). Values are only checked when monitoring starts,
 * so a bad value surfaces as a ConfigurationException from start rather than at boot.
 */
@Data
@Component
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    /** Kite's quote endpoint accepts at most this many instruments per call. */
    public static final int MAX_BATCH_SIZE = 500;

    private long pollIntervalSeconds = 5;
    private long pausedIdleSeconds = 10;
    private int batchSize = 200;
    private double buyThreshold = 0.05;
    private double sellThreshold = 0.05;
    private long cooldownSeconds = AlertSettings.DEFAULT_COOLDOWN_SECONDS;
    private double stabilityThreshold = 0.02;
    private long stabilityDurationSeconds = 60;
    private long stopGraceSeconds = 5;

    public AlertSettings toAlertSettings() {
        return AlertSettings.builder()
                .buyThreshold(buyThreshold)
                .sellThreshold(sellThreshold)
                .cooldownSeconds(cooldownSeconds)
                .stabilityThreshold(stabilityThreshold)
                .stabilityDurationSeconds(stabilityDurationSeconds)
                .build();
    }

    /** Alert-setting violations plus loop timing and batch size checks. */
    public List<String> violations() {
        List<String> violations = new ArrayList<>(toAlertSettings().violations());
        if (pollIntervalSeconds <= 0) {
            violations.add("pollIntervalSeconds must be > 0 but was " + pollIntervalSeconds);
        }
        if (pausedIdleSeconds <= 0) {
            violations.add("pausedIdleSeconds must be > 0 but was " + pausedIdleSeconds);
        }
        if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
            violations.add("batchSize must be between 1 and " + MAX_BATCH_SIZE + " but was " + batchSize);
        }
        if (stopGraceSeconds < 0) {
            violations.add("stopGraceSeconds must be >= 0 but was " + stopGraceSeconds);
        }
        return violations;
    }
}
