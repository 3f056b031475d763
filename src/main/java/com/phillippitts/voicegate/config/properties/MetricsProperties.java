package com.phillippitts.voicegate.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retention of attempt samples used for daily statistics (prefix {@code voice.metrics}).
 */
@ConfigurationProperties(prefix = "voice.metrics")
@Validated
public class MetricsProperties {

    @Positive
    private int retentionDays = 7;

    /** Hard cap on retained samples; the oldest are dropped first. */
    @Positive
    private int maxSamples = 100_000;

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }

    public int getMaxSamples() {
        return maxSamples;
    }

    public void setMaxSamples(int maxSamples) {
        this.maxSamples = maxSamples;
    }
}
