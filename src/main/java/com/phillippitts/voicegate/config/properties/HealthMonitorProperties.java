package com.phillippitts.voicegate.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Background health probing (prefix {@code voice.health}).
 */
@ConfigurationProperties(prefix = "voice.health")
@Validated
public class HealthMonitorProperties {

    /** Enable/disable periodic probing. On-demand checks stay available either way. */
    private boolean enabled = true;

    @NotNull
    private Duration interval = Duration.ofSeconds(60);

    @NotNull
    private Duration probeTimeout = Duration.ofSeconds(5);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public void setProbeTimeout(Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
    }
}
