package com.phillippitts.voicegate.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Result cache settings (prefix {@code voice.cache}).
 */
@ConfigurationProperties(prefix = "voice.cache")
@Validated
public class CacheProperties {

    private boolean enabled = true;

    @Positive(message = "Cache TTL must be positive")
    private long ttlSeconds = 86_400;

    @NotBlank
    private String keyPrefix = "voicegate";

    /** Upper bound for the in-memory store; oldest-expiring entries are evicted first. */
    @Positive
    private int maxEntries = 10_000;

    /** Delay between sweeps of expired in-memory entries. Read by the store's scheduled purge. */
    @Positive
    private long purgeIntervalMs = 60_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public long getPurgeIntervalMs() {
        return purgeIntervalMs;
    }

    public void setPurgeIntervalMs(long purgeIntervalMs) {
        this.purgeIntervalMs = purgeIntervalMs;
    }
}
