package com.phillippitts.voicegate.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Global resilience knobs shared by every provider: circuit breaker, retry and rate limiting.
 *
 * <p>Properties:
 * <ul>
 *   <li>voice.resilience.breaker.failure-threshold - consecutive failures before opening (default: 3)</li>
 *   <li>voice.resilience.breaker.cooldown - time a breaker stays open (default: 60s)</li>
 *   <li>voice.resilience.retry.max-retries - retries per attempt for transient errors (default: 2)</li>
 *   <li>voice.resilience.retry.attempt-timeout - deadline for a single adapter call (default: 30s)</li>
 *   <li>voice.resilience.rate-limit.requests-per-second - token refill rate per provider (default: 10)</li>
 *   <li>voice.resilience.rate-limit.max-concurrent - in-flight calls per provider (default: 8)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "voice.resilience")
@Validated
public class ResilienceProperties {

    @Valid
    private Breaker breaker = new Breaker();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    public Breaker getBreaker() {
        return breaker;
    }

    public void setBreaker(Breaker breaker) {
        this.breaker = breaker;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public static class Breaker {

        @Positive(message = "Failure threshold must be positive")
        private int failureThreshold = 3;

        @NotNull
        private Duration cooldown = Duration.ofSeconds(60);

        /** When true a single authentication failure opens the breaker. */
        private boolean openOnAuthenticationFailure = false;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public boolean isOpenOnAuthenticationFailure() {
            return openOnAuthenticationFailure;
        }

        public void setOpenOnAuthenticationFailure(boolean openOnAuthenticationFailure) {
            this.openOnAuthenticationFailure = openOnAuthenticationFailure;
        }
    }

    public static class Retry {

        @Min(value = 0, message = "Max retries must not be negative")
        private int maxRetries = 2;

        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(1);

        @DecimalMin(value = "1.0", message = "Backoff multiplier must be at least 1.0")
        private double multiplier = 2.0;

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(8);

        /** Relative jitter applied to each backoff, 0.2 means plus or minus 20%. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitter = 0.2;

        @NotNull
        private Duration attemptTimeout = Duration.ofSeconds(30);

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }

        public Duration getAttemptTimeout() {
            return attemptTimeout;
        }

        public void setAttemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
        }
    }

    public static class RateLimit {

        @Positive(message = "Requests per second must be positive")
        private double requestsPerSecond = 10.0;

        @Positive(message = "Burst must be positive")
        private int burst = 20;

        @Positive(message = "Max concurrent must be positive")
        private int maxConcurrent = 8;

        /** Per-tenant budget; 0 disables the tenant limiter. */
        @Min(0)
        private int tenantRequestsPerMinute = 0;

        /** How often tenant buckets that refilled to capacity are dropped. */
        @Positive
        private long tenantPurgeIntervalMs = 60_000;

        public double getRequestsPerSecond() {
            return requestsPerSecond;
        }

        public void setRequestsPerSecond(double requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
        }

        public int getBurst() {
            return burst;
        }

        public void setBurst(int burst) {
            this.burst = burst;
        }

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }

        public int getTenantRequestsPerMinute() {
            return tenantRequestsPerMinute;
        }

        public void setTenantRequestsPerMinute(int tenantRequestsPerMinute) {
            this.tenantRequestsPerMinute = tenantRequestsPerMinute;
        }

        public long getTenantPurgeIntervalMs() {
            return tenantPurgeIntervalMs;
        }

        public void setTenantPurgeIntervalMs(long tenantPurgeIntervalMs) {
            this.tenantPurgeIntervalMs = tenantPurgeIntervalMs;
        }
    }
}
