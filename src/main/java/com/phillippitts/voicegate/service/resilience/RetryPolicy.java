package com.phillippitts.voicegate.service.resilience;

import com.phillippitts.voicegate.config.properties.ResilienceProperties;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Bounded exponential backoff applied inside a single provider attempt.
 *
 * @param maxRetries     retries after the first call (0 disables retry)
 * @param initialBackoff wait before the first retry
 * @param multiplier     growth factor per retry
 * @param maxBackoff     upper bound for any single wait
 * @param jitter         relative jitter in [0, 1]
 * @param attemptTimeout deadline for each individual adapter call
 */
public record RetryPolicy(
        int maxRetries,
        Duration initialBackoff,
        double multiplier,
        Duration maxBackoff,
        double jitter,
        Duration attemptTimeout
) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        Objects.requireNonNull(attemptTimeout, "attemptTimeout");
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
        }
    }

    public static RetryPolicy from(ResilienceProperties.Retry props) {
        return new RetryPolicy(props.getMaxRetries(), props.getInitialBackoff(), props.getMultiplier(),
                props.getMaxBackoff(), props.getJitter(), props.getAttemptTimeout());
    }

    /**
     * Total number of calls an attempt may make.
     */
    public int maxCalls() {
        return maxRetries + 1;
    }

    /**
     * Backoff before the given retry.
     *
     * @param retry  1 for the first retry
     * @param random source of uniform values in [0, 1)
     * @return non-negative delay, capped at {@code maxBackoff}
     */
    public Duration backoffFor(int retry, DoubleSupplier random) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry must be >= 1");
        }
        double base = initialBackoff.toMillis() * Math.pow(multiplier, retry - 1);
        double capped = Math.min(base, maxBackoff.toMillis());
        double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofMillis(Math.max(0L, Math.round(capped * factor)));
    }
}
