package com.phillippitts.voicegate.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for provider attempts, cache usage, skips and breaker transitions.
 *
 * <p>All meters are exposed at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
public class SpeechMetrics {

    private static final String METRIC_PREFIX = "voicegate";

    private final MeterRegistry registry;

    public SpeechMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of one provider attempt.
     *
     * @param provider      provider name
     * @param operation     "stt" or "tts"
     * @param durationNanos attempt duration in nanoseconds
     */
    public void recordLatency(String provider, String operation, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".operation.latency")
                .description("Time taken by a provider attempt, retries included")
                .tag("provider", provider)
                .tag("operation", operation)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String provider, String operation) {
        Counter.builder(METRIC_PREFIX + ".operation.success")
                .description("Number of successful provider attempts")
                .tag("provider", provider)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    /**
     * @param reason lower-case error kind (transient, authentication, ...)
     */
    public void incrementFailure(String provider, String operation, String reason) {
        Counter.builder(METRIC_PREFIX + ".operation.failure")
                .description("Number of failed provider attempts")
                .tag("provider", provider)
                .tag("operation", operation)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementCacheHit(String operation) {
        Counter.builder(METRIC_PREFIX + ".cache.hit")
                .description("Requests served from the result cache")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void incrementCacheMiss(String operation) {
        Counter.builder(METRIC_PREFIX + ".cache.miss")
                .description("Requests not found in the result cache")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    /**
     * @param reason circuit_open or rate_limited
     */
    public void incrementSkipped(String provider, String reason) {
        Counter.builder(METRIC_PREFIX + ".provider.skipped")
                .description("Candidates skipped without an attempt")
                .tag("provider", provider)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordBreakerTransition(String provider, String from, String to) {
        Counter.builder(METRIC_PREFIX + ".breaker.transition")
                .description("Circuit breaker state transitions")
                .tag("provider", provider)
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }
}
