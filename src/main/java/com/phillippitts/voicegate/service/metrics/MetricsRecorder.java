package com.phillippitts.voicegate.service.metrics;

import com.phillippitts.voicegate.domain.DailyStats;
import com.phillippitts.voicegate.domain.MetricSample;
import com.phillippitts.voicegate.domain.ProviderStats;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Records one {@link MetricSample} per provider attempt and aggregates them on read.
 *
 * <p>{@link #record(MetricSample)} updates the Micrometer meters inline (in-memory counters) and hands
 * the sample to the metrics executor for the store append, so the request path never waits on storage.
 */
public class MetricsRecorder {

    private static final Logger LOG = LogManager.getLogger(MetricsRecorder.class);

    private final MetricSampleStore store;
    private final SpeechMetrics meters;
    private final Executor executor;

    public MetricsRecorder(MetricSampleStore store, SpeechMetrics meters, Executor executor) {
        this.store = Objects.requireNonNull(store, "store");
        this.meters = Objects.requireNonNull(meters, "meters");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Fire-and-forget. Never throws.
     */
    public void record(MetricSample sample) {
        String op = sample.operation().label();
        try {
            meters.recordLatency(sample.provider(), op, sample.latencyMs() * 1_000_000L);
            if (sample.success()) {
                meters.incrementSuccess(sample.provider(), op);
            } else {
                String reason = sample.errorKind() == null ? "unknown" : sample.errorKind().name().toLowerCase(Locale.ROOT);
                meters.incrementFailure(sample.provider(), op, reason);
            }
        } catch (RuntimeException e) {
            LOG.warn("Meter update failed for {}: {}", sample.provider(), e.toString());
        }
        try {
            executor.execute(() -> append(sample));
        } catch (RejectedExecutionException e) {
            LOG.warn("Metrics executor saturated; dropping sample for {}", sample.provider());
        }
    }

    /**
     * Aggregates the samples of one UTC day.
     *
     * @param provider restrict to one provider, or empty for all
     * @param day      UTC calendar day
     */
    public DailyStats getDailyStats(Optional<String> provider, LocalDate day) {
        List<MetricSample> samples = store.between(
                day.atStartOfDay().toInstant(ZoneOffset.UTC),
                day.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC));
        if (provider.isPresent()) {
            String name = provider.get();
            samples = samples.stream().filter(s -> s.provider().equals(name)).toList();
        }
        Map<String, ProviderStats> perProvider = samples.stream()
                .collect(Collectors.groupingBy(MetricSample::provider, TreeMap::new, Collectors.toList()))
                .entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> aggregate(e.getKey(), e.getValue()),
                        (a, b) -> a, TreeMap::new));
        return new DailyStats(day, aggregate(provider.orElse("all"), samples), perProvider);
    }

    static ProviderStats aggregate(String provider, List<MetricSample> samples) {
        long attempts = samples.size();
        long successes = samples.stream().filter(MetricSample::success).count();
        double avgLatency = samples.stream().mapToLong(MetricSample::latencyMs).average().orElse(0.0);
        long payload = samples.stream().mapToLong(MetricSample::payloadBytes).sum();
        double rate = attempts == 0 ? 0.0 : (double) successes / attempts;
        return new ProviderStats(provider, attempts, successes, attempts - successes, rate, avgLatency, payload);
    }

    private void append(MetricSample sample) {
        try {
            store.append(sample);
        } catch (RuntimeException e) {
            LOG.warn("Failed to append metric sample for {}: {}", sample.provider(), e.toString());
        }
    }
}
