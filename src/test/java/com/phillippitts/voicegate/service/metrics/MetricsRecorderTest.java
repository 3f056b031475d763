package com.phillippitts.voicegate.service.metrics;

import com.phillippitts.voicegate.domain.DailyStats;
import com.phillippitts.voicegate.domain.ErrorKind;
import com.phillippitts.voicegate.domain.MetricSample;
import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.ProviderStats;
import com.phillippitts.voicegate.testutil.MutableClock;
import com.phillippitts.voicegate.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class MetricsRecorderTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 2);

    private final MutableClock clock = MutableClock.at("2026-03-02T23:00:00Z");
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final InMemoryMetricSampleStore store = new InMemoryMetricSampleStore(100, Duration.ofDays(7), clock);
    private final MetricsRecorder recorder =
            new MetricsRecorder(store, new SpeechMetrics(meterRegistry), new SyncExecutor());

    @Test
    void aggregatesPerProviderAndTotal() {
        recorder.record(sample("2026-03-02T01:00:00Z", "A", true, 100, 10, null));
        recorder.record(sample("2026-03-02T02:00:00Z", "A", false, 300, 10, ErrorKind.TRANSIENT));
        recorder.record(sample("2026-03-02T03:00:00Z", "B", true, 50, 20, null));

        DailyStats stats = recorder.getDailyStats(Optional.empty(), DAY);

        assertThat(stats.providers()).containsOnlyKeys("A", "B");
        ProviderStats a = stats.providers().get("A");
        assertThat(a.attempts()).isEqualTo(2);
        assertThat(a.successes()).isEqualTo(1);
        assertThat(a.failures()).isEqualTo(1);
        assertThat(a.successRate()).isCloseTo(0.5, within(1e-9));
        assertThat(a.avgLatencyMs()).isCloseTo(200.0, within(1e-9));
        assertThat(a.totalPayloadBytes()).isEqualTo(20);
        assertThat(stats.total().provider()).isEqualTo("all");
        assertThat(stats.total().attempts()).isEqualTo(3);
        assertThat(stats.total().totalPayloadBytes()).isEqualTo(40);
    }

    @Test
    void dayBoundariesAreUtc() {
        recorder.record(sample("2026-03-01T23:59:59Z", "A", true, 1, 1, null));
        recorder.record(sample("2026-03-02T00:00:00Z", "A", true, 1, 1, null));
        recorder.record(sample("2026-03-02T23:59:59Z", "A", true, 1, 1, null));
        recorder.record(sample("2026-03-03T00:00:00Z", "A", true, 1, 1, null));

        assertThat(recorder.getDailyStats(Optional.empty(), DAY).total().attempts()).isEqualTo(2);
    }

    @Test
    void filtersByProvider() {
        recorder.record(sample("2026-03-02T01:00:00Z", "A", true, 100, 10, null));
        recorder.record(sample("2026-03-02T01:00:00Z", "B", true, 100, 10, null));

        DailyStats stats = recorder.getDailyStats(Optional.of("B"), DAY);

        assertThat(stats.providers()).containsOnlyKeys("B");
        assertThat(stats.total().provider()).isEqualTo("B");
        assertThat(stats.total().attempts()).isEqualTo(1);
    }

    @Test
    void emptyDayHasZeroRate() {
        DailyStats stats = recorder.getDailyStats(Optional.empty(), DAY);

        assertThat(stats.providers()).isEmpty();
        assertThat(stats.total().attempts()).isZero();
        assertThat(stats.total().successRate()).isZero();
    }

    @Test
    void updatesMetersInline() {
        recorder.record(sample("2026-03-02T01:00:00Z", "A", true, 100, 10, null));
        recorder.record(sample("2026-03-02T01:00:00Z", "A", false, 100, 10, ErrorKind.AUTHENTICATION));

        assertThat(meterRegistry.counter("voicegate.operation.success", "provider", "A", "operation", "stt").count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.counter("voicegate.operation.failure",
                "provider", "A", "operation", "stt", "reason", "authentication").count()).isEqualTo(1.0);
        assertThat(meterRegistry.timer("voicegate.operation.latency", "provider", "A", "operation", "stt").count())
                .isEqualTo(2);
    }

    @Test
    void saturatedExecutorDropsSampleWithoutThrowing() {
        MetricsRecorder saturated = new MetricsRecorder(store, new SpeechMetrics(meterRegistry), task -> {
            throw new RejectedExecutionException("full");
        });

        assertThatCode(() -> saturated.record(sample("2026-03-02T01:00:00Z", "A", true, 1, 1, null)))
                .doesNotThrowAnyException();
        assertThat(store.size()).isZero();
    }

    @Test
    void storeFailureIsContained() {
        MetricSampleStore failing = mock(MetricSampleStore.class);
        doThrow(new IllegalStateException("disk full")).when(failing).append(any());
        MetricsRecorder r = new MetricsRecorder(failing, new SpeechMetrics(meterRegistry), new SyncExecutor());

        assertThatCode(() -> r.record(sample("2026-03-02T01:00:00Z", "A", true, 1, 1, null)))
                .doesNotThrowAnyException();
    }

    private static MetricSample sample(String at, String provider, boolean success, long latencyMs, long bytes,
                                       ErrorKind kind) {
        return new MetricSample(Instant.parse(at), provider, ProviderCategory.STT, success, latencyMs, bytes, kind);
    }
}
