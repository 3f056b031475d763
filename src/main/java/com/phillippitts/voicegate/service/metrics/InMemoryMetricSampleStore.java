package com.phillippitts.voicegate.service.metrics;

import com.phillippitts.voicegate.domain.MetricSample;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory sample store. Samples older than the retention window or beyond the size cap are
 * dropped oldest first. The lock only guards the deque, never I/O.
 */
public class InMemoryMetricSampleStore implements MetricSampleStore {

    private final int maxSamples;
    private final Duration retention;
    private final Clock clock;
    private final Deque<MetricSample> samples = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public InMemoryMetricSampleStore(int maxSamples, Duration retention, Clock clock) {
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be positive");
        }
        this.maxSamples = maxSamples;
        this.retention = Objects.requireNonNull(retention, "retention");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void append(MetricSample sample) {
        Objects.requireNonNull(sample, "sample");
        lock.lock();
        try {
            samples.addLast(sample);
            Instant cutoff = clock.instant().minus(retention);
            while (!samples.isEmpty()
                    && (samples.size() > maxSamples || samples.peekFirst().timestamp().isBefore(cutoff))) {
                samples.removeFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<MetricSample> between(Instant from, Instant to) {
        lock.lock();
        try {
            List<MetricSample> out = new ArrayList<>();
            for (MetricSample s : samples) {
                if (!s.timestamp().isBefore(from) && s.timestamp().isBefore(to)) {
                    out.add(s);
                }
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return samples.size();
        } finally {
            lock.unlock();
        }
    }
}
