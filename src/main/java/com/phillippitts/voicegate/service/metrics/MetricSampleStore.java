package com.phillippitts.voicegate.service.metrics;

import com.phillippitts.voicegate.domain.MetricSample;

import java.time.Instant;
import java.util.List;

/**
 * Append-only backing store for attempt samples.
 */
public interface MetricSampleStore {

    void append(MetricSample sample);

    /**
     * @return samples with {@code from <= timestamp < to}, in append order
     */
    List<MetricSample> between(Instant from, Instant to);
}
