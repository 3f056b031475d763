package com.phillippitts.voicegate.domain;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily aggregate returned by the metrics recorder. Computed on read.
 *
 * @param day        UTC day the samples belong to
 * @param total      aggregate across every provider in {@code providers}
 * @param providers  per-provider aggregates keyed by provider name
 */
public record DailyStats(LocalDate day, ProviderStats total, Map<String, ProviderStats> providers) {

    public DailyStats {
        providers = providers == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(providers));
    }
}
