package com.phillippitts.voicegate.domain;

/**
 * Aggregate over a set of {@link MetricSample}s for one provider and day.
 *
 * @param provider      provider name
 * @param attempts      number of samples
 * @param successes     successful samples
 * @param failures      failed samples
 * @param successRate   successes / attempts, 0 when there are no attempts
 * @param avgLatencyMs  mean latency over all samples
 * @param totalPayloadBytes sum of payload sizes
 */
public record ProviderStats(
        String provider,
        long attempts,
        long successes,
        long failures,
        double successRate,
        double avgLatencyMs,
        long totalPayloadBytes
) {
}
