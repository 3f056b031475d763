package com.phillippitts.voicegate.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One record per provider attempt. Append-only.
 *
 * @param timestamp    when the attempt finished
 * @param provider     provider that was invoked
 * @param operation    STT or TTS
 * @param success      attempt outcome
 * @param latencyMs    attempt duration including retries
 * @param payloadBytes size of the request content
 * @param errorKind    failure classification, null on success
 */
public record MetricSample(
        Instant timestamp,
        String provider,
        ProviderCategory operation,
        boolean success,
        long latencyMs,
        long payloadBytes,
        ErrorKind errorKind
) {
    public MetricSample {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(operation, "operation");
    }
}
