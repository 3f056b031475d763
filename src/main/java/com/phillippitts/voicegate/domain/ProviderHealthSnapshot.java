package com.phillippitts.voicegate.domain;

import java.time.Instant;

/**
 * Point-in-time copy of a provider's runtime health. Produced by the breaker and health monitor;
 * never mutated after creation.
 *
 * @param provider            provider name
 * @param category            STT or TTS; null when the provider is no longer configured
 * @param breakerState        effective breaker state (an open breaker whose cooldown elapsed reads HALF_OPEN)
 * @param status              coarse status derived from the breaker
 * @param consecutiveFailures current failure streak
 * @param lastFailureAt       time of the last recorded failure, or null
 * @param openedUntil         end of the current open period, or null
 * @param lastLatencyMs       latency of the last successful call or probe, or null
 * @param lastProbeOk         outcome of the last health probe, or null when never probed
 */
public record ProviderHealthSnapshot(
        String provider,
        ProviderCategory category,
        BreakerState breakerState,
        ProviderStatus status,
        int consecutiveFailures,
        Instant lastFailureAt,
        Instant openedUntil,
        Double lastLatencyMs,
        Boolean lastProbeOk
) {

    public ProviderHealthSnapshot withContext(ProviderCategory category, Boolean lastProbeOk) {
        return new ProviderHealthSnapshot(provider, category, breakerState, status, consecutiveFailures,
                lastFailureAt, openedUntil, lastLatencyMs, lastProbeOk);
    }
}
