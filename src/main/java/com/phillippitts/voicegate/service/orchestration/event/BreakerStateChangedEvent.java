package com.phillippitts.voicegate.service.orchestration.event;

import com.phillippitts.voicegate.domain.BreakerState;

import java.time.Instant;

/**
 * Published after a provider's circuit breaker commits a state change.
 */
public record BreakerStateChangedEvent(
        String provider,
        BreakerState from,
        BreakerState to,
        int consecutiveFailures,
        Instant at
) {
    public BreakerStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
