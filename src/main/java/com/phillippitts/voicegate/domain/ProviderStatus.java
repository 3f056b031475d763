package com.phillippitts.voicegate.domain;

/**
 * Coarse provider status reported to operational tooling.
 */
public enum ProviderStatus {
    /** Breaker closed with no recent failures. */
    ACTIVE,
    /** Breaker closed with a failure streak in progress, or half-open. */
    DEGRADED,
    /** Breaker open; provider is not selected. */
    OPEN;

    public static ProviderStatus from(BreakerState state, int consecutiveFailures) {
        return switch (state) {
            case OPEN -> OPEN;
            case HALF_OPEN -> DEGRADED;
            case CLOSED -> consecutiveFailures > 0 ? DEGRADED : ACTIVE;
        };
    }
}
