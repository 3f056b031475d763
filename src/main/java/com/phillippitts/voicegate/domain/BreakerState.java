package com.phillippitts.voicegate.domain;

/**
 * Circuit breaker state per provider.
 */
public enum BreakerState {
    /** Normal operation; calls flow. */
    CLOSED,
    /** Provider excluded from selection until the cooldown elapses. */
    OPEN,
    /** Cooldown elapsed; one probe call is let through. */
    HALF_OPEN
}
