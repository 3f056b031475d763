package com.phillippitts.voicegate.service.resilience;

import com.phillippitts.voicegate.domain.BreakerState;

/**
 * Callback invoked after a breaker commits a state change. Runs on the thread that caused the
 * transition, outside any breaker critical section.
 */
@FunctionalInterface
public interface BreakerTransitionListener {

    BreakerTransitionListener NOOP = (provider, from, to, failures) -> { };

    void onTransition(String provider, BreakerState from, BreakerState to, int consecutiveFailures);
}
