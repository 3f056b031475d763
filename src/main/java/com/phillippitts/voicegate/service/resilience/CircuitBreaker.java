package com.phillippitts.voicegate.service.resilience;

import com.phillippitts.voicegate.domain.BreakerState;
import com.phillippitts.voicegate.domain.ProviderHealthSnapshot;
import com.phillippitts.voicegate.domain.ProviderStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-provider circuit breaker.
 *
 * <p>State machine:
 * <ul>
 *   <li>CLOSED → OPEN when consecutive failures reach the threshold</li>
 *   <li>OPEN → HALF_OPEN once the cooldown elapses; exactly one caller is admitted as a probe</li>
 *   <li>HALF_OPEN → CLOSED on probe success (failure count reset)</li>
 *   <li>HALF_OPEN → OPEN on probe failure (cooldown restarted from now)</li>
 * </ul>
 *
 * <p>All state lives in one immutable {@link State} swapped by compare-and-set, so concurrent callers
 * always observe a consistent commit and no lock is ever held across a provider call.
 */
public final class CircuitBreaker {

    /** Immutable breaker state. {@code probeInFlight} is only meaningful in HALF_OPEN. */
    record State(BreakerState state, int consecutiveFailures, Instant lastFailureAt, Instant openedUntil,
                 boolean probeInFlight) {

        static final State INITIAL = new State(BreakerState.CLOSED, 0, null, null, false);
    }

    private final String provider;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;
    private final BreakerTransitionListener listener;

    private final AtomicReference<State> state = new AtomicReference<>(State.INITIAL);
    private volatile Double lastLatencyMs;

    public CircuitBreaker(String provider, int failureThreshold, Duration cooldown, Clock clock,
                          BreakerTransitionListener listener) {
        this.provider = Objects.requireNonNull(provider, "provider");
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        this.failureThreshold = failureThreshold;
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = listener != null ? listener : BreakerTransitionListener.NOOP;
    }

    public String provider() {
        return provider;
    }

    /**
     * Asks for permission to call the provider.
     *
     * <p>CLOSED always admits. OPEN rejects until {@code openedUntil}; the first caller after that
     * moves the breaker to HALF_OPEN and becomes the probe. HALF_OPEN rejects while a probe is in flight.
     * A caller that was admitted as a probe must finish with {@link #recordSuccess()},
     * {@link #recordFailure()} or {@link #releaseProbe()}.
     *
     * @return true if the call may proceed
     */
    public boolean tryAcquire() {
        while (true) {
            State current = state.get();
            switch (current.state()) {
                case CLOSED:
                    return true;
                case OPEN: {
                    if (clock.instant().isBefore(current.openedUntil())) {
                        return false;
                    }
                    State probing = new State(BreakerState.HALF_OPEN, current.consecutiveFailures(),
                            current.lastFailureAt(), current.openedUntil(), true);
                    if (state.compareAndSet(current, probing)) {
                        fire(BreakerState.OPEN, BreakerState.HALF_OPEN, probing.consecutiveFailures());
                        return true;
                    }
                    break;
                }
                case HALF_OPEN: {
                    if (current.probeInFlight()) {
                        return false;
                    }
                    State probing = new State(BreakerState.HALF_OPEN, current.consecutiveFailures(),
                            current.lastFailureAt(), current.openedUntil(), true);
                    if (state.compareAndSet(current, probing)) {
                        return true;
                    }
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown breaker state " + current.state());
            }
        }
    }

    /**
     * Non-mutating check used for reporting: true while the provider would be rejected.
     */
    public boolean isOpen() {
        State current = state.get();
        return current.state() == BreakerState.OPEN && clock.instant().isBefore(current.openedUntil());
    }

    /**
     * Records a successful call: resets the failure streak and closes the breaker.
     */
    public void recordSuccess() {
        State previous;
        State next;
        do {
            previous = state.get();
            next = new State(BreakerState.CLOSED, 0, previous.lastFailureAt(), null, false);
        } while (!state.compareAndSet(previous, next));
        if (previous.state() != BreakerState.CLOSED) {
            fire(previous.state(), BreakerState.CLOSED, 0);
        }
    }

    /**
     * Records one breaker-countable failure.
     */
    public void recordFailure() {
        recordFailure(false);
    }

    /**
     * Records one breaker-countable failure.
     *
     * @param tripImmediately open the breaker regardless of the threshold
     */
    public void recordFailure(boolean tripImmediately) {
        Instant now = clock.instant();
        State previous;
        State next;
        do {
            previous = state.get();
            int failures = previous.consecutiveFailures() + 1;
            next = switch (previous.state()) {
                case CLOSED -> (tripImmediately || failures >= failureThreshold)
                        ? new State(BreakerState.OPEN, failures, now, now.plus(cooldown), false)
                        : new State(BreakerState.CLOSED, failures, now, null, false);
                case HALF_OPEN -> new State(BreakerState.OPEN, failures, now, now.plus(cooldown), false);
                // already open: keep the running cooldown
                case OPEN -> new State(BreakerState.OPEN, failures, now, previous.openedUntil(), false);
            };
        } while (!state.compareAndSet(previous, next));
        if (previous.state() != next.state()) {
            fire(previous.state(), next.state(), next.consecutiveFailures());
        }
    }

    /**
     * Gives back a probe slot without an outcome (cancelled call or a downstream gate rejected it).
     * Has no effect unless the breaker is HALF_OPEN with a probe in flight.
     */
    public void releaseProbe() {
        while (true) {
            State current = state.get();
            if (current.state() != BreakerState.HALF_OPEN || !current.probeInFlight()) {
                return;
            }
            State released = new State(BreakerState.HALF_OPEN, current.consecutiveFailures(),
                    current.lastFailureAt(), current.openedUntil(), false);
            if (state.compareAndSet(current, released)) {
                return;
            }
        }
    }

    public void recordLatency(double latencyMs) {
        this.lastLatencyMs = latencyMs;
    }

    /** Forces the breaker back to CLOSED. Operational use only. */
    public void reset() {
        State previous = state.getAndSet(State.INITIAL);
        if (previous.state() != BreakerState.CLOSED) {
            fire(previous.state(), BreakerState.CLOSED, 0);
        }
    }

    /**
     * Effective state: an OPEN breaker whose cooldown has elapsed reads HALF_OPEN.
     */
    public BreakerState currentState() {
        State current = state.get();
        if (current.state() == BreakerState.OPEN && !clock.instant().isBefore(current.openedUntil())) {
            return BreakerState.HALF_OPEN;
        }
        return current.state();
    }

    public int consecutiveFailures() {
        return state.get().consecutiveFailures();
    }

    public ProviderHealthSnapshot snapshot() {
        State current = state.get();
        BreakerState effective = currentState();
        return new ProviderHealthSnapshot(provider, null, effective,
                ProviderStatus.from(effective, current.consecutiveFailures()),
                current.consecutiveFailures(), current.lastFailureAt(), current.openedUntil(),
                lastLatencyMs, null);
    }

    private void fire(BreakerState from, BreakerState to, int failures) {
        listener.onTransition(provider, from, to, failures);
    }
}
