package com.phillippitts.voicegate.service.resilience;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lock-free token bucket. {@link #tryAcquire()} never blocks: it takes a token or reports rejection.
 */
public final class TokenBucket {

    private record Bucket(double tokens, long refilledAtMillis) {
    }

    private final double capacity;
    private final double tokensPerMilli;
    private final Clock clock;
    private final AtomicReference<Bucket> bucket;

    /**
     * @param capacity        maximum stored tokens (burst)
     * @param tokensPerSecond refill rate
     * @param clock           time source
     */
    public TokenBucket(double capacity, double tokensPerSecond, Clock clock) {
        if (capacity <= 0 || tokensPerSecond <= 0) {
            throw new IllegalArgumentException("capacity and tokensPerSecond must be positive");
        }
        this.capacity = capacity;
        this.tokensPerMilli = tokensPerSecond / 1000.0;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.bucket = new AtomicReference<>(new Bucket(capacity, clock.millis()));
    }

    public boolean tryAcquire() {
        while (true) {
            Bucket current = bucket.get();
            long now = clock.millis();
            double refilled = refilled(current, now);
            if (refilled < 1.0) {
                // persist the refill so elapsed time is not lost
                if (bucket.compareAndSet(current, new Bucket(refilled, Math.max(now, current.refilledAtMillis())))) {
                    return false;
                }
                continue;
            }
            if (bucket.compareAndSet(current, new Bucket(refilled - 1.0, Math.max(now, current.refilledAtMillis())))) {
                return true;
            }
        }
    }

    /**
     * Gives back one token taken by {@link #tryAcquire()} for a call that was never made.
     */
    public void refund() {
        while (true) {
            Bucket current = bucket.get();
            long now = clock.millis();
            double tokens = Math.min(capacity, refilled(current, now) + 1.0);
            if (bucket.compareAndSet(current, new Bucket(tokens, Math.max(now, current.refilledAtMillis())))) {
                return;
            }
        }
    }

    /** Tokens currently available, refill included. */
    public double available() {
        return refilled(bucket.get(), clock.millis());
    }

    /** A full bucket holds no history: dropping it and starting a new one changes nothing. */
    public boolean isFull() {
        return available() >= capacity;
    }

    private double refilled(Bucket current, long now) {
        return Math.min(capacity,
                current.tokens() + Math.max(0, now - current.refilledAtMillis()) * tokensPerMilli);
    }
}
