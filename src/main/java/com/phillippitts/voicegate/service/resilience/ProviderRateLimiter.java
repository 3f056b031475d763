package com.phillippitts.voicegate.service.resilience;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * Rate and concurrency gate for one provider: a token bucket bounds requests per second and a
 * semaphore bounds calls in flight. Both checks are non-blocking.
 */
public final class ProviderRateLimiter {

    private final String provider;
    private final TokenBucket bucket;
    private final Semaphore inFlight;
    private final int maxConcurrent;

    public ProviderRateLimiter(String provider, double requestsPerSecond, int burst, int maxConcurrent, Clock clock) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive");
        }
        this.provider = provider;
        this.bucket = new TokenBucket(burst, requestsPerSecond, clock);
        this.maxConcurrent = maxConcurrent;
        this.inFlight = new Semaphore(maxConcurrent);
    }

    /**
     * @return a permit to close when the call finishes, or empty when throttled
     */
    public Optional<ProviderPermit> tryAcquire() {
        if (!inFlight.tryAcquire()) {
            return Optional.empty();
        }
        if (!bucket.tryAcquire()) {
            inFlight.release();
            return Optional.empty();
        }
        return Optional.of(new ProviderPermit(inFlight::release));
    }

    /**
     * Returns a permit whose call will not be made, giving back both its concurrency slot and its token.
     */
    public void giveBack(ProviderPermit permit) {
        permit.close();
        bucket.refund();
    }

    public String provider() {
        return provider;
    }

    public int inFlight() {
        return maxConcurrent - inFlight.availablePermits();
    }
}
