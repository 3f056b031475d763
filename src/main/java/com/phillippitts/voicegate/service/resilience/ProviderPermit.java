package com.phillippitts.voicegate.service.resilience;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-flight slot granted by the rate limiter. Closing releases the slot; closing twice is harmless.
 */
public final class ProviderPermit implements AutoCloseable {

    private final Runnable release;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ProviderPermit(Runnable release) {
        this.release = release;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            release.run();
        }
    }
}
