package com.phillippitts.voicegate.service.resilience;

import java.time.Duration;

/**
 * Pauses the calling thread between retries. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
