package com.phillippitts.voicegate.util;

import java.time.Duration;

/**
 * Timeout values for external process management used by the command-line provider adapters.
 */
public final class ProcessTimeouts {

    /** Wait for stream gobbler threads to flush after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Wait for graceful termination via {@link Process#destroy()}. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait for {@link Process#destroyForcibly()} to take effect. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
