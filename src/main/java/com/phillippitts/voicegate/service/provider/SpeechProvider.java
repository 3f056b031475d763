package com.phillippitts.voicegate.service.provider;

import com.phillippitts.voicegate.domain.HealthProbe;
import com.phillippitts.voicegate.domain.ProviderCapabilities;

/**
 * Contract shared by every vendor adapter.
 *
 * <p>Adapter instances are cached by the registry and shared across concurrent requests, so
 * implementations must be stateless or internally thread-safe.
 *
 * <p>Failures are reported by throwing {@link com.phillippitts.voicegate.exception.ProviderException}
 * (or one of its subclasses) with the matching {@link com.phillippitts.voicegate.domain.ErrorKind}.
 * Any other exception is treated as an unclassified provider error.
 */
public interface SpeechProvider extends AutoCloseable {

    /**
     * @return configured provider name
     */
    String name();

    ProviderCapabilities capabilities();

    /**
     * Lightweight liveness probe. Must not consume vendor quota where avoidable.
     *
     * @return probe outcome; implementations should report failures here rather than throw
     */
    HealthProbe health();

    /**
     * Releases resources. Called once when the adapter is retired; the default does nothing.
     */
    @Override
    default void close() {
    }
}
