package com.phillippitts.voicegate.service.orchestration.event;

import com.phillippitts.voicegate.domain.ErrorKind;
import com.phillippitts.voicegate.domain.ProviderCategory;

import java.time.Instant;

/**
 * Published when a provider attempt ends in failure (after retries).
 *
 * <p>PII note: never carries request payloads. Messages are technical diagnostics only.
 */
public record ProviderFailureEvent(
        String provider,
        ProviderCategory operation,
        ErrorKind kind,
        String message,
        Instant at
) {
    public ProviderFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
