package com.phillippitts.voicegate.service.orchestration;

import com.phillippitts.voicegate.domain.ErrorKind;

/**
 * Result of one provider attempt, retries included.
 *
 * @param status    how the attempt ended
 * @param payload   adapter payload on success ({@code Transcription} or {@code Synthesis})
 * @param errorKind classification on failure
 * @param message   failure message on failure
 * @param calls     adapter invocations made
 * @param latencyMs attempt duration including backoff
 */
record AttemptOutcome(Status status, Object payload, ErrorKind errorKind, String message, int calls,
                      long latencyMs) {

    /**
     * {@code SKIPPED} means no call reached the adapter, so the provider is not charged.
     */
    enum Status { SUCCEEDED, FAILED, CANCELLED, SKIPPED }

    static AttemptOutcome succeeded(Object payload, int calls, long latencyMs) {
        return new AttemptOutcome(Status.SUCCEEDED, payload, null, null, calls, latencyMs);
    }

    static AttemptOutcome failed(ErrorKind kind, String message, int calls, long latencyMs) {
        return new AttemptOutcome(Status.FAILED, null, kind, message, calls, latencyMs);
    }

    static AttemptOutcome skipped(String message, long latencyMs) {
        return new AttemptOutcome(Status.SKIPPED, null, ErrorKind.RATE_LIMITED, message, 0, latencyMs);
    }

    static AttemptOutcome cancelled(int calls, long latencyMs) {
        return new AttemptOutcome(Status.CANCELLED, null, ErrorKind.CANCELLED, "Cancelled by caller", calls,
                latencyMs);
    }
}
