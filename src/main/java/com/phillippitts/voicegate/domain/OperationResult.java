package com.phillippitts.voicegate.domain;

/**
 * Normalized outcome returned to the caller. Implementations are immutable records built once at the
 * end of a request.
 *
 * <p>Invariant: {@code success()} implies a non-empty payload and a non-null provider.
 */
public interface OperationResult {

    boolean success();

    /** Name of the provider that produced the payload; null on failure. */
    String provider();

    /** Wall-clock time spent in the orchestrator for this request. */
    long processingMs();

    boolean cacheHit();

    /** Structured error; null on success. */
    OperationError error();
}
