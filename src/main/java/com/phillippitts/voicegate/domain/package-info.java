/**
 * Immutable domain values exchanged between the orchestrator, its collaborators and callers.
 *
 * <p>Requests ({@link com.phillippitts.voicegate.domain.SttRequest},
 * {@link com.phillippitts.voicegate.domain.TtsRequest}) and results
 * ({@link com.phillippitts.voicegate.domain.SttResponse},
 * {@link com.phillippitts.voicegate.domain.TtsResponse}) are records created per call. Mutable runtime
 * state (breaker counters, limiter buckets) is deliberately absent from this package.
 */
package com.phillippitts.voicegate.domain;
