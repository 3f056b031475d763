/**
 * Unchecked exception hierarchy rooted at {@link com.phillippitts.voicegate.exception.VoiceGateException}.
 *
 * <p>Adapter failures are {@link com.phillippitts.voicegate.exception.ProviderException}s carrying an
 * {@link com.phillippitts.voicegate.domain.ErrorKind}; the orchestrator converts them into structured
 * results and never lets them escape to callers.
 */
package com.phillippitts.voicegate.exception;
