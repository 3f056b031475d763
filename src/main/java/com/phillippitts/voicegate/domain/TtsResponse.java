package com.phillippitts.voicegate.domain;

/**
 * Result of a text-to-speech request.
 *
 * @param success      whether a provider produced audio
 * @param audioRef     opaque object-storage reference to the generated audio; null on failure
 * @param contentType  MIME type of the audio
 * @param provider     provider that produced the audio
 * @param processingMs time spent in the orchestrator
 * @param cacheHit     true when served from the cache
 * @param error        structured error on failure
 */
public record TtsResponse(
        boolean success,
        String audioRef,
        String contentType,
        String provider,
        long processingMs,
        boolean cacheHit,
        OperationError error
) implements OperationResult {

    public TtsResponse {
        if (success) {
            if (audioRef == null || audioRef.isBlank()) {
                throw new IllegalArgumentException("Successful TTS response requires an audio reference");
            }
            if (provider == null) {
                throw new IllegalArgumentException("Successful TTS response requires a provider");
            }
        } else if (error == null) {
            throw new IllegalArgumentException("Failed TTS response requires an error");
        }
    }

    public static TtsResponse success(String audioRef, String contentType, String provider, long processingMs) {
        return new TtsResponse(true, audioRef, contentType, provider, processingMs, false, null);
    }

    public static TtsResponse failure(OperationError error, long processingMs) {
        return new TtsResponse(false, null, null, null, processingMs, false, error);
    }

    public TtsResponse asCacheHit(long processingMs) {
        return new TtsResponse(success, audioRef, contentType, provider, processingMs, true, error);
    }
}
