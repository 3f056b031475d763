package com.phillippitts.voicegate.domain;

/**
 * Result of a speech-to-text request.
 *
 * @param success      whether a provider produced text
 * @param text         transcribed text; null on failure
 * @param confidence   provider confidence in [0, 1]; null when the provider does not report one
 * @param language     language reported by the provider or requested by the caller
 * @param provider     provider that produced the text
 * @param processingMs time spent in the orchestrator
 * @param cacheHit     true when served from the cache
 * @param error        structured error on failure
 */
public record SttResponse(
        boolean success,
        String text,
        Double confidence,
        String language,
        String provider,
        long processingMs,
        boolean cacheHit,
        OperationError error
) implements OperationResult {

    public SttResponse {
        if (success) {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException("Successful STT response requires non-empty text");
            }
            if (provider == null) {
                throw new IllegalArgumentException("Successful STT response requires a provider");
            }
        } else if (error == null) {
            throw new IllegalArgumentException("Failed STT response requires an error");
        }
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public static SttResponse success(String text, Double confidence, String language, String provider,
                                      long processingMs) {
        return new SttResponse(true, text, confidence, language, provider, processingMs, false, null);
    }

    public static SttResponse failure(OperationError error, long processingMs) {
        return new SttResponse(false, null, null, null, null, processingMs, false, error);
    }

    /**
     * Copy of this response marked as served from the cache.
     */
    public SttResponse asCacheHit(long processingMs) {
        return new SttResponse(success, text, confidence, language, provider, processingMs, true, error);
    }
}
