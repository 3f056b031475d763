package com.phillippitts.voicegate.domain;

import java.util.Map;

/**
 * Common view over {@link SttRequest} and {@link TtsRequest} used by validation, cache-key derivation and
 * the fallback loop.
 */
public interface SpeechRequest {

    ProviderCategory category();

    /** Copy of the raw content the cache key hashes: audio bytes for STT, UTF-8 text for TTS. */
    byte[] contentBytes();

    /** BCP-47 style language code or {@code "auto"}; may be null (treated as auto). */
    String language();

    /** Provider-specific options; never null. */
    Map<String, String> options();

    /** Caller-supplied fingerprint mixed into the cache key; may be null. */
    String cacheSettingsFingerprint();

    /** Calling agent / tenant, used for the fairness limiter; may be null. */
    String tenantId();
}
