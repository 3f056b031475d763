package com.phillippitts.voicegate.domain;

import java.util.Map;

/**
 * Immutable speech-to-text request. Created per call and discarded once the call completes. The audio
 * array is copied on the way in and on every read.
 *
 * @param audio                    encoded audio payload
 * @param audioFormat              container/codec hint such as "wav" or "ogg"; may be null
 * @param language                 language code or "auto"; null means auto
 * @param options                  provider-specific options
 * @param cacheSettingsFingerprint caller-supplied fingerprint mixed into the cache key
 * @param tenantId                 calling agent or tenant; may be null
 */
public record SttRequest(
        byte[] audio,
        String audioFormat,
        String language,
        Map<String, String> options,
        String cacheSettingsFingerprint,
        String tenantId
) implements SpeechRequest {

    public SttRequest {
        audio = audio == null ? null : audio.clone();
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    @Override
    public byte[] audio() {
        return audio == null ? null : audio.clone();
    }

    public static SttRequest of(byte[] audio, String language) {
        return new SttRequest(audio, null, language, Map.of(), null, null);
    }

    @Override
    public ProviderCategory category() {
        return ProviderCategory.STT;
    }

    @Override
    public byte[] contentBytes() {
        return audio == null ? new byte[0] : audio.clone();
    }
}
