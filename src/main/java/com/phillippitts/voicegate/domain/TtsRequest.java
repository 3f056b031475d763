package com.phillippitts.voicegate.domain;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Immutable text-to-speech request.
 *
 * @param text                     text to synthesize
 * @param language                 language code or "auto"; null means auto
 * @param voice                    vendor voice name; may be null for the provider default
 * @param outputFormat             requested audio format such as "mp3"; may be null
 * @param options                  provider-specific options (speed, quality)
 * @param cacheSettingsFingerprint caller-supplied fingerprint mixed into the cache key
 * @param tenantId                 calling agent or tenant; may be null
 */
public record TtsRequest(
        String text,
        String language,
        String voice,
        String outputFormat,
        Map<String, String> options,
        String cacheSettingsFingerprint,
        String tenantId
) implements SpeechRequest {

    public TtsRequest {
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static TtsRequest of(String text, String language, String voice) {
        return new TtsRequest(text, language, voice, null, Map.of(), null, null);
    }

    @Override
    public ProviderCategory category() {
        return ProviderCategory.TTS;
    }

    @Override
    public byte[] contentBytes() {
        return text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    }
}
