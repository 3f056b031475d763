package com.phillippitts.voicegate.domain;

import java.util.Map;

/**
 * Synthesis options handed to a TTS adapter.
 *
 * @param language language code, or "auto"
 * @param voice    vendor voice name, or null for the provider default
 * @param format   requested output format, or null for the provider default
 * @param options  remaining provider-specific options
 */
public record VoiceOptions(String language, String voice, String format, Map<String, String> options) {

    public VoiceOptions {
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static VoiceOptions from(TtsRequest request) {
        return new VoiceOptions(request.language(), request.voice(), request.outputFormat(), request.options());
    }
}
