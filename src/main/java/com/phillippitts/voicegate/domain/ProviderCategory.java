package com.phillippitts.voicegate.domain;

/**
 * Kind of speech operation a provider serves.
 */
public enum ProviderCategory {
    /** Speech-to-text: audio in, text out. */
    STT,
    /** Text-to-speech: text in, audio reference out. */
    TTS;

    /**
     * Lower-case label used in metric tags, cache keys and log lines.
     *
     * @return "stt" or "tts"
     */
    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
