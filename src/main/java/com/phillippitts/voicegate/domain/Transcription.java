package com.phillippitts.voicegate.domain;

import java.util.Objects;

/**
 * Raw transcription returned by an STT adapter.
 *
 * @param text       transcribed text
 * @param confidence confidence in [0, 1], or null when unknown
 * @param language   detected language, or null
 */
public record Transcription(String text, Double confidence, String language) {

    public Transcription {
        Objects.requireNonNull(text, "Transcription text must not be null");
    }

    public static Transcription of(String text) {
        return new Transcription(text, null, null);
    }
}
