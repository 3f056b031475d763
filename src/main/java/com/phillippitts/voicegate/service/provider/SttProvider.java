package com.phillippitts.voicegate.service.provider;

import com.phillippitts.voicegate.domain.Transcription;

import java.util.Map;

/**
 * Speech-to-text adapter.
 */
public interface SttProvider extends SpeechProvider {

    /**
     * @param audio    encoded audio payload, never empty
     * @param language language code or "auto"
     * @param options  provider-specific options, never null
     * @return transcription with non-blank text
     * @throws com.phillippitts.voicegate.exception.ProviderException on failure
     */
    Transcription transcribe(byte[] audio, String language, Map<String, String> options);
}
