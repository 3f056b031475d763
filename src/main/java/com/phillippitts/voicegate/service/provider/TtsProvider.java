package com.phillippitts.voicegate.service.provider;

import com.phillippitts.voicegate.domain.Synthesis;
import com.phillippitts.voicegate.domain.VoiceOptions;

/**
 * Text-to-speech adapter.
 */
public interface TtsProvider extends SpeechProvider {

    /**
     * @param text         text to synthesize, never blank
     * @param voiceOptions voice, language and format selection
     * @return audio reference or raw audio bytes
     * @throws com.phillippitts.voicegate.exception.ProviderException on failure
     */
    Synthesis synthesize(String text, VoiceOptions voiceOptions);
}
