package com.phillippitts.voicegate.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Request validation limits (prefix {@code voice.validation}).
 */
@ConfigurationProperties(prefix = "voice.validation")
@Validated
public class ValidationProperties {

    /** Maximum STT payload size in bytes (default 25 MB). */
    @Positive
    private long maxAudioBytes = 25L * 1024 * 1024;

    /** Maximum TTS text length in characters. */
    @Positive
    private int maxTextLength = 5000;

    public long getMaxAudioBytes() {
        return maxAudioBytes;
    }

    public void setMaxAudioBytes(long maxAudioBytes) {
        this.maxAudioBytes = maxAudioBytes;
    }

    public int getMaxTextLength() {
        return maxTextLength;
    }

    public void setMaxTextLength(int maxTextLength) {
        this.maxTextLength = maxTextLength;
    }
}
