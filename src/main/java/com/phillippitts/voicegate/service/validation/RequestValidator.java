package com.phillippitts.voicegate.service.validation;

import com.phillippitts.voicegate.config.properties.ValidationProperties;
import com.phillippitts.voicegate.domain.SpeechRequest;
import com.phillippitts.voicegate.domain.SttRequest;
import com.phillippitts.voicegate.domain.TtsRequest;
import com.phillippitts.voicegate.exception.InvalidRequestException;

import java.util.regex.Pattern;

/**
 * Validates requests before any cache or provider interaction.
 *
 * <p>Rules: non-empty payload, payload within size limits, language either absent, {@code auto}, or a
 * well-formed tag such as {@code en}, {@code ru-RU} or {@code zh-Hant-TW}.
 */
public class RequestValidator {

    private static final Pattern LANGUAGE = Pattern.compile("^[A-Za-z]{2,3}(-[A-Za-z0-9]{2,8})*$");

    private final ValidationProperties props;

    public RequestValidator(ValidationProperties props) {
        this.props = props;
    }

    /**
     * @throws InvalidRequestException when a rule is violated
     */
    public void validate(SpeechRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Request is null");
        }
        if (request instanceof SttRequest stt) {
            validateAudio(stt.audio());
        } else if (request instanceof TtsRequest tts) {
            validateText(tts.text());
        } else {
            throw new InvalidRequestException("Unsupported request type", request.getClass().getSimpleName());
        }
        validateLanguage(request.language());
    }

    private void validateAudio(byte[] audio) {
        if (audio == null || audio.length == 0) {
            throw new InvalidRequestException("Audio payload is empty");
        }
        if (audio.length > props.getMaxAudioBytes()) {
            throw new InvalidRequestException("Audio payload too large",
                    audio.length + " bytes, max " + props.getMaxAudioBytes());
        }
    }

    private void validateText(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidRequestException("Text payload is empty");
        }
        if (text.length() > props.getMaxTextLength()) {
            throw new InvalidRequestException("Text too long",
                    text.length() + " chars, max " + props.getMaxTextLength());
        }
    }

    private static void validateLanguage(String language) {
        if (language == null || "auto".equalsIgnoreCase(language)) {
            return;
        }
        if (!LANGUAGE.matcher(language).matches()) {
            throw new InvalidRequestException("Malformed language code", language);
        }
    }
}
