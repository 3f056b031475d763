package com.phillippitts.voicegate.exception;

/**
 * Base exception for all voicegate application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class VoiceGateException extends RuntimeException {

    public VoiceGateException(String message) {
        super(message);
    }

    public VoiceGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
