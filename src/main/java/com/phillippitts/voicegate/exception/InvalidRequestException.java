package com.phillippitts.voicegate.exception;

/**
 * Thrown when a caller request fails validation (empty payload, bad language code, size limit).
 * Raised before any provider is considered.
 */
public class InvalidRequestException extends VoiceGateException {

    private final String reason;

    public InvalidRequestException(String message) {
        super(message);
        this.reason = message;
    }

    public InvalidRequestException(String message, String reason) {
        super(message + " (" + reason + ")");
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
