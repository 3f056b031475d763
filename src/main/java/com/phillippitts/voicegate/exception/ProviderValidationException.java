package com.phillippitts.voicegate.exception;

import com.phillippitts.voicegate.domain.ErrorKind;

/**
 * Vendor rejected the request payload (unsupported format, language, voice). The provider itself is
 * healthy, so the breaker is not charged.
 */
public class ProviderValidationException extends ProviderException {

    public ProviderValidationException(String message, String providerName) {
        super(ErrorKind.VALIDATION, message, providerName);
    }
}
