package com.phillippitts.voicegate.exception;

import com.phillippitts.voicegate.domain.ErrorKind;

/**
 * Vendor rejected the configured credentials. Never retried.
 */
public class ProviderAuthenticationException extends ProviderException {

    public ProviderAuthenticationException(String message, String providerName) {
        super(ErrorKind.AUTHENTICATION, message, providerName);
    }
}
