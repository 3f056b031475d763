package com.phillippitts.voicegate.exception;

import com.phillippitts.voicegate.domain.ErrorKind;

/**
 * Network failure, timeout or vendor 5xx. Retried within the same provider attempt.
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(String message, String providerName) {
        super(ErrorKind.TRANSIENT, message, providerName);
    }

    public TransientProviderException(String message, String providerName, Throwable cause) {
        super(ErrorKind.TRANSIENT, message, providerName, cause);
    }
}
