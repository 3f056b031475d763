package com.phillippitts.voicegate.exception;

import com.phillippitts.voicegate.domain.ErrorKind;

/**
 * Vendor-side quota or rate limit. The next provider is tried without retrying this one.
 */
public class QuotaExceededException extends ProviderException {

    public QuotaExceededException(String message, String providerName) {
        super(ErrorKind.QUOTA_EXCEEDED, message, providerName);
    }
}
