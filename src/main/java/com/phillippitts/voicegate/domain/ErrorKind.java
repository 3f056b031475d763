package com.phillippitts.voicegate.domain;

/**
 * Classification of a failed attempt or a failed request.
 */
public enum ErrorKind {
    /** Malformed request; rejected before any provider is considered. */
    VALIDATION,
    /** Network failure, timeout or 5xx; retried inside the attempt. */
    TRANSIENT,
    /** Vendor rejected the credentials. */
    AUTHENTICATION,
    /** Vendor-side rate limit or quota. */
    QUOTA_EXCEEDED,
    /** Unclassified provider failure. */
    PROVIDER_ERROR,
    /** Local rate limiter or the saturated provider pool rejected the call. */
    RATE_LIMITED,
    /** Breaker excluded the provider. */
    CIRCUIT_OPEN,
    /** Caller cancelled the request. */
    CANCELLED,
    /** No enabled provider is configured for the category. */
    NO_PROVIDER_AVAILABLE,
    /** Every candidate was skipped or failed. */
    ALL_PROVIDERS_EXHAUSTED;

    /**
     * @return true when the error may be retried inside a single provider attempt
     */
    public boolean isRetryable() {
        return this == TRANSIENT;
    }

    /**
     * @return true when a terminal attempt with this error counts against the provider's breaker
     */
    public boolean chargesBreaker() {
        return this == TRANSIENT || this == AUTHENTICATION || this == PROVIDER_ERROR;
    }
}
