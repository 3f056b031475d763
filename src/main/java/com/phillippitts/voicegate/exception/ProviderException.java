package com.phillippitts.voicegate.exception;

import com.phillippitts.voicegate.domain.ErrorKind;

import java.util.Objects;

/**
 * Thrown by provider adapters when a vendor call fails.
 *
 * <p>The {@link ErrorKind} drives retry and breaker accounting in the fallback loop. Prefer the typed
 * subclasses or {@link ProviderExceptionBuilder} over constructing this class directly.
 */
public class ProviderException extends VoiceGateException {

    private final ErrorKind kind;
    private final String providerName;

    public ProviderException(ErrorKind kind, String message, String providerName) {
        super(format(message, providerName));
        this.kind = Objects.requireNonNull(kind, "kind");
        this.providerName = providerName != null ? providerName : "unknown";
    }

    public ProviderException(ErrorKind kind, String message, String providerName, Throwable cause) {
        super(format(message, providerName), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.providerName = providerName != null ? providerName : "unknown";
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getProviderName() {
        return providerName;
    }

    private static String format(String message, String providerName) {
        return providerName == null ? message : message + " (provider: " + providerName + ")";
    }
}
