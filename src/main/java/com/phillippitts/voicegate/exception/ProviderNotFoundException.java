package com.phillippitts.voicegate.exception;

/**
 * Thrown when a status or statistics lookup names a provider that is not configured.
 */
public class ProviderNotFoundException extends VoiceGateException {

    private final String providerName;

    public ProviderNotFoundException(String providerName) {
        super("Provider not configured: " + providerName);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
