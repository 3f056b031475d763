package com.phillippitts.voicegate.exception;

/**
 * Thrown at registration time when a provider descriptor cannot be turned into an adapter:
 * unknown type, duplicate name or a factory failure.
 */
public class ProviderConfigurationException extends VoiceGateException {

    private final String providerName;

    public ProviderConfigurationException(String message, String providerName) {
        super(message + " (provider: " + providerName + ")");
        this.providerName = providerName;
    }

    public ProviderConfigurationException(String message, String providerName, Throwable cause) {
        super(message + " (provider: " + providerName + ")", cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
