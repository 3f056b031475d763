package com.phillippitts.voicegate.service.provider;

import com.phillippitts.voicegate.domain.ProviderDescriptor;
import com.phillippitts.voicegate.exception.ProviderConfigurationException;

import java.util.Map;

/**
 * Typed accessors over a descriptor's opaque settings map for use inside {@link ProviderFactory}s.
 * Missing or malformed values raise {@link ProviderConfigurationException} naming the provider.
 */
public final class ProviderSettings {

    private final String provider;
    private final Map<String, String> values;

    private ProviderSettings(String provider, Map<String, String> values) {
        this.provider = provider;
        this.values = values;
    }

    public static ProviderSettings of(ProviderDescriptor descriptor) {
        return new ProviderSettings(descriptor.name(), descriptor.settings());
    }

    public String required(String key) {
        String v = values.get(key);
        if (v == null || v.isBlank()) {
            throw new ProviderConfigurationException("Missing required setting '" + key + "'", provider);
        }
        return v.trim();
    }

    public String optional(String key, String defaultValue) {
        String v = values.get(key);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    public int positiveInt(String key, int defaultValue) {
        String v = values.get(key);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(v.trim());
            if (parsed <= 0) {
                throw new ProviderConfigurationException("Setting '" + key + "' must be positive, got " + v, provider);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ProviderConfigurationException("Setting '" + key + "' is not an integer: " + v, provider, e);
        }
    }
}
