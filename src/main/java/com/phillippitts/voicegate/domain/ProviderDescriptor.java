package com.phillippitts.voicegate.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Identity and policy for one configured provider instance.
 *
 * <p>Descriptors are immutable. Reconfiguration replaces the whole list; a descriptor that is in use by
 * an in-flight request is never mutated.
 *
 * @param name     unique provider name (also the breaker / rate-limiter key)
 * @param type     key into the provider factory table; defaults to {@code name}
 * @param category STT or TTS
 * @param priority lower value is tried first
 * @param enabled  disabled descriptors are kept for reporting but never selected
 * @param settings opaque settings handed to the adapter factory
 */
public record ProviderDescriptor(
        String name,
        String type,
        ProviderCategory category,
        int priority,
        boolean enabled,
        Map<String, String> settings
) {

    public ProviderDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        Objects.requireNonNull(category, "category");
        type = (type == null || type.isBlank()) ? name : type;
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Convenience factory for an enabled descriptor whose type equals its name.
     */
    public static ProviderDescriptor of(String name, ProviderCategory category, int priority,
                                        Map<String, String> settings) {
        return new ProviderDescriptor(name, name, category, priority, true, settings);
    }

    /**
     * Stable hash of type and settings. Two descriptors with the same name and fingerprint can share one
     * adapter instance.
     *
     * @return hex-encoded SHA-256 over the sorted settings
     */
    public String settingsFingerprint() {
        StringBuilder canonical = new StringBuilder(type).append('|');
        new TreeMap<>(settings).forEach((k, v) -> canonical.append(k).append('=').append(v).append(';'));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
