package com.phillippitts.voicegate.domain;

import java.util.Objects;
import java.util.Set;

/**
 * Static capabilities advertised by an adapter.
 *
 * @param category           STT or TTS
 * @param supportedLanguages language codes; empty means "any"
 * @param supportedFormats   audio formats accepted (STT) or produced (TTS); empty means "any"
 */
public record ProviderCapabilities(
        ProviderCategory category,
        Set<String> supportedLanguages,
        Set<String> supportedFormats
) {
    public ProviderCapabilities {
        Objects.requireNonNull(category, "category");
        supportedLanguages = supportedLanguages == null ? Set.of() : Set.copyOf(supportedLanguages);
        supportedFormats = supportedFormats == null ? Set.of() : Set.copyOf(supportedFormats);
    }
}
