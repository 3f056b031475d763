package com.phillippitts.voicegate.service.provider;

import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.ProviderDescriptor;

/**
 * One entry of the static provider registration table.
 *
 * <p>Factories are Spring beans collected at startup; the registry maps
 * ({@link #category()}, {@link #type()}) to the factory and never looks classes up by name.
 */
public interface ProviderFactory {

    /** Key matched against {@link ProviderDescriptor#type()}. */
    String type();

    ProviderCategory category();

    /**
     * Builds an adapter from the descriptor's settings.
     *
     * @throws com.phillippitts.voicegate.exception.ProviderConfigurationException if the settings are invalid
     */
    SpeechProvider create(ProviderDescriptor descriptor);
}
