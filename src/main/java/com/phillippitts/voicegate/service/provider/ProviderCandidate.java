package com.phillippitts.voicegate.service.provider;

import com.phillippitts.voicegate.domain.ProviderDescriptor;

import java.util.Objects;

/**
 * A selectable provider: its descriptor paired with the cached adapter instance.
 */
public record ProviderCandidate(ProviderDescriptor descriptor, SpeechProvider adapter) {

    public ProviderCandidate {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(adapter, "adapter");
    }

    public String name() {
        return descriptor.name();
    }
}
