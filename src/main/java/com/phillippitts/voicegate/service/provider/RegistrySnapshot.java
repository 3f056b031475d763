package com.phillippitts.voicegate.service.provider;

import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.ProviderDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of one provider configuration. A request reads a single snapshot from start to end,
 * so a concurrent reload never changes the chain under it.
 */
public final class RegistrySnapshot {

    private static final Logger LOG = LogManager.getLogger(RegistrySnapshot.class);

    static final RegistrySnapshot EMPTY = new RegistrySnapshot(List.of(), Map.of());

    private final List<ProviderDescriptor> descriptors;
    private final Map<String, ProviderDescriptor> byName;
    private final Map<ProviderCategory, List<ProviderCandidate>> candidates;

    RegistrySnapshot(List<ProviderDescriptor> descriptors, Map<String, SpeechProvider> adapters) {
        this.descriptors = List.copyOf(descriptors);
        Map<String, ProviderDescriptor> names = new LinkedHashMap<>();
        descriptors.forEach(d -> names.put(d.name(), d));
        this.byName = Map.copyOf(names);

        Map<ProviderCategory, List<ProviderCandidate>> ordered = new EnumMap<>(ProviderCategory.class);
        for (ProviderCategory category : ProviderCategory.values()) {
            List<ProviderCandidate> list = new ArrayList<>();
            for (ProviderDescriptor d : descriptors) {
                if (d.category() == category && d.enabled()) {
                    list.add(new ProviderCandidate(d, adapters.get(d.name())));
                }
            }
            // List.sort is stable: equal priorities keep registration order
            list.sort(Comparator.comparingInt(c -> c.descriptor().priority()));
            ordered.put(category, List.copyOf(list));
        }
        this.candidates = ordered;
    }

    /**
     * Enabled providers of a category, ascending priority, registration order on ties.
     */
    public List<ProviderCandidate> candidates(ProviderCategory category) {
        return candidates.get(category);
    }

    /**
     * Enabled providers of a category restricted to and ordered by {@code chain}.
     * Names that are unknown, disabled or of another category are skipped with a warning.
     */
    public List<ProviderCandidate> candidates(ProviderCategory category, List<String> chain) {
        if (chain == null || chain.isEmpty()) {
            return candidates(category);
        }
        Map<String, ProviderCandidate> enabled = new LinkedHashMap<>();
        candidates(category).forEach(c -> enabled.put(c.name(), c));
        List<ProviderCandidate> out = new ArrayList<>(chain.size());
        for (String name : chain) {
            ProviderCandidate c = enabled.get(name);
            if (c == null) {
                LOG.warn("Chain override names unusable {} provider '{}'; skipping", category.label(), name);
            } else if (!out.contains(c)) {
                out.add(c);
            }
        }
        return List.copyOf(out);
    }

    public Optional<ProviderDescriptor> descriptor(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /** All configured descriptors, disabled ones included, in registration order. */
    public List<ProviderDescriptor> descriptors() {
        return descriptors;
    }
}
