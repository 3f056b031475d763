package com.phillippitts.voicegate.service.provider;

import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.ProviderDescriptor;
import com.phillippitts.voicegate.exception.ProviderConfigurationException;
import com.phillippitts.voicegate.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active provider configuration and the adapter instances built from it.
 *
 * <p>The factory table is fixed at construction: one {@link ProviderFactory} per (category, type).
 * {@link #register(List)} validates a full descriptor list, builds every enabled adapter up front and
 * swaps the snapshot atomically, so configuration errors surface at registration and never at call time.
 *
 * <p>Adapters are cached by (name, settings fingerprint). Re-registering an unchanged descriptor reuses
 * its adapter. Adapters that drop out of the configuration are retired: in-flight requests may still hold
 * them through an older snapshot, so they are closed by the first registration at least one retire grace
 * period later, or on {@link #close()}.
 */
public class ProviderRegistry implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ProviderRegistry.class);

    public static final Duration DEFAULT_RETIRE_GRACE = Duration.ofMinutes(10);

    private record FactoryKey(ProviderCategory category, String type) {
    }

    private record AdapterKey(String name, String fingerprint) {
    }

    private record Retired(SpeechProvider adapter, Instant since) {
    }

    private final Map<FactoryKey, ProviderFactory> factories;
    private final Map<AdapterKey, SpeechProvider> adapters = new ConcurrentHashMap<>();
    private final List<Retired> retired = new ArrayList<>();
    private final AtomicReference<RegistrySnapshot> current = new AtomicReference<>(RegistrySnapshot.EMPTY);
    private final Clock clock;
    private final Duration retireGrace;

    public ProviderRegistry(List<ProviderFactory> factories) {
        this(factories, Clock.systemUTC(), DEFAULT_RETIRE_GRACE);
    }

    /**
     * @param retireGrace minimum time a dropped adapter stays open for requests still using an older snapshot
     */
    public ProviderRegistry(List<ProviderFactory> factories, Clock clock, Duration retireGrace) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retireGrace = Objects.requireNonNull(retireGrace, "retireGrace");
        if (retireGrace.isNegative()) {
            throw new IllegalArgumentException("retireGrace must not be negative");
        }
        Map<FactoryKey, ProviderFactory> table = new HashMap<>();
        for (ProviderFactory f : factories) {
            FactoryKey key = new FactoryKey(f.category(), f.type());
            ProviderFactory previous = table.putIfAbsent(key, f);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider factory for " + key);
            }
        }
        this.factories = Map.copyOf(table);
        LOG.info("Provider factory table: {}", table.keySet());
    }

    /**
     * Validates and activates a new configuration.
     *
     * @param descriptors full provider list (both categories)
     * @return the activated snapshot
     * @throws ProviderConfigurationException on duplicate names, unknown types or adapter construction failure;
     *                                        the previous configuration stays active
     */
    public synchronized RegistrySnapshot register(List<ProviderDescriptor> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors");
        Set<String> seen = new HashSet<>();
        for (ProviderDescriptor d : descriptors) {
            if (!seen.add(d.name())) {
                throw new ProviderConfigurationException("Duplicate provider name", d.name());
            }
        }

        Map<AdapterKey, SpeechProvider> built = new LinkedHashMap<>();
        Map<String, SpeechProvider> byName = new HashMap<>();
        try {
            for (ProviderDescriptor d : descriptors) {
                if (!d.enabled()) {
                    continue;
                }
                AdapterKey key = new AdapterKey(d.name(), d.settingsFingerprint());
                SpeechProvider adapter = adapters.get(key);
                if (adapter == null) {
                    adapter = build(d);
                    built.put(key, adapter);
                }
                byName.put(d.name(), adapter);
            }
        } catch (RuntimeException e) {
            built.values().forEach(ProviderRegistry::closeQuietly);
            throw e;
        }

        RegistrySnapshot snapshot = new RegistrySnapshot(descriptors, byName);
        Set<AdapterKey> live = new HashSet<>();
        descriptors.stream()
                .filter(ProviderDescriptor::enabled)
                .forEach(d -> live.add(new AdapterKey(d.name(), d.settingsFingerprint())));
        Instant now = clock.instant();
        adapters.putAll(built);
        adapters.entrySet().removeIf(e -> {
            if (live.contains(e.getKey())) {
                return false;
            }
            retired.add(new Retired(e.getValue(), now));
            return true;
        });
        current.set(snapshot);
        closeRetiredBefore(now.minus(retireGrace));
        LOG.info("Registered providers: stt={}, tts={}",
                names(snapshot.candidates(ProviderCategory.STT)), names(snapshot.candidates(ProviderCategory.TTS)));
        return snapshot;
    }

    public RegistrySnapshot snapshot() {
        return current.get();
    }

    /**
     * Ordered candidates of the current snapshot.
     */
    public List<ProviderCandidate> candidates(ProviderCategory category) {
        return current.get().candidates(category);
    }

    /** Number of adapter instances currently cached. */
    int cachedAdapterCount() {
        return adapters.size();
    }

    /** Number of retired adapters not yet closed. */
    synchronized int retiredAdapterCount() {
        return retired.size();
    }

    @Override
    public synchronized void close() {
        adapters.values().forEach(ProviderRegistry::closeQuietly);
        Set<SpeechProvider> closed = Collections.newSetFromMap(new IdentityHashMap<>());
        closed.addAll(adapters.values());
        adapters.clear();
        for (Retired r : retired) {
            if (closed.add(r.adapter())) {
                closeQuietly(r.adapter());
            }
        }
        retired.clear();
        current.set(RegistrySnapshot.EMPTY);
    }

    // A factory may hand the same instance back for a new fingerprint; a live adapter is never closed.
    private void closeRetiredBefore(Instant cutoff) {
        Set<SpeechProvider> live = Collections.newSetFromMap(new IdentityHashMap<>());
        live.addAll(adapters.values());
        Iterator<Retired> it = retired.iterator();
        while (it.hasNext()) {
            Retired r = it.next();
            if (live.contains(r.adapter())) {
                it.remove();
            } else if (!r.since().isAfter(cutoff)) {
                it.remove();
                LOG.info("Closing retired provider {} (retired at {})", r.adapter().name(), r.since());
                closeQuietly(r.adapter());
            }
        }
    }

    private SpeechProvider build(ProviderDescriptor d) {
        ProviderFactory factory = factories.get(new FactoryKey(d.category(), d.type()));
        if (factory == null) {
            throw new ProviderConfigurationException(
                    "No " + d.category().label() + " factory for type '" + d.type() + "'", d.name());
        }
        LOG.debug("Building provider {} type={} settings={}", d.name(), d.type(),
                LogSanitizer.maskSecrets(d.settings()));
        SpeechProvider adapter;
        try {
            adapter = factory.create(d);
        } catch (ProviderConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderConfigurationException("Adapter construction failed: " + e.getMessage(), d.name(), e);
        }
        if (adapter == null) {
            throw new ProviderConfigurationException("Factory returned no adapter", d.name());
        }
        boolean matches = d.category() == ProviderCategory.STT
                ? adapter instanceof SttProvider
                : adapter instanceof TtsProvider;
        if (!matches) {
            closeQuietly(adapter);
            throw new ProviderConfigurationException(
                    "Adapter does not implement the " + d.category().label() + " contract", d.name());
        }
        return adapter;
    }

    private static List<String> names(List<ProviderCandidate> candidates) {
        return candidates.stream().map(ProviderCandidate::name).toList();
    }

    private static void closeQuietly(SpeechProvider adapter) {
        try {
            adapter.close();
        } catch (Exception e) {
            LOG.warn("Error closing provider {}: {}", adapter.name(), e.toString());
        }
    }
}
