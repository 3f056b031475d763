package com.phillippitts.voicegate.service.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded in-process {@link CacheStore}. Expired entries are dropped on read and by a periodic purge;
 * when full, the entry closest to expiry is evicted.
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryCacheStore.class);

    private record Entry(byte[] value, Instant expiresAt) {
    }

    private final int maxEntries;
    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public InMemoryCacheStore(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<byte[]> get(String key) {
        Entry e = entries.get(key);
        if (e == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(e.expiresAt())) {
            entries.remove(key, e);
            return Optional.empty();
        }
        return Optional.of(e.value().clone());
    }

    @Override
    public void set(String key, byte[] value, long ttlSeconds) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive");
        }
        if (!entries.containsKey(key) && entries.size() >= maxEntries) {
            purgeExpired();
            if (entries.size() >= maxEntries) {
                evictSoonestExpiring();
            }
        }
        entries.put(key, new Entry(value.clone(), clock.instant().plusSeconds(ttlSeconds)));
    }

    /**
     * Removes expired entries.
     *
     * @return number of entries removed
     */
    @Scheduled(fixedDelayString = "${voice.cache.purge-interval-ms:60000}")
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
        int removed = before - entries.size();
        if (removed > 0) {
            LOG.debug("Purged {} expired cache entries", removed);
        }
        return Math.max(0, removed);
    }

    public int size() {
        return entries.size();
    }

    private void evictSoonestExpiring() {
        entries.entrySet().stream()
                .min(Comparator.comparing(e -> e.getValue().expiresAt()))
                .ifPresent(e -> entries.remove(e.getKey(), e.getValue()));
    }
}
