package com.phillippitts.voicegate.service.cache;

import java.util.Optional;

/**
 * TTL key-value store used to memoize results. No transactional or locking guarantees: callers must
 * tolerate stale or missing entries.
 */
public interface CacheStore {

    /**
     * @return the stored bytes, or empty when absent or expired
     */
    Optional<byte[]> get(String key);

    /**
     * Stores a value, replacing any previous one.
     *
     * @param ttlSeconds time to live, positive
     */
    void set(String key, byte[] value, long ttlSeconds);
}
