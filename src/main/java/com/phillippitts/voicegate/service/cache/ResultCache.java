package com.phillippitts.voicegate.service.cache;

import com.phillippitts.voicegate.config.properties.CacheProperties;
import com.phillippitts.voicegate.domain.OperationResult;
import com.phillippitts.voicegate.domain.SpeechRequest;
import com.phillippitts.voicegate.service.metrics.SpeechMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Best-effort result cache in front of the fallback chain.
 *
 * <p>Store failures never fail a request: a failed read is a miss, a failed write is dropped. Only
 * successful results are written.
 */
public class ResultCache {

    private static final Logger LOG = LogManager.getLogger(ResultCache.class);

    private final CacheStore store;
    private final CacheKeyFactory keys;
    private final ResultCodec codec;
    private final CacheProperties props;
    private final SpeechMetrics metrics;

    public ResultCache(CacheStore store, CacheKeyFactory keys, ResultCodec codec, CacheProperties props,
                       SpeechMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public boolean enabled() {
        return props.isEnabled();
    }

    public String keyFor(SpeechRequest request) {
        return keys.keyFor(request);
    }

    public Optional<OperationResult> lookup(String key, SpeechRequest request) {
        if (!props.isEnabled()) {
            return Optional.empty();
        }
        String op = request.category().label();
        try {
            Optional<OperationResult> hit = store.get(key).flatMap(bytes -> codec.decode(bytes, request.category()));
            if (hit.isPresent()) {
                metrics.incrementCacheHit(op);
            } else {
                metrics.incrementCacheMiss(op);
            }
            return hit;
        } catch (RuntimeException e) {
            LOG.warn("Cache read failed for {}; treating as miss: {}", op, e.toString());
            metrics.incrementCacheMiss(op);
            return Optional.empty();
        }
    }

    public void store(String key, OperationResult result) {
        if (!props.isEnabled() || !result.success()) {
            return;
        }
        try {
            store.set(key, codec.encode(result), props.getTtlSeconds());
        } catch (RuntimeException e) {
            LOG.warn("Cache write failed; result not cached: {}", e.toString());
        }
    }
}
