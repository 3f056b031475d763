package com.phillippitts.voicegate.service.resilience;

import com.phillippitts.voicegate.config.properties.ResilienceProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Holds one {@link ProviderRateLimiter} per provider and, when enabled, one fairness bucket per
 * (tenant, provider) pair.
 *
 * <p>Tenant buckets are created on first use and dropped by {@link #purgeIdleTenants()} once they have
 * refilled to capacity.
 */
public class RateLimiterRegistry {

    private static final Logger LOG = LogManager.getLogger(RateLimiterRegistry.class);

    private final ResilienceProperties.RateLimit props;
    private final Clock clock;
    private final Map<String, ProviderRateLimiter> providers = new ConcurrentHashMap<>();
    private final Map<String, TokenBucket> tenants = new ConcurrentHashMap<>();

    public RateLimiterRegistry(ResilienceProperties.RateLimit props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Non-blocking acquire for one provider call.
     *
     * @param provider provider name
     * @param tenantId calling tenant, or null
     * @return a permit, or empty when either the provider or the tenant budget is exhausted
     */
    public Optional<ProviderPermit> tryAcquire(String provider, String tenantId) {
        ProviderRateLimiter limiter = forProvider(provider);
        Optional<ProviderPermit> permit = limiter.tryAcquire();
        if (permit.isEmpty()) {
            return permit;
        }
        if (!tenantAllows(provider, tenantId)) {
            limiter.giveBack(permit.get());
            return Optional.empty();
        }
        return permit;
    }

    public ProviderRateLimiter forProvider(String provider) {
        return providers.computeIfAbsent(provider, name -> new ProviderRateLimiter(name,
                props.getRequestsPerSecond(), props.getBurst(), props.getMaxConcurrent(), clock));
    }

    public void retainOnly(Set<String> configured) {
        providers.keySet().removeIf(name -> !configured.contains(name));
        tenants.keySet().removeIf(key -> !configured.contains(key.substring(key.indexOf(':') + 1)));
    }

    /**
     * Drops tenant buckets that have refilled to capacity.
     *
     * @return number of buckets removed
     */
    @Scheduled(fixedDelayString = "${voice.resilience.rate-limit.tenant-purge-interval-ms:60000}")
    public int purgeIdleTenants() {
        int removed = 0;
        for (String key : new ArrayList<>(tenants.keySet())) {
            AtomicBoolean dropped = new AtomicBoolean();
            tenants.computeIfPresent(key, (k, bucket) -> {
                dropped.set(bucket.isFull());
                return dropped.get() ? null : bucket;
            });
            if (dropped.get()) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debug("Purged {} idle tenant rate-limit buckets", removed);
        }
        return removed;
    }

    int tenantBucketCount() {
        return tenants.size();
    }

    private boolean tenantAllows(String provider, String tenantId) {
        int perMinute = props.getTenantRequestsPerMinute();
        if (perMinute <= 0 || tenantId == null || tenantId.isBlank()) {
            return true;
        }
        // tenant ids must not contain ':' for retainOnly to parse the key back
        String key = tenantId.replace(':', '_') + ':' + provider;
        AtomicBoolean allowed = new AtomicBoolean();
        // take the token inside compute so a concurrent purge cannot drop the bucket in between
        tenants.compute(key, (k, bucket) -> {
            TokenBucket b = bucket != null ? bucket : new TokenBucket(perMinute, perMinute / 60.0, clock);
            allowed.set(b.tryAcquire());
            return b;
        });
        return allowed.get();
    }
}
