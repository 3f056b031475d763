package com.phillippitts.voicegate.service.resilience;

import com.phillippitts.voicegate.config.properties.ResilienceProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns exactly one {@link CircuitBreaker} per provider name.
 *
 * <p>Breakers outlive configuration snapshots: a reload keeps the breaker of every provider that is
 * still configured and drops the rest.
 */
public class CircuitBreakerRegistry {

    private static final Logger LOG = LogManager.getLogger(CircuitBreakerRegistry.class);

    private final ResilienceProperties.Breaker props;
    private final Clock clock;
    private final BreakerTransitionListener listener;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(ResilienceProperties.Breaker props, Clock clock,
                                  BreakerTransitionListener listener) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = listener;
    }

    /**
     * Returns the breaker for a provider, creating a CLOSED one on first use.
     */
    public CircuitBreaker forProvider(String provider) {
        return breakers.computeIfAbsent(provider,
                name -> new CircuitBreaker(name, props.getFailureThreshold(), props.getCooldown(), clock, listener));
    }

    public Optional<CircuitBreaker> find(String provider) {
        return Optional.ofNullable(breakers.get(provider));
    }

    public Collection<CircuitBreaker> all() {
        return breakers.values();
    }

    /** Whether authentication failures open the breaker on first occurrence. */
    public boolean opensOnAuthenticationFailure() {
        return props.isOpenOnAuthenticationFailure();
    }

    /**
     * Drops the breakers of providers that are no longer configured.
     *
     * @param configured provider names of the new configuration
     */
    public void retainOnly(Set<String> configured) {
        breakers.keySet().removeIf(name -> {
            boolean remove = !configured.contains(name);
            if (remove) {
                LOG.info("Discarding breaker state for removed provider {}", name);
            }
            return remove;
        });
    }
}
