package com.phillippitts.voicegate.service.health;

import com.phillippitts.voicegate.config.properties.HealthMonitorProperties;
import com.phillippitts.voicegate.domain.HealthProbe;
import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.ProviderDescriptor;
import com.phillippitts.voicegate.domain.ProviderHealthSnapshot;
import com.phillippitts.voicegate.exception.ProviderNotFoundException;
import com.phillippitts.voicegate.service.provider.ProviderCandidate;
import com.phillippitts.voicegate.service.provider.ProviderRegistry;
import com.phillippitts.voicegate.service.provider.RegistrySnapshot;
import com.phillippitts.voicegate.service.resilience.CircuitBreaker;
import com.phillippitts.voicegate.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.voicegate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Background prober that feeds adapter health into the circuit breakers, independent of request traffic.
 *
 * <p>A failed probe is charged to the provider's breaker, so a dead provider can open before any request
 * reaches it. A passing probe only refreshes the latency reading; closing a breaker is left to real
 * traffic through the half-open probe.
 */
@Component
public class ProviderHealthMonitor {

    private static final Logger LOG = LogManager.getLogger(ProviderHealthMonitor.class);

    private final ProviderRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final HealthMonitorProperties props;
    private final Executor executor;

    private final ConcurrentMap<String, Boolean> lastProbeOk = new ConcurrentHashMap<>();

    public ProviderHealthMonitor(ProviderRegistry registry,
                                 CircuitBreakerRegistry breakers,
                                 HealthMonitorProperties props,
                                 @Qualifier("providerExecutor") Executor executor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.props = Objects.requireNonNull(props, "props");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Scheduled(initialDelayString = "${voice.health.interval:PT60S}", fixedDelayString = "${voice.health.interval:PT60S}")
    void scheduledProbe() {
        if (props.isEnabled()) {
            probeAll();
        }
    }

    /**
     * Probes every enabled provider once, sequentially. A saturated provider pool ends the round early;
     * providers left unchecked are not charged.
     *
     * @return probe outcome per provider name
     */
    public Map<String, HealthProbe> probeAll() {
        RegistrySnapshot snapshot = registry.snapshot();
        lastProbeOk.keySet().retainAll(configuredNames(snapshot));

        Map<String, HealthProbe> results = new LinkedHashMap<>();
        for (ProviderCategory category : ProviderCategory.values()) {
            for (ProviderCandidate candidate : snapshot.candidates(category)) {
                if (Thread.currentThread().isInterrupted()) {
                    return results;
                }
                HealthProbe probe;
                try {
                    probe = probe(candidate);
                } catch (RejectedExecutionException e) {
                    LOG.warn("Provider pool saturated, remaining health checks skipped this round");
                    logSummary(results);
                    return results;
                }
                apply(candidate.name(), probe);
                results.put(candidate.name(), probe);
            }
        }
        logSummary(results);
        return results;
    }

    /**
     * Current health of one provider, or of every configured provider when {@code provider} is empty.
     *
     * @throws ProviderNotFoundException if the named provider is not configured
     */
    public Map<String, ProviderHealthSnapshot> healthCheck(Optional<String> provider) {
        RegistrySnapshot snapshot = registry.snapshot();
        if (provider.isPresent()) {
            String name = provider.get();
            ProviderDescriptor descriptor = snapshot.descriptor(name)
                    .orElseThrow(() -> new ProviderNotFoundException(name));
            return Map.of(name, report(descriptor));
        }
        Map<String, ProviderHealthSnapshot> out = new LinkedHashMap<>();
        for (ProviderDescriptor descriptor : snapshot.descriptors()) {
            out.put(descriptor.name(), report(descriptor));
        }
        return out;
    }

    private ProviderHealthSnapshot report(ProviderDescriptor descriptor) {
        CircuitBreaker breaker = breakers.forProvider(descriptor.name());
        return breaker.snapshot().withContext(descriptor.category(), lastProbeOk.get(descriptor.name()));
    }

    /**
     * @throws RejectedExecutionException when the provider pool is saturated
     */
    HealthProbe probe(ProviderCandidate candidate) {
        long start = System.nanoTime();
        FutureTask<HealthProbe> task = new FutureTask<>(() -> candidate.adapter().health());
        executor.execute(task);
        try {
            HealthProbe probe = task.get(props.getProbeTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return probe != null ? probe : HealthProbe.down(TimeUtils.elapsedMillisPrecise(start), "no probe result");
        } catch (TimeoutException e) {
            task.cancel(true);
            return HealthProbe.down(TimeUtils.elapsedMillisPrecise(start), "probe timed out");
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            return HealthProbe.down(TimeUtils.elapsedMillisPrecise(start), "probe interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return HealthProbe.down(TimeUtils.elapsedMillisPrecise(start), cause.toString());
        } catch (RuntimeException e) {
            return HealthProbe.down(TimeUtils.elapsedMillisPrecise(start), e.toString());
        }
    }

    private void apply(String provider, HealthProbe probe) {
        CircuitBreaker breaker = breakers.forProvider(provider);
        Boolean previous = lastProbeOk.put(provider, probe.ok());
        if (probe.ok()) {
            breaker.recordLatency(probe.latencyMs());
            if (Boolean.FALSE.equals(previous)) {
                LOG.info("Health probe for {} passing again ({}ms)", provider, Math.round(probe.latencyMs()));
            }
        } else {
            breaker.recordFailure();
            LOG.warn("Health probe failed for {}: {}", provider, probe.detail());
        }
    }

    private static Set<String> configuredNames(RegistrySnapshot snapshot) {
        return snapshot.descriptors().stream().map(ProviderDescriptor::name).collect(Collectors.toSet());
    }

    private void logSummary(Map<String, HealthProbe> results) {
        if (results.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder("Provider health: ");
        results.forEach((name, probe) -> sb.append(name).append('=')
                .append(probe.ok() ? "ok" : "failing").append('/')
                .append(breakers.forProvider(name).currentState()).append(' '));
        LOG.info(sb.toString().trim());
    }
}
