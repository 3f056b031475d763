package com.phillippitts.voicegate.service.orchestration;

import com.phillippitts.voicegate.domain.DailyStats;
import com.phillippitts.voicegate.domain.ErrorKind;
import com.phillippitts.voicegate.domain.OperationError;
import com.phillippitts.voicegate.domain.OperationResult;
import com.phillippitts.voicegate.domain.ProviderDescriptor;
import com.phillippitts.voicegate.domain.SpeechRequest;
import com.phillippitts.voicegate.domain.SttRequest;
import com.phillippitts.voicegate.domain.SttResponse;
import com.phillippitts.voicegate.domain.TtsRequest;
import com.phillippitts.voicegate.domain.TtsResponse;
import com.phillippitts.voicegate.exception.InvalidRequestException;
import com.phillippitts.voicegate.exception.OrchestratorNotReadyException;
import com.phillippitts.voicegate.service.metrics.MetricsRecorder;
import com.phillippitts.voicegate.service.provider.ProviderRegistry;
import com.phillippitts.voicegate.service.provider.RegistrySnapshot;
import com.phillippitts.voicegate.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.voicegate.service.resilience.RateLimiterRegistry;
import com.phillippitts.voicegate.service.validation.RequestValidator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Entry point for speech requests. Owns the provider registry and the per-provider breaker and limiter
 * sets it was built with; there is no global instance.
 *
 * <p>Every call returns a result object. The only exception that escapes {@code process*} is
 * {@link OrchestratorNotReadyException}, thrown before {@link #init()} or after {@link #shutdown()}.
 *
 * <p>Cancellation: interrupting the calling thread aborts the current provider call and yields a
 * {@link ErrorKind#CANCELLED} result with the interrupt flag still set.
 *
 * @see VoiceOrchestratorBuilder
 */
public class VoiceOrchestrator {

    private static final Logger LOG = LogManager.getLogger(VoiceOrchestrator.class);

    static final String MDC_REQUEST_ID = "requestId";
    static final String MDC_OPERATION = "operation";
    static final String MDC_TENANT_ID = "tenantId";

    enum Lifecycle { NEW, RUNNING, STOPPED }

    private final ProviderRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final RateLimiterRegistry limiters;
    private final RequestValidator validator;
    private final MetricsRecorder metrics;
    private final FallbackChainExecutor chain;
    private final List<ProviderDescriptor> initialProviders;
    private final AtomicReference<Lifecycle> lifecycle = new AtomicReference<>(Lifecycle.NEW);

    VoiceOrchestrator(ProviderRegistry registry,
                      CircuitBreakerRegistry breakers,
                      RateLimiterRegistry limiters,
                      RequestValidator validator,
                      MetricsRecorder metrics,
                      FallbackChainExecutor chain,
                      List<ProviderDescriptor> initialProviders) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.breakers = Objects.requireNonNull(breakers, "breakers must not be null");
        this.limiters = Objects.requireNonNull(limiters, "limiters must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.chain = Objects.requireNonNull(chain, "chain must not be null");
        this.initialProviders = List.copyOf(initialProviders);
    }

    /**
     * Loads the configured providers. Fails with
     * {@link com.phillippitts.voicegate.exception.ProviderConfigurationException} when a descriptor
     * cannot be turned into an adapter.
     */
    @PostConstruct
    public void init() {
        if (lifecycle.get() == Lifecycle.RUNNING) {
            return;
        }
        if (lifecycle.get() == Lifecycle.STOPPED) {
            throw new OrchestratorNotReadyException("Orchestrator was shut down and cannot be restarted");
        }
        applyDescriptors(initialProviders);
        lifecycle.set(Lifecycle.RUNNING);
        LOG.info("Voice orchestrator started with {} provider(s)", initialProviders.size());
    }

    @PreDestroy
    public void shutdown() {
        if (lifecycle.getAndSet(Lifecycle.STOPPED) == Lifecycle.STOPPED) {
            return;
        }
        registry.close();
        LOG.info("Voice orchestrator stopped");
    }

    public boolean isRunning() {
        return lifecycle.get() == Lifecycle.RUNNING;
    }

    /**
     * Swaps the provider configuration. Requests already in flight finish against the snapshot they
     * started with; breaker state is kept for names that remain configured.
     */
    public void reload(List<ProviderDescriptor> descriptors) {
        ensureRunning();
        applyDescriptors(descriptors);
        LOG.info("Provider configuration reloaded: {} provider(s)", descriptors.size());
    }

    public SttResponse processStt(SttRequest request) {
        return processStt(request, null);
    }

    public SttResponse processStt(SttRequest request, List<String> chainOverride) {
        return (SttResponse) process(request, chainOverride);
    }

    public TtsResponse processTts(TtsRequest request) {
        return processTts(request, null);
    }

    public TtsResponse processTts(TtsRequest request, List<String> chainOverride) {
        return (TtsResponse) process(request, chainOverride);
    }

    /**
     * Runs one request through cache lookup and the provider fallback chain.
     *
     * @param request       STT or TTS request
     * @param chainOverride provider names to try, in order; null or empty for priority order
     * @return normalized result, never null
     * @throws OrchestratorNotReadyException if the orchestrator is not running
     */
    public OperationResult process(SpeechRequest request, List<String> chainOverride) {
        ensureRunning();
        Objects.requireNonNull(request, "request must not be null");
        long start = System.nanoTime();
        String previousRequestId = ThreadContext.get(MDC_REQUEST_ID);
        String previousOperation = ThreadContext.get(MDC_OPERATION);
        String previousTenant = ThreadContext.get(MDC_TENANT_ID);
        try {
            if (previousRequestId == null) {
                ThreadContext.put(MDC_REQUEST_ID, UUID.randomUUID().toString());
            }
            ThreadContext.put(MDC_OPERATION, request.category().label());
            if (request.tenantId() != null) {
                ThreadContext.put(MDC_TENANT_ID, request.tenantId());
            }

            try {
                validator.validate(request);
            } catch (InvalidRequestException e) {
                LOG.warn("Rejected {} request: {}", request.category().label(), e.getMessage());
                return FallbackChainExecutor.failure(request.category(),
                        OperationError.of(ErrorKind.VALIDATION, e.getMessage()), start);
            }

            RegistrySnapshot snapshot = registry.snapshot();
            List<String> override = chainOverride == null || chainOverride.isEmpty() ? null : chainOverride;
            return chain.execute(request, snapshot, override, start);
        } finally {
            restore(MDC_REQUEST_ID, previousRequestId);
            restore(MDC_OPERATION, previousOperation);
            restore(MDC_TENANT_ID, previousTenant);
        }
    }

    /**
     * Aggregates the recorded samples of one UTC day.
     */
    public DailyStats getDailyStats(Optional<String> provider, LocalDate day) {
        return metrics.getDailyStats(provider, day);
    }

    public RegistrySnapshot providers() {
        return registry.snapshot();
    }

    private void applyDescriptors(List<ProviderDescriptor> descriptors) {
        registry.register(descriptors);
        Set<String> names = descriptors.stream()
                .map(ProviderDescriptor::name)
                .collect(Collectors.toSet());
        breakers.retainOnly(names);
        limiters.retainOnly(names);
    }

    private void ensureRunning() {
        Lifecycle state = lifecycle.get();
        if (state != Lifecycle.RUNNING) {
            throw new OrchestratorNotReadyException("Orchestrator is not running (state=" + state + ")");
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            ThreadContext.remove(key);
        } else {
            ThreadContext.put(key, previous);
        }
    }
}
