package com.phillippitts.voicegate.service.orchestration;

import com.phillippitts.voicegate.domain.ProviderDescriptor;
import com.phillippitts.voicegate.service.cache.ResultCache;
import com.phillippitts.voicegate.service.metrics.MetricsRecorder;
import com.phillippitts.voicegate.service.metrics.SpeechMetrics;
import com.phillippitts.voicegate.service.provider.ProviderRegistry;
import com.phillippitts.voicegate.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.voicegate.service.resilience.RateLimiterRegistry;
import com.phillippitts.voicegate.service.resilience.RetryPolicy;
import com.phillippitts.voicegate.service.resilience.Sleeper;
import com.phillippitts.voicegate.service.storage.ObjectStorage;
import com.phillippitts.voicegate.service.validation.RequestValidator;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Builder for {@link VoiceOrchestrator}.
 *
 * <pre>{@code
 * VoiceOrchestrator orchestrator = VoiceOrchestratorBuilder.builder()
 *     .registry(registry)
 *     .breakers(breakers)
 *     .limiters(limiters)
 *     .cache(cache)
 *     .metrics(recorder)
 *     .meters(speechMetrics)
 *     .storage(storage)
 *     .validator(validator)
 *     .retryPolicy(RetryPolicy.from(props.getRetry()))
 *     .providerExecutor(executor)
 *     .publisher(publisher)
 *     .clock(clock)
 *     .providers(providerProps.toDescriptors())
 *     .build();
 * }</pre>
 *
 * <p>{@code providers}, {@code sleeper} and {@code jitterSource} are optional.
 */
public final class VoiceOrchestratorBuilder {

    private ProviderRegistry registry;
    private CircuitBreakerRegistry breakers;
    private RateLimiterRegistry limiters;
    private ResultCache cache;
    private MetricsRecorder metrics;
    private SpeechMetrics meters;
    private ObjectStorage storage;
    private RequestValidator validator;
    private RetryPolicy retryPolicy;
    private Executor providerExecutor;
    private ApplicationEventPublisher publisher;
    private Clock clock;

    private List<ProviderDescriptor> providers = List.of();
    private Sleeper sleeper = Sleeper.THREAD;
    private DoubleSupplier jitterSource = () -> ThreadLocalRandom.current().nextDouble();

    private VoiceOrchestratorBuilder() {
    }

    public static VoiceOrchestratorBuilder builder() {
        return new VoiceOrchestratorBuilder();
    }

    public VoiceOrchestratorBuilder registry(ProviderRegistry registry) {
        this.registry = registry;
        return this;
    }

    public VoiceOrchestratorBuilder breakers(CircuitBreakerRegistry breakers) {
        this.breakers = breakers;
        return this;
    }

    public VoiceOrchestratorBuilder limiters(RateLimiterRegistry limiters) {
        this.limiters = limiters;
        return this;
    }

    public VoiceOrchestratorBuilder cache(ResultCache cache) {
        this.cache = cache;
        return this;
    }

    public VoiceOrchestratorBuilder metrics(MetricsRecorder metrics) {
        this.metrics = metrics;
        return this;
    }

    public VoiceOrchestratorBuilder meters(SpeechMetrics meters) {
        this.meters = meters;
        return this;
    }

    public VoiceOrchestratorBuilder storage(ObjectStorage storage) {
        this.storage = storage;
        return this;
    }

    public VoiceOrchestratorBuilder validator(RequestValidator validator) {
        this.validator = validator;
        return this;
    }

    public VoiceOrchestratorBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        return this;
    }

    /**
     * Executor that runs adapter calls so a per-attempt deadline can interrupt them.
     */
    public VoiceOrchestratorBuilder providerExecutor(Executor providerExecutor) {
        this.providerExecutor = providerExecutor;
        return this;
    }

    public VoiceOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public VoiceOrchestratorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Descriptors registered by {@link VoiceOrchestrator#init()}.
     */
    public VoiceOrchestratorBuilder providers(List<ProviderDescriptor> providers) {
        this.providers = providers;
        return this;
    }

    /**
     * Backoff sleeper; tests pass a recording no-op.
     */
    public VoiceOrchestratorBuilder sleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
        return this;
    }

    /**
     * Source of uniform [0, 1) values for backoff jitter.
     */
    public VoiceOrchestratorBuilder jitterSource(DoubleSupplier jitterSource) {
        this.jitterSource = jitterSource;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     */
    public VoiceOrchestrator build() {
        Objects.requireNonNull(registry, "registry is required");
        Objects.requireNonNull(breakers, "breakers is required");
        Objects.requireNonNull(limiters, "limiters is required");
        Objects.requireNonNull(cache, "cache is required");
        Objects.requireNonNull(metrics, "metrics is required");
        Objects.requireNonNull(meters, "meters is required");
        Objects.requireNonNull(storage, "storage is required");
        Objects.requireNonNull(validator, "validator is required");
        Objects.requireNonNull(retryPolicy, "retryPolicy is required");
        Objects.requireNonNull(providerExecutor, "providerExecutor is required");
        Objects.requireNonNull(publisher, "publisher is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(providers, "providers must not be null");

        ProviderAttemptRunner attempts = new ProviderAttemptRunner(providerExecutor, retryPolicy, sleeper,
                jitterSource);
        FallbackChainExecutor chain = new FallbackChainExecutor(breakers, limiters, cache, metrics, meters,
                storage, attempts, publisher, clock);
        return new VoiceOrchestrator(registry, breakers, limiters, validator, metrics, chain, providers);
    }
}
