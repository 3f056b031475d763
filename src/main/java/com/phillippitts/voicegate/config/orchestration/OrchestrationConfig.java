package com.phillippitts.voicegate.config.orchestration;

import com.phillippitts.voicegate.config.properties.ProviderProperties;
import com.phillippitts.voicegate.config.properties.ResilienceProperties;
import com.phillippitts.voicegate.config.properties.ValidationProperties;
import com.phillippitts.voicegate.service.cache.ResultCache;
import com.phillippitts.voicegate.service.metrics.MetricsRecorder;
import com.phillippitts.voicegate.service.metrics.SpeechMetrics;
import com.phillippitts.voicegate.service.orchestration.VoiceOrchestrator;
import com.phillippitts.voicegate.service.orchestration.VoiceOrchestratorBuilder;
import com.phillippitts.voicegate.service.orchestration.event.BreakerStateChangedEvent;
import com.phillippitts.voicegate.service.provider.ProviderFactory;
import com.phillippitts.voicegate.service.provider.ProviderRegistry;
import com.phillippitts.voicegate.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.voicegate.service.resilience.RateLimiterRegistry;
import com.phillippitts.voicegate.service.resilience.RetryPolicy;
import com.phillippitts.voicegate.service.storage.ObjectStorage;
import com.phillippitts.voicegate.service.validation.RequestValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the orchestrator and the per-provider resilience state it owns.
 */
@Configuration
public class OrchestrationConfig {

    private final ResilienceProperties resilience;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public OrchestrationConfig(ResilienceProperties resilience, ApplicationEventPublisher publisher, Clock clock) {
        this.resilience = resilience;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Static registration table: every {@link ProviderFactory} bean, keyed by category and type.
     */
    @Bean
    public ProviderRegistry providerRegistry(List<ProviderFactory> factories, ProviderProperties providers) {
        return new ProviderRegistry(factories, clock, providers.getRetireGrace());
    }

    /**
     * Breakers publish every committed transition as an application event and count it.
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(SpeechMetrics metrics) {
        return new CircuitBreakerRegistry(resilience.getBreaker(), clock, (provider, from, to, failures) -> {
            metrics.recordBreakerTransition(provider, from.name(), to.name());
            publisher.publishEvent(new BreakerStateChangedEvent(provider, from, to, failures, clock.instant()));
        });
    }

    @Bean
    public RateLimiterRegistry rateLimiterRegistry() {
        return new RateLimiterRegistry(resilience.getRateLimit(), clock);
    }

    @Bean
    public RequestValidator requestValidator(ValidationProperties props) {
        return new RequestValidator(props);
    }

    @Bean
    public VoiceOrchestrator voiceOrchestrator(ProviderRegistry registry,
                                               CircuitBreakerRegistry breakers,
                                               RateLimiterRegistry limiters,
                                               ResultCache cache,
                                               MetricsRecorder metricsRecorder,
                                               SpeechMetrics speechMetrics,
                                               ObjectStorage storage,
                                               RequestValidator validator,
                                               ProviderProperties providers,
                                               @Qualifier("providerExecutor") Executor providerExecutor) {
        return VoiceOrchestratorBuilder.builder()
                .registry(registry)
                .breakers(breakers)
                .limiters(limiters)
                .cache(cache)
                .metrics(metricsRecorder)
                .meters(speechMetrics)
                .storage(storage)
                .validator(validator)
                .retryPolicy(RetryPolicy.from(resilience.getRetry()))
                .providerExecutor(providerExecutor)
                .publisher(publisher)
                .clock(clock)
                .providers(providers.toDescriptors())
                .build();
    }
}
