package com.phillippitts.voicegate.service.orchestration;

import com.phillippitts.voicegate.domain.ErrorKind;
import com.phillippitts.voicegate.domain.MetricSample;
import com.phillippitts.voicegate.domain.OperationError;
import com.phillippitts.voicegate.domain.OperationResult;
import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.SpeechRequest;
import com.phillippitts.voicegate.domain.SttRequest;
import com.phillippitts.voicegate.domain.SttResponse;
import com.phillippitts.voicegate.domain.Synthesis;
import com.phillippitts.voicegate.domain.Transcription;
import com.phillippitts.voicegate.domain.TtsResponse;
import com.phillippitts.voicegate.exception.VoiceGateException;
import com.phillippitts.voicegate.service.cache.ResultCache;
import com.phillippitts.voicegate.service.metrics.MetricsRecorder;
import com.phillippitts.voicegate.service.metrics.SpeechMetrics;
import com.phillippitts.voicegate.service.orchestration.event.ProviderFailureEvent;
import com.phillippitts.voicegate.service.provider.ProviderCandidate;
import com.phillippitts.voicegate.service.provider.RegistrySnapshot;
import com.phillippitts.voicegate.service.resilience.CircuitBreaker;
import com.phillippitts.voicegate.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.voicegate.service.resilience.ProviderPermit;
import com.phillippitts.voicegate.service.resilience.RateLimiterRegistry;
import com.phillippitts.voicegate.service.storage.ObjectStorage;
import com.phillippitts.voicegate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sequential fallback over the ordered candidates of one registry snapshot.
 *
 * <p>Per candidate: breaker gate, rate-limiter gate, attempt (with retry and deadline), then exactly one
 * breaker update and one metric sample. Gate rejections are skips: no sample, no breaker charge.
 * Candidates are never tried in parallel.
 *
 * <p>Breaker accounting per terminal attempt outcome:
 * <ul>
 *   <li>success: recordSuccess</li>
 *   <li>TRANSIENT, PROVIDER_ERROR: one recordFailure, however many retries were made</li>
 *   <li>AUTHENTICATION: one recordFailure, tripping immediately when so configured</li>
 *   <li>QUOTA_EXCEEDED, VALIDATION: not charged</li>
 *   <li>cancelled: not charged; a held half-open probe slot is released</li>
 *   <li>skipped because the provider pool never started the call: handled like a gate rejection</li>
 * </ul>
 */
class FallbackChainExecutor {

    private static final Logger LOG = LogManager.getLogger(FallbackChainExecutor.class);

    private final CircuitBreakerRegistry breakers;
    private final RateLimiterRegistry limiters;
    private final ResultCache cache;
    private final MetricsRecorder metrics;
    private final SpeechMetrics meters;
    private final ObjectStorage storage;
    private final ProviderAttemptRunner attempts;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    FallbackChainExecutor(CircuitBreakerRegistry breakers, RateLimiterRegistry limiters, ResultCache cache,
                          MetricsRecorder metrics, SpeechMetrics meters, ObjectStorage storage,
                          ProviderAttemptRunner attempts, ApplicationEventPublisher publisher, Clock clock) {
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.limiters = Objects.requireNonNull(limiters, "limiters");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.meters = Objects.requireNonNull(meters, "meters");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.attempts = Objects.requireNonNull(attempts, "attempts");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs the chain for an already validated request.
     *
     * @param snapshot      configuration the request was started with
     * @param chainOverride explicit provider order, or null for priority order
     * @param startNanos    request start, for processing time
     */
    OperationResult execute(SpeechRequest request, RegistrySnapshot snapshot, List<String> chainOverride,
                            long startNanos) {
        String cacheKey = cache.enabled() ? cache.keyFor(request) : null;
        if (cacheKey != null) {
            Optional<OperationResult> hit = cache.lookup(cacheKey, request);
            if (hit.isPresent()) {
                LOG.debug("Cache hit for {} request", request.category().label());
                return markCacheHit(hit.get(), TimeUtils.elapsedMillis(startNanos));
            }
        }

        List<ProviderCandidate> candidates = snapshot.candidates(request.category(), chainOverride);
        if (candidates.isEmpty()) {
            return failure(request.category(), new OperationError(ErrorKind.NO_PROVIDER_AVAILABLE,
                    "No enabled " + request.category().label() + " provider configured", null, null, List.of()),
                    startNanos);
        }

        List<String> attempted = new ArrayList<>();
        ErrorKind lastKind = null;
        String lastMessage = null;

        for (ProviderCandidate candidate : candidates) {
            String name = candidate.name();
            CircuitBreaker breaker = breakers.forProvider(name);
            if (!breaker.tryAcquire()) {
                LOG.debug("Skipping {}: circuit open", name);
                meters.incrementSkipped(name, "circuit_open");
                lastKind = ErrorKind.CIRCUIT_OPEN;
                lastMessage = "Circuit open for " + name;
                continue;
            }
            Optional<ProviderPermit> permit = limiters.tryAcquire(name, request.tenantId());
            if (permit.isEmpty()) {
                breaker.releaseProbe();
                LOG.debug("Skipping {}: rate limited", name);
                meters.incrementSkipped(name, "rate_limited");
                lastKind = ErrorKind.RATE_LIMITED;
                lastMessage = "Rate limit reached for " + name;
                continue;
            }

            AttemptOutcome outcome;
            try (ProviderPermit ignored = permit.get()) {
                outcome = attempts.run(candidate, request);
            }
            if (outcome.status() == AttemptOutcome.Status.SKIPPED) {
                breaker.releaseProbe();
                LOG.debug("Skipping {}: {}", name, outcome.message());
                meters.incrementSkipped(name, "pool_saturated");
                lastKind = outcome.errorKind();
                lastMessage = outcome.message();
                continue;
            }
            attempted.add(name);

            switch (outcome.status()) {
                case SUCCEEDED -> {
                    breaker.recordSuccess();
                    breaker.recordLatency(outcome.latencyMs());
                    record(request, name, true, outcome);
                    OperationResult result;
                    try {
                        result = toResult(request, name, outcome.payload(), startNanos);
                    } catch (VoiceGateException | IllegalArgumentException e) {
                        LOG.error("Provider {} succeeded but the audio could not be stored: {}", name, e.toString());
                        return failure(request.category(), new OperationError(ErrorKind.PROVIDER_ERROR,
                                "Audio storage failed", ErrorKind.PROVIDER_ERROR, e.getMessage(), attempted),
                                startNanos);
                    }
                    if (cacheKey != null) {
                        cache.store(cacheKey, result);
                    }
                    LOG.info("{} served by {} in {}ms (attempts={})", request.category().label(), name,
                            result.processingMs(), attempted.size());
                    return result;
                }
                case CANCELLED -> {
                    breaker.releaseProbe();
                    record(request, name, false, outcome);
                    LOG.info("{} request cancelled during attempt on {}", request.category().label(), name);
                    return failure(request.category(), new OperationError(ErrorKind.CANCELLED,
                            "Request cancelled", ErrorKind.CANCELLED, outcome.message(), attempted), startNanos);
                }
                case FAILED -> {
                    charge(breaker, outcome.errorKind());
                    record(request, name, false, outcome);
                    publisher.publishEvent(new ProviderFailureEvent(name, request.category(), outcome.errorKind(),
                            outcome.message(), clock.instant()));
                    lastKind = outcome.errorKind();
                    lastMessage = outcome.message();
                }
                default -> throw new IllegalStateException("Unexpected outcome " + outcome.status());
            }
        }

        String message = attempted.isEmpty()
                ? "No provider available: every " + request.category().label() + " candidate was skipped"
                : "All providers failed";
        return failure(request.category(), new OperationError(ErrorKind.ALL_PROVIDERS_EXHAUSTED, message,
                lastKind, lastMessage, attempted), startNanos);
    }

    private void charge(CircuitBreaker breaker, ErrorKind kind) {
        if (kind.chargesBreaker()) {
            boolean trip = kind == ErrorKind.AUTHENTICATION && breakers.opensOnAuthenticationFailure();
            breaker.recordFailure(trip);
        } else {
            breaker.releaseProbe();
        }
    }

    private void record(SpeechRequest request, String provider, boolean success, AttemptOutcome outcome) {
        metrics.record(new MetricSample(clock.instant(), provider, request.category(), success,
                outcome.latencyMs(), request.contentBytes().length, success ? null : outcome.errorKind()));
    }

    private OperationResult toResult(SpeechRequest request, String provider, Object payload, long startNanos) {
        if (payload instanceof Transcription t) {
            String language = t.language() != null ? t.language() : ((SttRequest) request).language();
            return SttResponse.success(t.text(), t.confidence(), language, provider,
                    TimeUtils.elapsedMillis(startNanos));
        }
        Synthesis s = (Synthesis) payload;
        String ref = s.hasReference() ? s.audioRef() : storage.put(s.audio(), s.contentType());
        return TtsResponse.success(ref, s.contentType(), provider, TimeUtils.elapsedMillis(startNanos));
    }

    private static OperationResult markCacheHit(OperationResult hit, long processingMs) {
        if (hit instanceof SttResponse stt) {
            return stt.asCacheHit(processingMs);
        }
        return ((TtsResponse) hit).asCacheHit(processingMs);
    }

    static OperationResult failure(ProviderCategory category, OperationError error, long startNanos) {
        long elapsed = TimeUtils.elapsedMillis(startNanos);
        return category == ProviderCategory.STT
                ? SttResponse.failure(error, elapsed)
                : TtsResponse.failure(error, elapsed);
    }
}
