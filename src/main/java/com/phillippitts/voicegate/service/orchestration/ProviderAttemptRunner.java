package com.phillippitts.voicegate.service.orchestration;

import com.phillippitts.voicegate.domain.ErrorKind;
import com.phillippitts.voicegate.domain.SpeechRequest;
import com.phillippitts.voicegate.domain.SttRequest;
import com.phillippitts.voicegate.domain.Synthesis;
import com.phillippitts.voicegate.domain.Transcription;
import com.phillippitts.voicegate.domain.TtsRequest;
import com.phillippitts.voicegate.domain.VoiceOptions;
import com.phillippitts.voicegate.exception.ProviderException;
import com.phillippitts.voicegate.service.provider.ProviderCandidate;
import com.phillippitts.voicegate.service.provider.SttProvider;
import com.phillippitts.voicegate.service.provider.TtsProvider;
import com.phillippitts.voicegate.service.resilience.ErrorClassifier;
import com.phillippitts.voicegate.service.resilience.RetryPolicy;
import com.phillippitts.voicegate.service.resilience.Sleeper;
import com.phillippitts.voicegate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;

/**
 * Runs one provider attempt: the adapter call under a per-call deadline, retried with backoff for
 * transient errors only.
 *
 * <p>Each call is a {@link FutureTask} on the provider executor so a deadline or a caller interrupt
 * can interrupt the adapter thread. The deadline starts when a worker picks the call up, not when it is
 * queued. A call the executor rejects, or one still queued after a full deadline, never reached the
 * provider: the attempt ends {@link AttemptOutcome.Status#SKIPPED} if that was its first call.
 *
 * <p>No breaker or limiter state is touched here; the caller accounts for the outcome exactly once.
 */
class ProviderAttemptRunner {

    private static final Logger LOG = LogManager.getLogger(ProviderAttemptRunner.class);

    private final Executor executor;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    ProviderAttemptRunner(Executor executor, RetryPolicy policy, Sleeper sleeper) {
        this(executor, policy, sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    ProviderAttemptRunner(Executor executor, RetryPolicy policy, Sleeper sleeper, DoubleSupplier random) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.random = Objects.requireNonNull(random, "random");
    }

    AttemptOutcome run(ProviderCandidate candidate, SpeechRequest request) {
        long start = System.nanoTime();
        int calls = 0;
        ErrorKind kind = null;
        String message = null;
        while (true) {
            calls++;
            try {
                Object payload = callWithDeadline(candidate, request);
                return AttemptOutcome.succeeded(payload, calls, TimeUtils.elapsedMillis(start));
            } catch (InterruptedException | CancellationException e) {
                Thread.currentThread().interrupt();
                return AttemptOutcome.cancelled(calls, TimeUtils.elapsedMillis(start));
            } catch (NotStartedException e) {
                LOG.warn("Call {} to {} not started: {}", calls, candidate.name(), e.getMessage());
                if (calls == 1) {
                    return AttemptOutcome.skipped(e.getMessage(), TimeUtils.elapsedMillis(start));
                }
                return AttemptOutcome.failed(kind, message, calls - 1, TimeUtils.elapsedMillis(start));
            } catch (Exception e) {
                kind = ErrorClassifier.classify(e);
                message = describe(e);
                if (!kind.isRetryable() || calls >= policy.maxCalls()) {
                    return AttemptOutcome.failed(kind, message, calls, TimeUtils.elapsedMillis(start));
                }
                Duration backoff = policy.backoffFor(calls, random);
                LOG.debug("Retrying {} after {} ({}ms backoff, call {}/{})", candidate.name(), kind,
                        backoff.toMillis(), calls, policy.maxCalls());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return AttemptOutcome.cancelled(calls, TimeUtils.elapsedMillis(start));
                }
            }
        }
    }

    private Object callWithDeadline(ProviderCandidate candidate, SpeechRequest request) throws Exception {
        long timeoutMs = policy.attemptTimeout().toMillis();
        AtomicBoolean claimed = new AtomicBoolean();
        CountDownLatch started = new CountDownLatch(1);
        FutureTask<Object> task = new FutureTask<>(() -> {
            if (!claimed.compareAndSet(false, true)) {
                throw new CancellationException("Call abandoned while queued");
            }
            started.countDown();
            return invoke(candidate, request);
        });
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            throw new NotStartedException("Provider pool saturated");
        }
        try {
            if (!started.await(timeoutMs, TimeUnit.MILLISECONDS) && claimed.compareAndSet(false, true)) {
                task.cancel(false);
                throw new NotStartedException("Provider pool busy for " + timeoutMs + "ms");
            }
            // claimed by the worker, which counts down right after
            started.await();
            return task.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw new TimeoutException("No response within " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            claimed.set(true);
            task.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = ErrorClassifier.unwrap(e);
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
    }

    private static Object invoke(ProviderCandidate candidate, SpeechRequest request) {
        if (request instanceof SttRequest stt) {
            SttProvider adapter = (SttProvider) candidate.adapter();
            Map<String, String> options = new HashMap<>(stt.options());
            if (stt.audioFormat() != null) {
                options.putIfAbsent("format", stt.audioFormat());
            }
            Transcription t = adapter.transcribe(stt.audio(), languageOf(stt), Map.copyOf(options));
            if (t == null || t.text().isBlank()) {
                throw new ProviderException(ErrorKind.PROVIDER_ERROR, "Empty transcription", candidate.name());
            }
            if (t.confidence() != null && (t.confidence() < 0.0 || t.confidence() > 1.0)) {
                throw new ProviderException(ErrorKind.PROVIDER_ERROR,
                        "Confidence out of range: " + t.confidence(), candidate.name());
            }
            return t;
        }
        TtsRequest tts = (TtsRequest) request;
        TtsProvider adapter = (TtsProvider) candidate.adapter();
        Synthesis s = adapter.synthesize(tts.text(), VoiceOptions.from(tts));
        if (s == null) {
            throw new ProviderException(ErrorKind.PROVIDER_ERROR, "Empty synthesis", candidate.name());
        }
        return s;
    }

    private static String languageOf(SpeechRequest request) {
        return request.language() == null ? "auto" : request.language();
    }

    private static String describe(Throwable e) {
        Throwable t = ErrorClassifier.unwrap(e);
        String msg = t.getMessage();
        return msg == null ? t.getClass().getSimpleName() : msg;
    }

    /**
     * The call never reached the adapter: rejected by the executor or still queued at the deadline.
     */
    static final class NotStartedException extends Exception {
        NotStartedException(String message) {
            super(message);
        }
    }
}
