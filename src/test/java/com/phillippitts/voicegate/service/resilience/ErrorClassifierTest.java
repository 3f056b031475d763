package com.phillippitts.voicegate.service.resilience;

import com.phillippitts.voicegate.domain.ErrorKind;
import com.phillippitts.voicegate.exception.ProviderAuthenticationException;
import com.phillippitts.voicegate.exception.QuotaExceededException;
import com.phillippitts.voicegate.exception.TransientProviderException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    @Test
    void usesProviderExceptionKind() {
        assertThat(ErrorClassifier.classify(new QuotaExceededException("quota", "A")))
                .isEqualTo(ErrorKind.QUOTA_EXCEEDED);
        assertThat(ErrorClassifier.classify(new ProviderAuthenticationException("bad key", "A")))
                .isEqualTo(ErrorKind.AUTHENTICATION);
    }

    @Test
    void unwrapsExecutorWrappers() {
        Throwable wrapped = new ExecutionException(
                new CompletionException(new TransientProviderException("reset", "A")));

        assertThat(ErrorClassifier.classify(wrapped)).isEqualTo(ErrorKind.TRANSIENT);
        assertThat(ErrorClassifier.unwrap(wrapped)).isInstanceOf(TransientProviderException.class);
    }

    @Test
    void ioAndTimeoutsAreTransient() {
        assertThat(ErrorClassifier.classify(new IOException("broken pipe"))).isEqualTo(ErrorKind.TRANSIENT);
        assertThat(ErrorClassifier.classify(new TimeoutException())).isEqualTo(ErrorKind.TRANSIENT);
    }

    @Test
    void anythingElseIsProviderError() {
        assertThat(ErrorClassifier.classify(new IllegalStateException("boom"))).isEqualTo(ErrorKind.PROVIDER_ERROR);
        assertThat(ErrorClassifier.classify(new ExecutionException(new IllegalArgumentException("bad"))))
                .isEqualTo(ErrorKind.PROVIDER_ERROR);
    }
}
