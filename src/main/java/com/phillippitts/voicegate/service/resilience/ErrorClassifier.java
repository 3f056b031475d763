package com.phillippitts.voicegate.service.resilience;

import com.phillippitts.voicegate.domain.ErrorKind;
import com.phillippitts.voicegate.exception.ProviderException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps adapter failures onto {@link ErrorKind}s.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static ErrorKind classify(Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof ProviderException pe) {
            return pe.getKind();
        }
        if (t instanceof TimeoutException || t instanceof IOException || t instanceof UncheckedIOException) {
            return ErrorKind.TRANSIENT;
        }
        return ErrorKind.PROVIDER_ERROR;
    }

    /**
     * Strips executor wrappers to reach the adapter's own exception.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
