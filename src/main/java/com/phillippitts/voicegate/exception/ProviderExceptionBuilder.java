package com.phillippitts.voicegate.exception;

import com.phillippitts.voicegate.domain.ErrorKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ProviderException} with contextual metadata.
 *
 * <pre>
 * throw ProviderExceptionBuilder.create("Process failed")
 *         .provider("whisper-cli")
 *         .kind(ErrorKind.TRANSIENT)
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 *
 * <p>The built instance is the typed subclass matching the kind when one exists, so callers can still
 * catch {@link TransientProviderException} and friends.
 */
public final class ProviderExceptionBuilder {

    private final String message;
    private ErrorKind kind = ErrorKind.PROVIDER_ERROR;
    private String providerName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ProviderExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ProviderExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ProviderExceptionBuilder(message);
    }

    public ProviderExceptionBuilder provider(String providerName) {
        this.providerName = providerName;
        return this;
    }

    public ProviderExceptionBuilder kind(ErrorKind kind) {
        if (kind != null) {
            this.kind = kind;
        }
        return this;
    }

    public ProviderExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ProviderExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public ProviderExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata pair to the message. Null keys or values are ignored.
     */
    public ProviderExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (provider: {name})
     * </pre>
     */
    public ProviderException build() {
        String detailed = buildDetailedMessage();
        return switch (kind) {
            case TRANSIENT -> cause != null
                    ? new TransientProviderException(detailed, providerName, cause)
                    : new TransientProviderException(detailed, providerName);
            case AUTHENTICATION -> withCause(new ProviderAuthenticationException(detailed, providerName));
            case VALIDATION -> withCause(new ProviderValidationException(detailed, providerName));
            case QUOTA_EXCEEDED -> withCause(new QuotaExceededException(detailed, providerName));
            default -> cause != null
                    ? new ProviderException(kind, detailed, providerName, cause)
                    : new ProviderException(kind, detailed, providerName);
        };
    }

    private ProviderException withCause(ProviderException ex) {
        if (cause != null) {
            ex.initCause(cause);
        }
        return ex;
    }

    private String buildDetailedMessage() {
        StringBuilder sb = new StringBuilder(message);
        StringBuilder details = new StringBuilder();
        if (exitCode != null) {
            details.append("exitCode=").append(exitCode);
        }
        if (durationMs != null) {
            appendSeparator(details).append("durationMs=").append(durationMs);
        }
        metadata.forEach((k, v) -> appendSeparator(details).append(k).append('=').append(v));
        if (!details.isEmpty()) {
            sb.append(" (").append(details).append(')');
        }
        return sb.toString();
    }

    private static StringBuilder appendSeparator(StringBuilder sb) {
        if (!sb.isEmpty()) {
            sb.append(", ");
        }
        return sb;
    }
}
