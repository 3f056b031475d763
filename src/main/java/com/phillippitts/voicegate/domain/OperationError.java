package com.phillippitts.voicegate.domain;

import java.util.List;
import java.util.Objects;

/**
 * Structured error carried by a failed {@link OperationResult}.
 *
 * @param kind               overall outcome
 * @param message            human-readable summary
 * @param lastErrorKind      kind of the last underlying error; null when nothing was attempted
 * @param lastErrorMessage   message of the last underlying error; null when nothing was attempted
 * @param providersAttempted providers whose adapter was actually invoked, in order
 */
public record OperationError(
        ErrorKind kind,
        String message,
        ErrorKind lastErrorKind,
        String lastErrorMessage,
        List<String> providersAttempted
) {

    public OperationError {
        Objects.requireNonNull(kind, "kind");
        providersAttempted = providersAttempted == null ? List.of() : List.copyOf(providersAttempted);
    }

    public static OperationError of(ErrorKind kind, String message) {
        return new OperationError(kind, message, null, null, List.of());
    }
}
