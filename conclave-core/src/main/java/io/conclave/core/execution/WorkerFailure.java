package io.conclave.core.execution;

import java.util.Objects;

/// Record of a worker that produced no usable result in a round.
///
/// @param workerId the failing worker, not null
/// @param roleKey that worker's role, may be null
/// @param roundIndex the round in which it failed
/// @param kind why the result is missing, not null
/// @param message human-readable cause, never null
public record WorkerFailure(
        String workerId, String roleKey, int roundIndex, Kind kind, String message) {

    /// Failure categories.
    public enum Kind {
        /// The worker threw.
        ERROR,
        /// The worker did not return within the timeout.
        TIMEOUT,
        /// The worker returned a result that failed validation.
        INVALID_RESULT
    }

    public WorkerFailure {
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        message = message != null ? message : "";
    }
}
