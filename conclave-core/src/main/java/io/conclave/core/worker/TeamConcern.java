package io.conclave.core.worker;

import java.util.Objects;

/// A concern raised by one worker and shared with the whole team in the next round.
///
/// @param workerId id of the worker that raised it, not null
/// @param roleKey role of that worker, may be null
/// @param concern trimmed concern text, not blank
public record TeamConcern(String workerId, String roleKey, String concern) {

    public TeamConcern {
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(concern, "concern must not be null");
        if (concern.isBlank()) {
            throw new IllegalArgumentException("concern must not be blank");
        }
    }
}
