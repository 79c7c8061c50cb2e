package io.conclave.core.execution.result;

import io.conclave.core.worker.RoundPhase;
import java.time.Instant;
import java.util.List;

/// One turn of the discussion transcript, derived from a worker result.
///
/// @param roundIndex round in which the message was produced
/// @param phase phase label of that round, not null
/// @param workerId speaking worker, not null
/// @param roleKey that worker's role, may be null
/// @param message summary followed by details, never null
/// @param concerns concerns raised in the message, never null
/// @param timestamp when the result was produced, may be null
public record ConversationMessage(
        int roundIndex,
        RoundPhase phase,
        String workerId,
        String roleKey,
        String message,
        List<String> concerns,
        Instant timestamp) {}
