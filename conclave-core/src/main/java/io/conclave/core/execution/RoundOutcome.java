package io.conclave.core.execution;

import io.conclave.core.worker.WorkerResult;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/// Valid results and failures of one executed round.
///
/// @param results valid, sanitized results in roster order, never null
/// @param failures one entry per worker without a valid result, never null
public record RoundOutcome(List<WorkerResult> results, List<WorkerFailure> failures) {

    public RoundOutcome {
        results = results != null ? List.copyOf(results) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public Set<String> failedWorkerIds() {
        return failures.stream().map(WorkerFailure::workerId).collect(Collectors.toSet());
    }

    public boolean allFailed() {
        return results.isEmpty();
    }
}
