package io.conclave.core.execution.result;

import io.conclave.core.execution.WorkerFailure;
import io.conclave.core.execution.convergence.ConvergenceResult;
import io.conclave.core.metric.Scorecard;
import io.conclave.core.worker.ResourceUsage;
import io.conclave.core.worker.WorkerResult;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Everything that happened in one completed round.
///
/// @param roundIndex zero-based index of the round
/// @param results valid results, one per worker that produced one, never null
/// @param failures workers that errored, timed out or returned an invalid result, never null
/// @param aggregatedScorecard weighted aggregate of this round's results alone, never null
/// @param convergence comparison with the previous round, never null
/// @param newlyExcluded workers that opted out at the end of this round, never null
/// @param roundUsage resources consumed by the valid results of this round, never null
public record RoundRecord(
        int roundIndex,
        List<WorkerResult> results,
        List<WorkerFailure> failures,
        Scorecard aggregatedScorecard,
        ConvergenceResult convergence,
        Set<String> newlyExcluded,
        ResourceUsage roundUsage) {

    public RoundRecord {
        if (roundIndex < 0) {
            throw new IllegalArgumentException("roundIndex must be >= 0, was " + roundIndex);
        }
        results = results != null ? List.copyOf(results) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
        aggregatedScorecard = aggregatedScorecard != null ? aggregatedScorecard : Scorecard.empty();
        convergence = Objects.requireNonNullElse(convergence, ConvergenceResult.none());
        newlyExcluded = newlyExcluded != null ? Set.copyOf(newlyExcluded) : Set.of();
        roundUsage = roundUsage != null ? roundUsage : ResourceUsage.ZERO;
    }
}
