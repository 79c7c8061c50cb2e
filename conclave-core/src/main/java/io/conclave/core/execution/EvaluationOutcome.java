package io.conclave.core.execution;

import io.conclave.core.execution.result.EvaluationHistory;
import io.conclave.core.metric.DerivedMetrics;
import io.conclave.core.metric.Scorecard;
import io.conclave.core.worker.ResourceUsage;
import java.util.Optional;
import java.util.Set;

/// Final result of a discussion.
///
/// @param executionId identifier of the discussion, not null
/// @param history every completed round in order, never null
/// @param finalScorecard running aggregate after the last round, never null
/// @param converged whether the last round reached the convergence threshold
/// @param convergenceScore score of the last round, in [0, 1]
/// @param roundsRun number of completed rounds
/// @param excludedWorkers workers that opted out, never null
/// @param totalResourceUsage resources used by all valid results, never null
public record EvaluationOutcome(
        String executionId,
        EvaluationHistory history,
        Scorecard finalScorecard,
        boolean converged,
        double convergenceScore,
        int roundsRun,
        Set<String> excludedWorkers,
        ResourceUsage totalResourceUsage) {

    public EvaluationOutcome {
        history = history.copy();
        excludedWorkers = Set.copyOf(excludedWorkers);
    }

    /// Returns net technical debt of the final scorecard.
    ///
    /// @see DerivedMetrics#netDebt(Scorecard)
    public Optional<Double> netDebt() {
        return DerivedMetrics.netDebt(finalScorecard);
    }

    /// Returns the overall commit score of the final scorecard.
    ///
    /// @see DerivedMetrics#commitScore(Scorecard)
    public Optional<Double> commitScore() {
        return DerivedMetrics.commitScore(finalScorecard);
    }
}
