package io.conclave.core.execution;

import io.conclave.core.execution.convergence.ConvergenceResult;
import io.conclave.core.metric.Scorecard;

/// Progress report sent to listeners after each completed round.
///
/// @param roundIndex index of the round just completed
/// @param maxRounds round limit of the discussion
/// @param resultsCount valid results in the round
/// @param failureCount workers without a valid result in the round
/// @param aggregatedScorecard running aggregate after the round, never null
/// @param convergence comparison with the previous round, never null
public record RoundProgress(
        int roundIndex,
        int maxRounds,
        int resultsCount,
        int failureCount,
        Scorecard aggregatedScorecard,
        ConvergenceResult convergence) {}
