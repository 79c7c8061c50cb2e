package io.conclave.core.worker;

import io.conclave.core.diff.DiffContext;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Everything a worker sees when asked to score a round.
///
/// Built fresh by the controller for each round. Later rounds carry the previous
/// round's valid results and the concerns raised in it, so workers can revise their
/// scores after reading their peers.
///
/// @param diff the change under evaluation, not null
/// @param roundIndex zero-based index of the round being executed
/// @param maxRounds maximum number of rounds in this discussion, at least 1
/// @param previousRoundResults valid results of the previous round, never null
/// @param teamConcerns concerns raised in the previous round, never null
public record EvaluationContext(
        DiffContext diff,
        int roundIndex,
        int maxRounds,
        List<WorkerResult> previousRoundResults,
        List<TeamConcern> teamConcerns) {

    public EvaluationContext {
        Objects.requireNonNull(diff, "diff must not be null");
        previousRoundResults =
                previousRoundResults != null ? List.copyOf(previousRoundResults) : List.of();
        teamConcerns = teamConcerns != null ? List.copyOf(teamConcerns) : List.of();
    }

    public boolean isFirstRound() {
        return roundIndex == 0;
    }

    public boolean isFinalRound() {
        return roundIndex >= maxRounds - 1;
    }

    public RoundPhase phase() {
        return RoundPhase.of(roundIndex, maxRounds);
    }

    /// Finds the previous-round result of a specific worker.
    ///
    /// @param workerId worker to look up, not null
    /// @return that worker's previous result, empty in round 0 or if it had none
    public Optional<WorkerResult> previousResultOf(String workerId) {
        return previousRoundResults.stream()
                .filter(result -> workerId.equals(result.getWorkerId()))
                .findFirst();
    }
}
