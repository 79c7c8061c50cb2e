package io.conclave.core.state;

import io.conclave.core.diff.DiffContext;
import io.conclave.core.execution.convergence.ConvergenceResult;
import io.conclave.core.execution.result.EvaluationHistory;
import io.conclave.core.metric.Scorecard;
import io.conclave.core.worker.ResourceUsage;
import io.conclave.core.worker.TeamConcern;
import io.conclave.core.worker.WorkerResult;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Immutable snapshot of discussion state for checkpointing and resume.
///
/// Taken by the controller after every completed round, when the state is
/// consistent. A snapshot whose phase is not `DONE` can be resumed with the same
/// roster; the next round to run is `roundIndex`.
///
/// ### Usage
/// {@snippet :
/// DiscussionSnapshot snapshot = DiscussionSnapshot.from(state, "round-complete");
/// repository.save(snapshot);
///
/// // Later
/// EvaluationOutcome outcome = controller.resume(snapshot, roster);
/// }
///
/// @param executionId unique identifier of the discussion, not null
/// @param diff the change under evaluation, not null
/// @param phase control phase when the snapshot was taken, not null
/// @param roundIndex index of the next round to run
/// @param maxRounds round limit
/// @param minRounds minimum rounds before convergence may stop the discussion
/// @param convergenceThreshold convergence threshold
/// @param excludedWorkers permanently excluded worker ids, never null
/// @param previousRoundResults results of the last completed round, never null
/// @param teamConcerns concerns for the next round, never null
/// @param runningAggregate aggregate of all rounds so far, never null
/// @param lastConvergence convergence of the last completed round, never null
/// @param totalResourceUsage resources used so far, never null
/// @param history completed rounds, never null
/// @param createdAt when this snapshot was created, not null
/// @param checkpointReason why this checkpoint was created, may be null
/// @see DiscussionState for the mutable form
public record DiscussionSnapshot(
        String executionId,
        DiffContext diff,
        DiscussionPhase phase,
        int roundIndex,
        int maxRounds,
        int minRounds,
        double convergenceThreshold,
        Set<String> excludedWorkers,
        List<WorkerResult> previousRoundResults,
        List<TeamConcern> teamConcerns,
        Scorecard runningAggregate,
        ConvergenceResult lastConvergence,
        ResourceUsage totalResourceUsage,
        EvaluationHistory history,
        Instant createdAt,
        String checkpointReason) {

    /// Compact constructor with validation and defensive copying.
    public DiscussionSnapshot {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(diff, "diff must not be null");
        phase = phase != null ? phase : DiscussionPhase.AWAITING_ROUND;
        excludedWorkers = excludedWorkers != null ? Set.copyOf(excludedWorkers) : Set.of();
        previousRoundResults =
                previousRoundResults != null ? List.copyOf(previousRoundResults) : List.of();
        teamConcerns = teamConcerns != null ? List.copyOf(teamConcerns) : List.of();
        runningAggregate = runningAggregate != null ? runningAggregate : Scorecard.empty();
        lastConvergence = lastConvergence != null ? lastConvergence : ConvergenceResult.none();
        totalResourceUsage = totalResourceUsage != null ? totalResourceUsage : ResourceUsage.ZERO;
        history = history != null ? history.copy() : new EvaluationHistory(maxRounds);
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /// Creates a snapshot from the current discussion state.
    ///
    /// @param state the current state, not null
    /// @param reason why this checkpoint is being created, may be null
    /// @return new snapshot, never null
    /// @throws NullPointerException if state is null
    public static DiscussionSnapshot from(DiscussionState state, String reason) {
        Objects.requireNonNull(state, "state must not be null");
        return new DiscussionSnapshot(
                state.getExecutionId(),
                state.getDiff(),
                state.getPhase(),
                state.getRoundIndex(),
                state.getMaxRounds(),
                state.getMinRounds(),
                state.getConvergenceThreshold(),
                state.getExcludedWorkers(),
                state.getPreviousRoundResults(),
                state.getTeamConcerns(),
                state.getRunningAggregate(),
                state.getLastConvergence(),
                state.getTotalResourceUsage(),
                state.getHistory(),
                Instant.now(),
                reason);
    }

    /// Restores discussion state from this snapshot.
    ///
    /// @return reconstructed state, never null
    public DiscussionState toState() {
        return DiscussionState.builder()
                .executionId(executionId)
                .diff(diff)
                .phase(phase)
                .roundIndex(roundIndex)
                .maxRounds(maxRounds)
                .minRounds(minRounds)
                .convergenceThreshold(convergenceThreshold)
                .excludedWorkers(excludedWorkers)
                .previousRoundResults(previousRoundResults)
                .teamConcerns(teamConcerns)
                .runningAggregate(runningAggregate)
                .lastConvergence(lastConvergence)
                .totalResourceUsage(totalResourceUsage)
                .history(history)
                .build();
    }

    /// Returns whether the discussion had finished when this snapshot was taken.
    ///
    /// @return true if the phase is DONE
    public boolean isCompleted() {
        return phase == DiscussionPhase.DONE;
    }
}
