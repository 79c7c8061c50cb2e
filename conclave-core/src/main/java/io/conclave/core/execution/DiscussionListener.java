package io.conclave.core.execution;

import io.conclave.core.state.DiscussionSnapshot;
import io.conclave.core.worker.RoundPhase;
import java.util.List;

/// Listener for discussion lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to override
/// only the events they care about.
///
/// ### Callback Lifecycle
/// ```
/// onRoundStart(round, phase, workers)   - about to invoke workers
/// onWorkerExcluded(workerId, round)     - once per worker that opted out this round
/// onRoundComplete(progress)             - round recorded in history
/// onCheckpoint(snapshot)                - state is consistent, safe to persist
/// ...
/// onDiscussionComplete(outcome)         - terminal, once
/// ```
///
/// @implNote Callbacks come from the thread running the discussion. An exception
/// thrown by a listener is logged and does not affect the discussion.
///
/// @see DiscussionController#evaluate
public interface DiscussionListener {

    /// Called before the workers of a round are invoked.
    ///
    /// @param roundIndex index of the round, zero-based
    /// @param phase phase label of the round, not null
    /// @param workerIds ids of the eligible workers, not null
    default void onRoundStart(int roundIndex, RoundPhase phase, List<String> workerIds) {}

    /// Called when a worker is excluded from all later rounds.
    ///
    /// @param workerId the excluded worker, not null
    /// @param roundIndex the round after which it was excluded
    default void onWorkerExcluded(String workerId, int roundIndex) {}

    /// Called after a round has been recorded.
    ///
    /// @param progress summary of the round, not null
    default void onRoundComplete(RoundProgress progress) {}

    /// Called when discussion state is fully consistent and safe to persist.
    ///
    /// @param snapshot the state after the round, not null
    default void onCheckpoint(DiscussionSnapshot snapshot) {}

    /// Called once when the discussion has finished.
    ///
    /// @param outcome the final outcome, not null
    default void onDiscussionComplete(EvaluationOutcome outcome) {}

    /// No-op listener instance that ignores all events.
    DiscussionListener NOOP = new DiscussionListener() {};
}
