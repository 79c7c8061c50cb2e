package io.conclave.core.worker;

/// A reviewer that scores a code change from the perspective of one role.
///
/// How a worker arrives at its scores is opaque to the controller: it may call a
/// language model, run static analysis or return canned results.
///
/// ### Contracts
/// - **Precondition**: `execute` is only called when `canExecute` returned true for
///   the same context
/// - **Postcondition**: a returned result belongs to the round of the given context;
///   the round executor stamps worker id, role key and round index on it
/// - **Invariant**: `getId()` and `getRoleKey()` do not change between rounds
///
/// @implNote Implementations must be thread-safe with respect to their own state.
/// Workers of the same round run concurrently on a shared executor.
///
/// @see io.conclave.core.execution.RoundExecutor for how results are validated
public interface Worker {

    /// Returns the identifier unique within a roster.
    ///
    /// @return non-null identifier, stable for the worker's lifetime
    String getId();

    /// Returns the role used for weight lookup, either a role key or an alias.
    ///
    /// @return role key or display name, not null
    String getRoleKey();

    /// Returns whether this worker wants to take part in the round described by the
    /// context.
    ///
    /// @param context the upcoming round, not null
    /// @return true to be scheduled, false to sit out this round
    default boolean canExecute(EvaluationContext context) {
        return true;
    }

    /// Scores the change for one round.
    ///
    /// @param context the round being executed, not null
    /// @return the worker's result, not null
    /// @throws Exception on any failure; the round continues without this worker
    WorkerResult execute(EvaluationContext context) throws Exception;
}
