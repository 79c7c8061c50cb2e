package io.conclave.core.state;

/// Control phase of a discussion.
///
/// ```
/// AWAITING_ROUND -> ROUND_IN_PROGRESS -> DECIDING -> AWAITING_ROUND | DONE
/// ```
public enum DiscussionPhase {
    /// Ready to start the round at the current index.
    AWAITING_ROUND,
    /// Workers of the current round are running.
    ROUND_IN_PROGRESS,
    /// The round finished; the controller is deciding whether to continue.
    DECIDING,
    /// Terminal. No further rounds will run.
    DONE
}
