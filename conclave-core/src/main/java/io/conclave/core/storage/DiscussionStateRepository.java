package io.conclave.core.storage;

import io.conclave.core.state.DiscussionSnapshot;
import java.util.List;
import java.util.Optional;

/// Repository for discussion checkpoints.
///
/// The controller saves a snapshot after every completed round, so an interrupted
/// discussion can continue from its last completed round.
///
/// ### Usage
/// {@snippet :
/// Optional<DiscussionSnapshot> restored = repository.findByExecutionId(executionId);
/// restored.filter(s -> !s.isCompleted())
///         .ifPresent(s -> controller.resume(s, roster));
/// }
///
/// @see DiscussionSnapshot for state representation
/// @see InMemoryDiscussionStateRepository for in-memory implementation
public interface DiscussionStateRepository {

    /// Saves a snapshot, replacing any earlier one with the same execution id.
    ///
    /// @param snapshot the state to persist, not null
    /// @throws NullPointerException if snapshot is null
    void save(DiscussionSnapshot snapshot);

    /// Finds the latest snapshot of a discussion.
    ///
    /// @param executionId the discussion identifier, not null
    /// @return the snapshot if found, empty otherwise
    Optional<DiscussionSnapshot> findByExecutionId(String executionId);

    /// Finds discussions that have not reached their terminal phase.
    ///
    /// @return unfinished snapshots, never null (may be empty)
    List<DiscussionSnapshot> findUnfinished();

    /// Deletes a snapshot.
    ///
    /// @param executionId the discussion to delete, not null
    /// @return true if the snapshot was deleted, false if not found
    boolean delete(String executionId);
}
