package io.conclave.core.storage;

import io.conclave.core.state.DiscussionSnapshot;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory discussion state repository (default implementation).
///
/// Thread-safe, no external dependencies. Keeps only the latest snapshot per
/// execution id.
///
/// @see DiscussionStateRepository for contract
public final class InMemoryDiscussionStateRepository implements DiscussionStateRepository {

    private final Map<String, DiscussionSnapshot> storage = new ConcurrentHashMap<>();

    @Override
    public void save(DiscussionSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        storage.put(snapshot.executionId(), snapshot);
    }

    @Override
    public Optional<DiscussionSnapshot> findByExecutionId(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return Optional.ofNullable(storage.get(executionId));
    }

    @Override
    public List<DiscussionSnapshot> findUnfinished() {
        return storage.values().stream().filter(s -> !s.isCompleted()).toList();
    }

    @Override
    public boolean delete(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return storage.remove(executionId) != null;
    }

    /// Returns the number of stored snapshots (useful for testing).
    public int size() {
        return storage.size();
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }
}
