package io.conclave.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;

/// Jackson mixin that keeps the derived `completed` flag out of snapshot JSON.
///
/// The flag is computed from `phase`, which is written.
public abstract class DiscussionSnapshotMixin {

    @JsonIgnore
    public abstract boolean isCompleted();
}
