package io.conclave.core.diff;

import java.util.List;
import java.util.Objects;

/// The code change under evaluation.
///
/// Opaque to the discussion controller: it is passed unchanged to every worker.
///
/// @param diff raw unified diff text, not null
/// @param filesChanged paths touched by the change, never null (may be empty)
/// @param developerOverview optional author description of the change, may be null
/// @param commitHash optional commit identifier, may be null
public record DiffContext(
        String diff, List<String> filesChanged, String developerOverview, String commitHash) {

    public DiffContext {
        Objects.requireNonNull(diff, "diff must not be null");
        filesChanged = filesChanged != null ? List.copyOf(filesChanged) : List.of();
    }

    public static DiffContext of(String diff) {
        return new DiffContext(diff, List.of(), null, null);
    }

    public boolean hasDeveloperOverview() {
        return developerOverview != null && !developerOverview.isBlank();
    }
}
