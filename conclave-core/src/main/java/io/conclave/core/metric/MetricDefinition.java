package io.conclave.core.metric;

import java.util.Objects;

/// Definition of a single scored metric ("pillar").
///
/// @param name technical key used in scorecards, not null or blank
/// @param displayName human-readable label, defaults to `name` when null
/// @param description what the metric measures, may be empty
/// @param nullable whether a worker may legitimately return null for this metric
///
/// @see MetricRegistry for the ordered metric set
public record MetricDefinition(
        String name, String displayName, String description, boolean nullable) {

    public MetricDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Metric name must not be blank");
        }
        displayName = displayName != null ? displayName : name;
        description = description != null ? description : "";
    }

    /// Creates a nullable metric with no description.
    ///
    /// @param name technical key, not null
    /// @param displayName label, may be null
    /// @return new definition, never null
    public static MetricDefinition nullable(String name, String displayName) {
        return new MetricDefinition(name, displayName, "", true);
    }

    /// Creates a required (non-nullable) metric with no description.
    ///
    /// @param name technical key, not null
    /// @param displayName label, may be null
    /// @return new definition, never null
    public static MetricDefinition required(String name, String displayName) {
        return new MetricDefinition(name, displayName, "", false);
    }
}
