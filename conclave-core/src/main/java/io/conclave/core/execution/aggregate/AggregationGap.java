package io.conclave.core.execution.aggregate;

/// A primary-authority role that gave no value for a metric it is weighted highest on.
///
/// Diagnostic only: the metric is still aggregated from the remaining contributors.
///
/// @param workerId worker that abstained, not null
/// @param roleKey normalized role of that worker, not null
/// @param metric metric left without the primary's vote, not null
/// @param weight the role's weight for the metric, at least the primary threshold
public record AggregationGap(String workerId, String roleKey, String metric, double weight) {}
