package io.conclave.core.execution.convergence;

/// Outcome of comparing a round with the round before it.
///
/// @param score combined stability score in [0, 1]
/// @param contentSimilarity average text similarity between the rounds, in [0, 1]
/// @param metricStability how little the average metric values moved, in [0, 1]
/// @param converged true if the score reached the threshold
///
/// @see ConvergenceDetector for how the parts are computed
public record ConvergenceResult(
        double score, double contentSimilarity, double metricStability, boolean converged) {

    private static final ConvergenceResult NONE = new ConvergenceResult(0.0, 0.0, 0.0, false);

    /// Returns the result used when there is nothing to compare against.
    ///
    /// @return zero score, not converged
    public static ConvergenceResult none() {
        return NONE;
    }
}
