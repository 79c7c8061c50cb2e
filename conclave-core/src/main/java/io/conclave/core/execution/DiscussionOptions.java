package io.conclave.core.execution;

/// Round limits and convergence threshold of one discussion.
///
/// Values are checked by the controller when a discussion starts, not here, so an
/// invalid combination surfaces as a {@link io.conclave.core.exception.ControllerFaultException}.
///
/// @param maxRounds hard upper bound on rounds, at least 1
/// @param minRounds rounds that must complete before convergence may stop the
///        discussion, in [1, maxRounds]
/// @param convergenceThreshold score in [0, 1] at which rounds count as converged
public record DiscussionOptions(int maxRounds, int minRounds, double convergenceThreshold) {

    public static final int DEFAULT_MAX_ROUNDS = 3;
    public static final int DEFAULT_MIN_ROUNDS = 2;
    public static final double DEFAULT_CONVERGENCE_THRESHOLD = 0.85;

    public static DiscussionOptions defaults() {
        return new DiscussionOptions(
                DEFAULT_MAX_ROUNDS, DEFAULT_MIN_ROUNDS, DEFAULT_CONVERGENCE_THRESHOLD);
    }

    public DiscussionOptions withMaxRounds(int maxRounds) {
        return new DiscussionOptions(maxRounds, minRounds, convergenceThreshold);
    }

    public DiscussionOptions withMinRounds(int minRounds) {
        return new DiscussionOptions(maxRounds, minRounds, convergenceThreshold);
    }

    public DiscussionOptions withConvergenceThreshold(double convergenceThreshold) {
        return new DiscussionOptions(maxRounds, minRounds, convergenceThreshold);
    }
}
