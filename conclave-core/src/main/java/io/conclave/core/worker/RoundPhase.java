package io.conclave.core.worker;

/// Label describing the purpose of a round, shown to workers in their context.
public enum RoundPhase {
    INITIAL_ANALYSIS("Initial Analysis"),
    TEAM_DISCUSSION("Team Discussion"),
    FINAL_REVIEW("Final Review");

    private final String label;

    RoundPhase(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /// Determines the phase of a round.
    ///
    /// Round 0 is always the initial analysis, even for a single-round discussion.
    ///
    /// @param roundIndex zero-based round index
    /// @param maxRounds maximum number of rounds, at least 1
    /// @return phase for the round, never null
    public static RoundPhase of(int roundIndex, int maxRounds) {
        if (roundIndex == 0) {
            return INITIAL_ANALYSIS;
        }
        if (roundIndex >= maxRounds - 1) {
            return FINAL_REVIEW;
        }
        return TEAM_DISCUSSION;
    }
}
