package io.conclave.core.state;

import io.conclave.core.diff.DiffContext;
import io.conclave.core.execution.DiscussionOptions;
import io.conclave.core.execution.convergence.ConvergenceResult;
import io.conclave.core.execution.result.EvaluationHistory;
import io.conclave.core.execution.result.RoundRecord;
import io.conclave.core.metric.Scorecard;
import io.conclave.core.worker.ResourceUsage;
import io.conclave.core.worker.TeamConcern;
import io.conclave.core.worker.WorkerResult;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/// Mutable control state of one discussion.
///
/// Created per evaluation and owned by the controller thread running it. Every field
/// changes only through a named fold method that states its merge rule:
///
/// | Field                  | Fold method                     | Rule              |
/// |------------------------|---------------------------------|-------------------|
/// | history                | {@link #appendHistory}          | append            |
/// | previousRoundResults   | {@link #replaceCurrentRoundResults} | replace       |
/// | teamConcerns           | {@link #replaceTeamConcerns}    | replace           |
/// | runningAggregate       | {@link #mergeAggregate}         | per-metric replace |
/// | excludedWorkers        | {@link #unionExcludedWorkers}   | set union         |
/// | totalResourceUsage     | {@link #sumResourceUsage}       | sum               |
/// | roundIndex             | {@link #advanceRound}           | increment         |
///
/// @implNote **Not thread-safe**. Never shared between evaluations.
///
/// @see DiscussionSnapshot for the immutable persisted form
public final class DiscussionState {

    private final String executionId;
    private final DiffContext diff;
    private final int maxRounds;
    private final int minRounds;
    private final double convergenceThreshold;
    private final EvaluationHistory history;
    private final Set<String> excludedWorkers;

    private DiscussionPhase phase;
    private int roundIndex;
    private List<WorkerResult> previousRoundResults;
    private List<TeamConcern> teamConcerns;
    private Scorecard runningAggregate;
    private ConvergenceResult lastConvergence;
    private ResourceUsage totalResourceUsage;

    private DiscussionState(Builder builder) {
        this.executionId =
                builder.executionId != null ? builder.executionId : UUID.randomUUID().toString();
        this.diff = Objects.requireNonNull(builder.diff, "diff must not be null");
        this.maxRounds = builder.maxRounds;
        this.minRounds = builder.minRounds;
        this.convergenceThreshold = builder.convergenceThreshold;
        this.history =
                builder.history != null ? builder.history.copy() : new EvaluationHistory(maxRounds);
        this.excludedWorkers = new LinkedHashSet<>(builder.excludedWorkers);
        this.phase = builder.phase;
        this.roundIndex = builder.roundIndex;
        this.previousRoundResults = List.copyOf(builder.previousRoundResults);
        this.teamConcerns = List.copyOf(builder.teamConcerns);
        this.runningAggregate = builder.runningAggregate;
        this.lastConvergence = builder.lastConvergence;
        this.totalResourceUsage = builder.totalResourceUsage;
    }

    /// Creates the initial state of a new discussion.
    ///
    /// @param diff change under evaluation, not null
    /// @param options round limits and threshold, not null
    /// @return state at round 0 awaiting its first round, never null
    public static DiscussionState start(DiffContext diff, DiscussionOptions options) {
        return builder()
                .diff(diff)
                .maxRounds(options.maxRounds())
                .minRounds(options.minRounds())
                .convergenceThreshold(options.convergenceThreshold())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getExecutionId() {
        return executionId;
    }

    public DiffContext getDiff() {
        return diff;
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    public int getMinRounds() {
        return minRounds;
    }

    public double getConvergenceThreshold() {
        return convergenceThreshold;
    }

    public DiscussionOptions getOptions() {
        return new DiscussionOptions(maxRounds, minRounds, convergenceThreshold);
    }

    public DiscussionPhase getPhase() {
        return phase;
    }

    public void setPhase(DiscussionPhase phase) {
        this.phase = Objects.requireNonNull(phase, "phase must not be null");
    }

    public boolean isDone() {
        return phase == DiscussionPhase.DONE;
    }

    public int getRoundIndex() {
        return roundIndex;
    }

    /// Returns the history of completed rounds.
    ///
    /// @return the live history, never null
    public EvaluationHistory getHistory() {
        return history;
    }

    /// Returns the ids of permanently excluded workers.
    ///
    /// @return unmodifiable view in exclusion order, never null
    public Set<String> getExcludedWorkers() {
        return Collections.unmodifiableSet(excludedWorkers);
    }

    public List<WorkerResult> getPreviousRoundResults() {
        return previousRoundResults;
    }

    public List<TeamConcern> getTeamConcerns() {
        return teamConcerns;
    }

    /// Returns the aggregate of all rounds so far.
    ///
    /// @return aggregated scorecard without null values, never null
    public Scorecard getRunningAggregate() {
        return runningAggregate;
    }

    public ConvergenceResult getLastConvergence() {
        return lastConvergence;
    }

    public ResourceUsage getTotalResourceUsage() {
        return totalResourceUsage;
    }

    /// Appends a completed round to the history.
    ///
    /// @apiNote **Side effects**: Modifies the history
    public void appendHistory(RoundRecord round) {
        history.append(round);
    }

    /// Replaces the results the next round will see as the previous round.
    public void replaceCurrentRoundResults(List<WorkerResult> results) {
        this.previousRoundResults = List.copyOf(results);
    }

    /// Replaces the concerns passed to the next round.
    public void replaceTeamConcerns(List<TeamConcern> concerns) {
        this.teamConcerns = List.copyOf(concerns);
    }

    /// Overlays a round aggregate on the running aggregate, metric by metric.
    ///
    /// Metrics absent from the round aggregate keep their earlier value.
    public void mergeAggregate(Scorecard roundAggregate) {
        this.runningAggregate = runningAggregate.mergedWith(roundAggregate);
    }

    /// Adds workers to the exclusion set. Exclusion is permanent.
    ///
    /// @param workerIds ids to exclude, not null
    /// @return ids that were not excluded before, in argument order, never null
    public Set<String> unionExcludedWorkers(Collection<String> workerIds) {
        Set<String> added = new LinkedHashSet<>();
        for (String id : workerIds) {
            if (excludedWorkers.add(id)) {
                added.add(id);
            }
        }
        return added;
    }

    public void sumResourceUsage(ResourceUsage usage) {
        this.totalResourceUsage = totalResourceUsage.plus(usage);
    }

    public void recordConvergence(ConvergenceResult convergence) {
        this.lastConvergence = Objects.requireNonNull(convergence, "convergence must not be null");
    }

    /// Moves to the next round index.
    ///
    /// @apiNote **Side effects**: Increments the round index
    public void advanceRound() {
        roundIndex++;
    }

    /// Creates an immutable snapshot of this state.
    ///
    /// @param reason why the snapshot is taken, may be null
    /// @return new snapshot, never null
    public DiscussionSnapshot snapshot(String reason) {
        return DiscussionSnapshot.from(this, reason);
    }

    /// Builder for restoring or creating discussion state.
    public static final class Builder {
        private String executionId;
        private DiffContext diff;
        private int maxRounds = 3;
        private int minRounds = 2;
        private double convergenceThreshold = 0.85;
        private EvaluationHistory history;
        private Set<String> excludedWorkers = Set.of();
        private DiscussionPhase phase = DiscussionPhase.AWAITING_ROUND;
        private int roundIndex;
        private List<WorkerResult> previousRoundResults = List.of();
        private List<TeamConcern> teamConcerns = List.of();
        private Scorecard runningAggregate = Scorecard.empty();
        private ConvergenceResult lastConvergence = ConvergenceResult.none();
        private ResourceUsage totalResourceUsage = ResourceUsage.ZERO;

        private Builder() {}

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder diff(DiffContext diff) {
            this.diff = diff;
            return this;
        }

        public Builder maxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
            return this;
        }

        public Builder minRounds(int minRounds) {
            this.minRounds = minRounds;
            return this;
        }

        public Builder convergenceThreshold(double convergenceThreshold) {
            this.convergenceThreshold = convergenceThreshold;
            return this;
        }

        public Builder history(EvaluationHistory history) {
            this.history = history;
            return this;
        }

        public Builder excludedWorkers(Set<String> excludedWorkers) {
            this.excludedWorkers = excludedWorkers != null ? excludedWorkers : Set.of();
            return this;
        }

        public Builder phase(DiscussionPhase phase) {
            this.phase = phase != null ? phase : DiscussionPhase.AWAITING_ROUND;
            return this;
        }

        public Builder roundIndex(int roundIndex) {
            this.roundIndex = roundIndex;
            return this;
        }

        public Builder previousRoundResults(List<WorkerResult> previousRoundResults) {
            this.previousRoundResults =
                    previousRoundResults != null ? previousRoundResults : List.of();
            return this;
        }

        public Builder teamConcerns(List<TeamConcern> teamConcerns) {
            this.teamConcerns = teamConcerns != null ? teamConcerns : List.of();
            return this;
        }

        public Builder runningAggregate(Scorecard runningAggregate) {
            this.runningAggregate = runningAggregate != null ? runningAggregate : Scorecard.empty();
            return this;
        }

        public Builder lastConvergence(ConvergenceResult lastConvergence) {
            this.lastConvergence =
                    lastConvergence != null ? lastConvergence : ConvergenceResult.none();
            return this;
        }

        public Builder totalResourceUsage(ResourceUsage totalResourceUsage) {
            this.totalResourceUsage =
                    totalResourceUsage != null ? totalResourceUsage : ResourceUsage.ZERO;
            return this;
        }

        public DiscussionState build() {
            return new DiscussionState(this);
        }
    }
}
