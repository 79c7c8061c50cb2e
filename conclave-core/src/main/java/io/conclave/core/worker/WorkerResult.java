package io.conclave.core.worker;

import io.conclave.core.metric.Scorecard;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Immutable output of one worker for one round.
///
/// Holds the worker's scorecard together with the free text that justifies it. A
/// result is created once per worker per round and owned by the round that produced
/// it; revisions in later rounds produce new results.
///
/// ### Validity
/// The round executor only keeps results whose summary is non-blank and whose
/// scorecard has a value for every required metric. See {@link #hasSummary()}.
///
/// @implNote Immutable after construction. Use {@link #toBuilder()} to derive a
/// modified copy.
///
/// @see io.conclave.core.execution.RoundExecutor for validation and stamping
public final class WorkerResult {

    private final String workerId;
    private final String roleKey;
    private final int roundIndex;
    private final String summary;
    private final String details;
    private final Scorecard scorecard;
    private final List<String> concerns;
    private final ResourceUsage resourceUsage;
    private final Integer confidenceScore;
    private final int refinementCount;
    private final Instant timestamp;

    private WorkerResult(Builder builder) {
        this.workerId = builder.workerId;
        this.roleKey = builder.roleKey;
        this.roundIndex = builder.roundIndex;
        this.summary = builder.summary;
        this.details = builder.details;
        this.scorecard = builder.scorecard;
        this.concerns = List.copyOf(builder.concerns);
        this.resourceUsage = builder.resourceUsage;
        this.confidenceScore = builder.confidenceScore;
        this.refinementCount = builder.refinementCount;
        this.timestamp = builder.timestamp;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getRoleKey() {
        return roleKey;
    }

    public int getRoundIndex() {
        return roundIndex;
    }

    /// Returns the short justification of the scores.
    ///
    /// @return summary text, may be blank for results that will be rejected
    public String getSummary() {
        return summary;
    }

    public String getDetails() {
        return details;
    }

    /// Returns the scores given by the worker.
    ///
    /// @return scorecard, never null (may contain explicit null values)
    public Scorecard getScorecard() {
        return scorecard;
    }

    /// Returns the concerns the worker wants its peers to consider.
    ///
    /// @return unmodifiable list, never null
    public List<String> getConcerns() {
        return concerns;
    }

    public ResourceUsage getResourceUsage() {
        return resourceUsage;
    }

    /// Returns the self-reported confidence.
    ///
    /// @return confidence in [0, 100], or null if the worker did not report one
    public Integer getConfidenceScore() {
        return confidenceScore;
    }

    /// Returns how many internal refinement passes the worker ran for this result.
    public int getRefinementCount() {
        return refinementCount;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /// Checks whether the summary has any non-whitespace content.
    ///
    /// @return true if the summary is non-blank
    public boolean hasSummary() {
        return summary != null && !summary.isBlank();
    }

    /// Returns summary and details joined by a single space, for text comparison.
    ///
    /// @return combined text, never null
    public String combinedText() {
        String s = summary != null ? summary : "";
        String d = details != null ? details : "";
        return s + " " + d;
    }

    /// Creates a builder pre-populated with this result's fields.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .workerId(workerId)
                .roleKey(roleKey)
                .roundIndex(roundIndex)
                .summary(summary)
                .details(details)
                .scorecard(scorecard)
                .concerns(concerns)
                .resourceUsage(resourceUsage)
                .confidenceScore(confidenceScore)
                .refinementCount(refinementCount)
                .timestamp(timestamp);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkerResult that)) {
            return false;
        }
        return roundIndex == that.roundIndex
                && refinementCount == that.refinementCount
                && Objects.equals(workerId, that.workerId)
                && Objects.equals(roleKey, that.roleKey)
                && Objects.equals(summary, that.summary)
                && Objects.equals(details, that.details)
                && Objects.equals(scorecard, that.scorecard)
                && Objects.equals(concerns, that.concerns)
                && Objects.equals(resourceUsage, that.resourceUsage)
                && Objects.equals(confidenceScore, that.confidenceScore)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workerId, roleKey, roundIndex, summary, scorecard, timestamp);
    }

    @Override
    public String toString() {
        return "WorkerResult{workerId='"
                + workerId
                + "', roleKey='"
                + roleKey
                + "', round="
                + roundIndex
                + ", scorecard="
                + scorecard
                + "}";
    }

    /// Builder for constructing WorkerResult instances.
    public static final class Builder {
        private String workerId;
        private String roleKey;
        private int roundIndex;
        private String summary = "";
        private String details = "";
        private Scorecard scorecard = Scorecard.empty();
        private List<String> concerns = List.of();
        private ResourceUsage resourceUsage = ResourceUsage.ZERO;
        private Integer confidenceScore;
        private int refinementCount;
        private Instant timestamp = Instant.now();

        private Builder() {}

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder roleKey(String roleKey) {
            this.roleKey = roleKey;
            return this;
        }

        public Builder roundIndex(int roundIndex) {
            this.roundIndex = roundIndex;
            return this;
        }

        /// Sets the summary.
        ///
        /// @param summary short justification, may be null (stored as empty)
        /// @return this builder for chaining
        public Builder summary(String summary) {
            this.summary = summary != null ? summary : "";
            return this;
        }

        public Builder details(String details) {
            this.details = details != null ? details : "";
            return this;
        }

        /// Sets the scorecard.
        ///
        /// @param scorecard worker scores, may be null (stored as empty)
        /// @return this builder for chaining
        public Builder scorecard(Scorecard scorecard) {
            this.scorecard = scorecard != null ? scorecard : Scorecard.empty();
            return this;
        }

        public Builder concerns(List<String> concerns) {
            this.concerns = concerns != null ? List.copyOf(concerns) : List.of();
            return this;
        }

        public Builder resourceUsage(ResourceUsage resourceUsage) {
            this.resourceUsage = resourceUsage != null ? resourceUsage : ResourceUsage.ZERO;
            return this;
        }

        /// Sets the self-reported confidence.
        ///
        /// @param confidenceScore value in [0, 100], or null if not reported
        /// @return this builder for chaining
        /// @throws IllegalArgumentException if the value is outside [0, 100]
        public Builder confidenceScore(Integer confidenceScore) {
            if (confidenceScore != null && (confidenceScore < 0 || confidenceScore > 100)) {
                throw new IllegalArgumentException(
                        "confidenceScore must be in [0, 100], was " + confidenceScore);
            }
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder refinementCount(int refinementCount) {
            this.refinementCount = refinementCount;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public WorkerResult build() {
            return new WorkerResult(this);
        }
    }
}
