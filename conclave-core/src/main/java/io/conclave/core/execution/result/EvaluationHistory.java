package io.conclave.core.execution.result;

import io.conclave.core.worker.RoundPhase;
import io.conclave.core.worker.WorkerResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Append-only record of all completed rounds of one discussion.
///
/// Rounds are kept in completion order. Results of workers that later opted out stay
/// in the history; they are never re-counted in later rounds.
///
/// @implNote **Not thread-safe**. Owned by a single discussion. The `copy()` method
/// creates an independent instance for safe sharing.
///
/// @see RoundRecord for the per-round contents
public class EvaluationHistory {

    private List<RoundRecord> rounds = new ArrayList<>();
    private int maxRounds;

    public EvaluationHistory() {}

    /// Creates an empty history for a discussion with the given round limit.
    ///
    /// @param maxRounds round limit, used to label transcript phases
    public EvaluationHistory(int maxRounds) {
        this.maxRounds = maxRounds;
    }

    /// Appends a completed round.
    ///
    /// @apiNote **Side effects**: Modifies internal round list
    ///
    /// @param round the completed round, not null
    /// @throws IllegalArgumentException if the round index does not follow the last one
    public void append(RoundRecord round) {
        int expected = rounds.size();
        if (round.roundIndex() != expected) {
            throw new IllegalArgumentException(
                    "Expected round " + expected + " but got round " + round.roundIndex());
        }
        rounds.add(round);
    }

    /// Returns all recorded rounds.
    ///
    /// @return immutable copy of the rounds list, never null
    public List<RoundRecord> getRounds() {
        return List.copyOf(rounds);
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    public int size() {
        return rounds.size();
    }

    public boolean isEmpty() {
        return rounds.isEmpty();
    }

    /// Counts the valid results across all rounds.
    public int resultCount() {
        return rounds.stream().mapToInt(r -> r.results().size()).sum();
    }

    /// Returns every valid result in append order.
    ///
    /// @return immutable list, never null
    public List<WorkerResult> allResults() {
        return rounds.stream().flatMap(r -> r.results().stream()).toList();
    }

    public Optional<RoundRecord> lastRound() {
        return rounds.isEmpty() ? Optional.empty() : Optional.of(rounds.get(rounds.size() - 1));
    }

    /// Renders the discussion as a chronological list of messages.
    ///
    /// @return one message per valid result in append order, never null
    public List<ConversationMessage> transcript() {
        List<ConversationMessage> messages = new ArrayList<>();
        for (RoundRecord round : rounds) {
            RoundPhase phase = RoundPhase.of(round.roundIndex(), Math.max(1, maxRounds));
            for (WorkerResult result : round.results()) {
                String text =
                        result.getDetails().isBlank()
                                ? result.getSummary()
                                : result.getSummary() + "\n\n" + result.getDetails();
                messages.add(
                        new ConversationMessage(
                                round.roundIndex(),
                                phase,
                                result.getWorkerId(),
                                result.getRoleKey(),
                                text,
                                result.getConcerns(),
                                result.getTimestamp()));
            }
        }
        return messages;
    }

    /// Creates an independent copy of this history.
    ///
    /// @return a new EvaluationHistory with copied data, never null
    public EvaluationHistory copy() {
        EvaluationHistory history = new EvaluationHistory(maxRounds);
        history.rounds = new ArrayList<>(rounds);
        return history;
    }
}
