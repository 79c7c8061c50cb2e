package io.conclave.core.execution.convergence;

import io.conclave.core.worker.WorkerResult;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Decides whether a discussion has stabilized by comparing consecutive rounds.
///
/// ### Scoring
/// ```
/// contentSimilarity = mean over all (current, previous) pairs of jaccard(words(c), words(p))
/// metricStability   = 1 - mean over shared metrics of |avg|cur| - avg|prev|| / 10
/// score             = 0.7 * contentSimilarity + 0.3 * metricStability
/// converged         = score >= threshold
/// ```
///
/// Words are the lower-cased, whitespace-separated tokens of `summary + " " + details`
/// longer than three characters. Pairs are not matched by role: every current result
/// is compared with every previous result. Two identical rounds therefore reach a
/// content similarity of 1 only when they hold a single result or all results share
/// the same text; two workers with different texts repeated verbatim score 0.5 on
/// content and 0.65 overall.
///
/// A metric is shared when both rounds have at least one non-null value for it. With no
/// shared metric, stability is 1.
///
/// @implNote Stateless. Safe to share across threads.
public class ConvergenceDetector {

    private static final Logger logger = Logger.getLogger(ConvergenceDetector.class.getName());

    static final double CONTENT_WEIGHT = 0.7;
    static final double STABILITY_WEIGHT = 0.3;
    static final double METRIC_SCALE = 10.0;
    static final int MIN_WORD_LENGTH = 4;

    /// Compares the current round's results with the previous round's.
    ///
    /// @param current valid results of the round just completed, not null
    /// @param previous valid results of the round before it, not null
    /// @param threshold score at or above which the rounds count as converged, in [0, 1]
    /// @return convergence verdict, {@link ConvergenceResult#none()} when there is no
    ///         previous round
    public ConvergenceResult detect(
            List<WorkerResult> current, List<WorkerResult> previous, double threshold) {
        Objects.requireNonNull(current, "current must not be null");
        Objects.requireNonNull(previous, "previous must not be null");
        if (previous.isEmpty()) {
            return ConvergenceResult.none();
        }

        double content = contentSimilarity(current, previous);
        double stability = metricStability(current, previous);
        double score = CONTENT_WEIGHT * content + STABILITY_WEIGHT * stability;
        boolean converged = score >= threshold;

        logger.fine(
                "Convergence: content="
                        + content
                        + ", stability="
                        + stability
                        + ", score="
                        + score
                        + ", converged="
                        + converged);
        return new ConvergenceResult(score, content, stability, converged);
    }

    /// Averages the Jaccard similarity over all current/previous pairs.
    ///
    /// @return similarity in [0, 1], 0 if either list is empty
    public double contentSimilarity(List<WorkerResult> current, List<WorkerResult> previous) {
        if (current.isEmpty() || previous.isEmpty()) {
            return 0.0;
        }
        List<Set<String>> previousWords =
                previous.stream().map(r -> words(r.combinedText())).toList();

        double total = 0.0;
        int pairs = 0;
        for (WorkerResult result : current) {
            Set<String> currentWords = words(result.combinedText());
            for (Set<String> other : previousWords) {
                total += jaccard(currentWords, other);
                pairs++;
            }
        }
        return total / pairs;
    }

    /// Jaccard similarity of two word sets.
    ///
    /// @return |a ∩ b| / |a ∪ b|, or 0 if either set is empty
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    /// Extracts the comparable words of a text.
    ///
    /// @param text any text, may be null
    /// @return distinct lower-cased words longer than three characters, never null
    public static Set<String> words(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .filter(word -> word.length() >= MIN_WORD_LENGTH)
                .collect(Collectors.toSet());
    }

    /// Measures how much the average absolute metric values moved between rounds.
    ///
    /// @return stability in [0, 1], 1 if no metric has values in both rounds
    public double metricStability(List<WorkerResult> current, List<WorkerResult> previous) {
        Set<String> metrics = new TreeSet<>();
        current.forEach(r -> metrics.addAll(r.getScorecard().metricNames()));
        previous.forEach(r -> metrics.addAll(r.getScorecard().metricNames()));

        double totalDifference = 0.0;
        int compared = 0;
        for (String metric : metrics) {
            double[] currentValues = values(current, metric);
            double[] previousValues = values(previous, metric);
            if (currentValues.length == 0 || previousValues.length == 0) {
                continue;
            }
            totalDifference +=
                    Math.abs(averageAbs(currentValues) - averageAbs(previousValues))
                            / METRIC_SCALE;
            compared++;
        }
        if (compared == 0) {
            return 1.0;
        }
        double stability = 1.0 - totalDifference / compared;
        return Math.max(0.0, Math.min(1.0, stability));
    }

    private static double[] values(List<WorkerResult> results, String metric) {
        return results.stream()
                .map(r -> r.getScorecard().get(metric))
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .toArray();
    }

    private static double averageAbs(double[] values) {
        return Arrays.stream(values).map(Math::abs).average().orElse(0.0);
    }
}
