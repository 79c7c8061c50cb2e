package io.conclave.core.metric;

import java.util.Optional;

/// Figures computed from an aggregated eight-pillar scorecard.
///
/// Neither value is scored by workers directly; both are derived after the
/// discussion finishes.
///
/// @implNote Stateless utility class. Safe to call from any thread.
///
/// @see DefaultMetrics for the metric names read here
public final class DerivedMetrics {

    static final double QUALITY_FACTOR = 0.4;
    static final double COMPLEXITY_FACTOR = 0.3;
    static final double ESTIMATION_FACTOR = 0.3;
    static final double BASELINE = 3.0;
    static final double MAX_PENALTY = 4.0;
    static final double NEUTRAL_ESTIMATION = 5.0;

    private DerivedMetrics() {}

    /// Returns introduced debt minus reduced debt, in hours.
    ///
    /// A missing side counts as zero; when both sides are missing there is no value.
    ///
    /// @param scorecard aggregated scorecard, not null
    /// @return net debt hours, empty if neither debt metric has a value
    public static Optional<Double> netDebt(Scorecard scorecard) {
        Optional<Double> introduced = scorecard.valueOf(DefaultMetrics.TECHNICAL_DEBT_HOURS);
        Optional<Double> reduced = scorecard.valueOf(DefaultMetrics.DEBT_REDUCTION_HOURS);
        if (introduced.isEmpty() && reduced.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(introduced.orElse(0.0) - reduced.orElse(0.0));
    }

    /// Computes the overall commit score on a 1-10 scale.
    ///
    /// ```
    /// estimation = idealHours > 0 ? max(0, 10 - |actual - ideal| / ideal * 10) : 5
    /// score      = quality * 0.4 - complexity * 0.3 + estimation * 0.3 + 3 - penalty
    /// ```
    ///
    /// The penalty is largest for very short changes that are complex or of low
    /// quality, and is capped at 4.
    ///
    /// @param scorecard aggregated scorecard, not null
    /// @return score clamped to [1, 10], empty unless quality, complexity, actual
    ///         and ideal hours all have values
    public static Optional<Double> commitScore(Scorecard scorecard) {
        Optional<Double> quality = scorecard.valueOf(DefaultMetrics.CODE_QUALITY);
        Optional<Double> complexity = scorecard.valueOf(DefaultMetrics.CODE_COMPLEXITY);
        Optional<Double> actual = scorecard.valueOf(DefaultMetrics.ACTUAL_TIME_HOURS);
        Optional<Double> ideal = scorecard.valueOf(DefaultMetrics.IDEAL_TIME_HOURS);
        if (quality.isEmpty() || complexity.isEmpty() || actual.isEmpty() || ideal.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(
                commitScore(quality.get(), complexity.get(), actual.get(), ideal.get()));
    }

    static double commitScore(
            double quality, double complexity, double actualHours, double idealHours) {
        double estimation =
                idealHours > 0
                        ? Math.max(0, 10 - (Math.abs(actualHours - idealHours) / idealHours) * 10)
                        : NEUTRAL_ESTIMATION;
        double penalty = penalty(actualHours * 60, complexity, quality);
        double score =
                quality * QUALITY_FACTOR
                        - complexity * COMPLEXITY_FACTOR
                        + estimation * ESTIMATION_FACTOR
                        + BASELINE
                        - penalty;
        return Math.max(1, Math.min(10, score));
    }

    private static double penalty(double actualMinutes, double complexity, double quality) {
        double timeFactor = 1 / (1 + Math.pow(actualMinutes / 60, 2));
        double complexityPenalty = Math.pow(complexity / 10, 2) * timeFactor * 4;
        double qualityPenalty = Math.pow((10 - quality) / 10, 2) * timeFactor * 4;
        return Math.min(MAX_PENALTY, Math.max(complexityPenalty, qualityPenalty));
    }
}
