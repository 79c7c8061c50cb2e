package io.conclave.core.execution.aggregate;

import io.conclave.core.metric.MetricRegistry;
import io.conclave.core.metric.Scorecard;
import io.conclave.core.weight.WeightTable;
import io.conclave.core.worker.WorkerResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Combines the scorecards of one round into a single weighted scorecard.
///
/// For each metric of the registry, in registry order:
///
/// ```
/// value(M) = sum(v_i * w(role_i, M)) / sum(w(role_i, M))   over results with v_i != null
/// ```
///
/// - No contributor for M: M is absent from the output (never zero)
/// - Contributing weights sum to zero: plain arithmetic mean of the values
///
/// Null contributions are skipped entirely, so an abstaining role neither pulls the
/// value toward zero nor dilutes the other weights.
///
/// @implNote Stateless and deterministic: the same results in any order give the same
/// scorecard up to floating-point summation order. Safe to share across threads.
///
/// @see WeightTable for role weights and the primary threshold
public class WeightedAggregator {

    private static final Logger logger = Logger.getLogger(WeightedAggregator.class.getName());

    private final WeightTable weights;
    private final MetricRegistry registry;

    public WeightedAggregator(WeightTable weights, MetricRegistry registry) {
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /// Aggregates the results of a round.
    ///
    /// Logs a warning for every primary-weight role that abstained on its metric.
    ///
    /// @param results valid results of one round, not null (may be empty)
    /// @return aggregated scorecard without null values, empty if there were no results
    public Scorecard aggregate(List<WorkerResult> results) {
        Scorecard.Builder aggregated = Scorecard.builder();

        for (String metric : registry.names()) {
            double weightedSum = 0.0;
            double weightSum = 0.0;
            double plainSum = 0.0;
            int count = 0;

            for (WorkerResult result : results) {
                Double value = result.getScorecard().get(metric);
                if (value == null) {
                    continue;
                }
                double weight = weights.weight(result.getRoleKey(), metric);
                weightedSum += value * weight;
                weightSum += weight;
                plainSum += value;
                count++;
            }

            if (count == 0) {
                continue;
            }
            aggregated.put(metric, weightSum > 0 ? weightedSum / weightSum : plainSum / count);
        }

        for (AggregationGap gap : findPrimaryGaps(results)) {
            logger.warning(
                    "Primary role "
                            + gap.roleKey()
                            + " (worker "
                            + gap.workerId()
                            + ", weight "
                            + gap.weight()
                            + ") returned no value for "
                            + gap.metric());
        }
        return aggregated.build();
    }

    /// Finds primary-weight roles that returned null or omitted a metric.
    ///
    /// @param results valid results of one round, not null
    /// @return gaps in result order then registry order, never null
    public List<AggregationGap> findPrimaryGaps(List<WorkerResult> results) {
        List<AggregationGap> gaps = new ArrayList<>();
        for (WorkerResult result : results) {
            if (!weights.knowsRole(result.getRoleKey())) {
                continue;
            }
            String roleKey = weights.normalizeRole(result.getRoleKey());
            for (String metric : registry.names()) {
                double weight = weights.weight(roleKey, metric);
                if (weight >= WeightTable.PRIMARY_THRESHOLD
                        && result.getScorecard().get(metric) == null) {
                    gaps.add(new AggregationGap(result.getWorkerId(), roleKey, metric, weight));
                }
            }
        }
        return gaps;
    }
}
