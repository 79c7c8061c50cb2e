package io.conclave.core.execution.optout;

import io.conclave.core.metric.MetricRegistry;
import io.conclave.core.worker.WorkerResult;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Detects workers whose scores did not change between two consecutive rounds.
///
/// A worker that repeats every metric value exactly has confirmed its position and
/// gains nothing from another round; the controller excludes it permanently.
///
/// Comparison uses `Double` equality per metric of the registry. A metric that is
/// null or absent on both sides counts as unchanged; null on one side only counts as
/// changed.
public class OptOutTracker {

    private static final Logger logger = Logger.getLogger(OptOutTracker.class.getName());

    private final MetricRegistry registry;

    public OptOutTracker(MetricRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /// Checks whether a worker repeated its previous scores exactly.
    ///
    /// @param current the worker's result in this round, not null
    /// @param previous the same worker's result in the previous round, may be null
    /// @return true if every registry metric is identical, false if there is no previous
    public boolean detectStable(WorkerResult current, WorkerResult previous) {
        if (previous == null) {
            return false;
        }
        for (String metric : registry.names()) {
            Double now = current.getScorecard().get(metric);
            Double before = previous.getScorecard().get(metric);
            if (!Objects.equals(now, before)) {
                return false;
            }
        }
        return true;
    }

    /// Finds all workers of the current round that repeated their previous scores.
    ///
    /// Results are matched to the previous round by worker id.
    ///
    /// @param current valid results of the round just completed, not null
    /// @param previous valid results of the round before, not null
    /// @return ids of stable workers in current-result order, never null
    public Set<String> findStableWorkers(List<WorkerResult> current, List<WorkerResult> previous) {
        Map<String, WorkerResult> previousById =
                previous.stream()
                        .collect(
                                Collectors.toMap(
                                        WorkerResult::getWorkerId,
                                        Function.identity(),
                                        (first, second) -> second));

        Set<String> stable = new LinkedHashSet<>();
        for (WorkerResult result : current) {
            if (detectStable(result, previousById.get(result.getWorkerId()))) {
                logger.info(
                        "Worker "
                                + result.getWorkerId()
                                + " confirmed its scores in round "
                                + result.getRoundIndex()
                                + " and opts out");
                stable.add(result.getWorkerId());
            }
        }
        return stable;
    }
}
