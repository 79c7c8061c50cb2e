package io.conclave.core;

import io.conclave.core.execution.DiscussionController;
import io.conclave.core.execution.RoundExecutor;
import io.conclave.core.execution.aggregate.WeightedAggregator;
import io.conclave.core.execution.convergence.ConvergenceDetector;
import io.conclave.core.execution.optout.OptOutTracker;
import io.conclave.core.metric.MetricRegistry;
import io.conclave.core.storage.DiscussionStateRepository;
import io.conclave.core.weight.WeightTable;
import java.util.concurrent.ExecutorService;

/// Container holding all components required to run discussions.
///
/// Implements {@link AutoCloseable} to shut down the worker thread pool.
///
/// ### Contracts
/// - **Precondition**: All constructor parameters must be non-null
/// - **Invariant**: Component references are immutable after construction
///
/// @implNote Safe for concurrent reads. The controller returned by
/// {@link #getController()} holds no per-discussion state and can run several
/// discussions at once.
///
/// @apiNote Create instances via {@link ConclaveFactory#createEnvironment()} or
/// {@link ConclaveFactory.Builder} rather than direct construction.
public final class ConclaveEnvironment implements AutoCloseable {

    private final ConclaveConfig config;
    private final MetricRegistry metricRegistry;
    private final WeightTable weightTable;
    private final DiscussionStateRepository stateRepository;
    private final ExecutorService executorService;
    private final DiscussionController controller;

    /// Creates an environment and wires a discussion controller from its parts.
    ///
    /// @param config configuration the environment was built from, not null
    /// @param metricRegistry metrics scorecards may contain, not null
    /// @param weightTable role weights for aggregation, not null
    /// @param stateRepository checkpoint storage, not null
    /// @param executorService thread pool for worker invocations, not null
    public ConclaveEnvironment(
            ConclaveConfig config,
            MetricRegistry metricRegistry,
            WeightTable weightTable,
            DiscussionStateRepository stateRepository,
            ExecutorService executorService) {
        this.config = config;
        this.metricRegistry = metricRegistry;
        this.weightTable = weightTable;
        this.stateRepository = stateRepository;
        this.executorService = executorService;
        this.controller =
                new DiscussionController(
                        new RoundExecutor(executorService, metricRegistry, config.getWorkerTimeout()),
                        new WeightedAggregator(weightTable, metricRegistry),
                        new ConvergenceDetector(),
                        new OptOutTracker(metricRegistry),
                        stateRepository);
    }

    public ConclaveConfig getConfig() {
        return config;
    }

    public MetricRegistry getMetricRegistry() {
        return metricRegistry;
    }

    public WeightTable getWeightTable() {
        return weightTable;
    }

    /// Returns the repository receiving a checkpoint after every round.
    ///
    /// @return the state repository, never null
    public DiscussionStateRepository getStateRepository() {
        return stateRepository;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    /// Returns the discussion controller wired to this environment.
    ///
    /// @return the controller, never null
    public DiscussionController getController() {
        return controller;
    }

    /// Shuts down the underlying executor service gracefully.
    ///
    /// @implNote Calls `ExecutorService.shutdown()` which does not block.
    @Override
    public void close() {
        executorService.shutdown();
    }
}
