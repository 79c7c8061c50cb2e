package io.conclave.core.execution;

import io.conclave.core.diff.DiffContext;
import io.conclave.core.exception.ControllerFaultException;
import io.conclave.core.execution.aggregate.WeightedAggregator;
import io.conclave.core.execution.convergence.ConvergenceDetector;
import io.conclave.core.execution.convergence.ConvergenceResult;
import io.conclave.core.execution.optout.OptOutTracker;
import io.conclave.core.execution.result.RoundRecord;
import io.conclave.core.metric.Scorecard;
import io.conclave.core.state.DiscussionPhase;
import io.conclave.core.state.DiscussionSnapshot;
import io.conclave.core.state.DiscussionState;
import io.conclave.core.storage.DiscussionStateRepository;
import io.conclave.core.worker.EvaluationContext;
import io.conclave.core.worker.ResourceUsage;
import io.conclave.core.worker.TeamConcern;
import io.conclave.core.worker.Worker;
import io.conclave.core.worker.WorkerResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Drives a multi-round discussion between reviewer workers.
///
/// ### Round loop
/// Each round runs these steps in order:
///
/// 1. Eligible set = roster minus excluded workers minus workers rejecting the context
/// 2. {@link RoundExecutor} runs the eligible workers concurrently
/// 3. {@link WeightedAggregator} computes the round scorecard and merges it into the
///    running aggregate
/// 4. {@link ConvergenceDetector} compares the round with the previous one
/// 5. {@link OptOutTracker} excludes workers that repeated their scores
/// 6. A {@link RoundRecord} is appended to the history
/// 7. The round index advances and the state is checkpointed
///
/// ### Stop rule
/// With `r` the index of the round just completed, the discussion stops when
/// `converged && r >= minRounds - 1`, or when `r + 1 >= maxRounds`. It also stops
/// when no worker is eligible; that empty round is not recorded.
///
/// @implNote Holds no per-discussion state. All mutable state lives in a
/// {@link DiscussionState} created per call, so one controller can run several
/// discussions concurrently.
///
/// @see DiscussionListener for progress callbacks
/// @see DiscussionStateRepository for checkpoint persistence
public class DiscussionController {

    private static final Logger logger = Logger.getLogger(DiscussionController.class.getName());

    private final RoundExecutor roundExecutor;
    private final WeightedAggregator aggregator;
    private final ConvergenceDetector convergenceDetector;
    private final OptOutTracker optOutTracker;
    private final DiscussionStateRepository stateRepository;

    public DiscussionController(
            RoundExecutor roundExecutor,
            WeightedAggregator aggregator,
            ConvergenceDetector convergenceDetector,
            OptOutTracker optOutTracker) {
        this(roundExecutor, aggregator, convergenceDetector, optOutTracker, null);
    }

    /// Creates a controller that also saves a checkpoint after every round.
    ///
    /// @param roundExecutor runs one round, not null
    /// @param aggregator combines round scorecards, not null
    /// @param convergenceDetector compares consecutive rounds, not null
    /// @param optOutTracker finds workers with unchanged scores, not null
    /// @param stateRepository checkpoint store, may be null to disable persistence
    public DiscussionController(
            RoundExecutor roundExecutor,
            WeightedAggregator aggregator,
            ConvergenceDetector convergenceDetector,
            OptOutTracker optOutTracker,
            DiscussionStateRepository stateRepository) {
        this.roundExecutor = Objects.requireNonNull(roundExecutor, "roundExecutor must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.convergenceDetector =
                Objects.requireNonNull(convergenceDetector, "convergenceDetector must not be null");
        this.optOutTracker = Objects.requireNonNull(optOutTracker, "optOutTracker must not be null");
        this.stateRepository = stateRepository;
    }

    public EvaluationOutcome evaluate(
            DiffContext diff, List<? extends Worker> roster, DiscussionOptions options) {
        return evaluate(diff, roster, options, DiscussionListener.NOOP);
    }

    /// Runs a discussion from round 0 until the stop rule fires.
    ///
    /// @param diff the change under evaluation, not null
    /// @param roster participating workers with unique ids, not empty
    /// @param options round limits and threshold, not null
    /// @param listener progress callbacks, may be null
    /// @return the final outcome with the full history, never null
    /// @throws ControllerFaultException if the configuration is unusable; raised
    ///         before any worker runs
    public EvaluationOutcome evaluate(
            DiffContext diff,
            List<? extends Worker> roster,
            DiscussionOptions options,
            DiscussionListener listener) {
        if (diff == null) {
            throw new ControllerFaultException("diff must not be null");
        }
        if (options == null) {
            throw new ControllerFaultException("options must not be null");
        }
        validateOptions(options);
        validateRoster(roster);

        DiscussionState state = DiscussionState.start(diff, options);
        logger.info(
                "Starting discussion "
                        + state.getExecutionId()
                        + " with "
                        + roster.size()
                        + " workers, rounds "
                        + options.minRounds()
                        + ".."
                        + options.maxRounds()
                        + ", threshold "
                        + options.convergenceThreshold());
        return run(state, List.copyOf(roster), listener != null ? listener : DiscussionListener.NOOP);
    }

    public EvaluationOutcome resume(DiscussionSnapshot snapshot, List<? extends Worker> roster) {
        return resume(snapshot, roster, DiscussionListener.NOOP);
    }

    /// Continues a checkpointed discussion from its next round.
    ///
    /// A snapshot of a finished discussion is returned as an outcome without invoking
    /// any worker.
    ///
    /// @param snapshot checkpoint to continue from, not null
    /// @param roster the same workers the discussion started with, not empty
    /// @param listener progress callbacks, may be null
    /// @return the final outcome with the full history, never null
    /// @throws ControllerFaultException if the snapshot or roster is unusable
    public EvaluationOutcome resume(
            DiscussionSnapshot snapshot,
            List<? extends Worker> roster,
            DiscussionListener listener) {
        if (snapshot == null) {
            throw new ControllerFaultException("snapshot must not be null");
        }
        DiscussionState state = snapshot.toState();
        validateOptions(state.getOptions());
        validateRoster(roster);
        if (!state.isDone() && state.getRoundIndex() >= state.getMaxRounds()) {
            throw new ControllerFaultException(
                    "Snapshot round index "
                            + state.getRoundIndex()
                            + " must be < maxRounds "
                            + state.getMaxRounds());
        }

        DiscussionListener effective = listener != null ? listener : DiscussionListener.NOOP;
        if (state.isDone()) {
            logger.info("Discussion " + state.getExecutionId() + " already completed");
            return toOutcome(state);
        }
        state.setPhase(DiscussionPhase.AWAITING_ROUND);
        logger.info(
                "Resuming discussion "
                        + state.getExecutionId()
                        + " at round "
                        + state.getRoundIndex());
        return run(state, List.copyOf(roster), effective);
    }

    private EvaluationOutcome run(
            DiscussionState state, List<Worker> roster, DiscussionListener listener) {
        while (!state.isDone()) {
            int round = state.getRoundIndex();
            EvaluationContext context =
                    new EvaluationContext(
                            state.getDiff(),
                            round,
                            state.getMaxRounds(),
                            state.getPreviousRoundResults(),
                            state.getTeamConcerns());

            List<Worker> eligible = eligibleWorkers(roster, state.getExcludedWorkers(), context);
            if (eligible.isEmpty()) {
                logger.info("No eligible workers for round " + round + ", stopping discussion");
                state.setPhase(DiscussionPhase.DONE);
                checkpoint(state, "no-eligible-workers", listener);
                break;
            }

            state.setPhase(DiscussionPhase.ROUND_IN_PROGRESS);
            List<String> eligibleIds = eligible.stream().map(Worker::getId).toList();
            notifyListener(
                    "onRoundStart", () -> listener.onRoundStart(round, context.phase(), eligibleIds));

            RoundOutcome outcome = roundExecutor.runRound(eligible, context);
            state.setPhase(DiscussionPhase.DECIDING);

            RoundRecord record = fold(state, outcome);
            for (String workerId : record.newlyExcluded()) {
                notifyListener("onWorkerExcluded", () -> listener.onWorkerExcluded(workerId, round));
            }
            RoundProgress progress =
                    new RoundProgress(
                            round,
                            state.getMaxRounds(),
                            record.results().size(),
                            record.failures().size(),
                            state.getRunningAggregate(),
                            record.convergence());
            notifyListener("onRoundComplete", () -> listener.onRoundComplete(progress));

            boolean stop = shouldStop(record.convergence(), round, state);
            state.advanceRound();
            state.setPhase(stop ? DiscussionPhase.DONE : DiscussionPhase.AWAITING_ROUND);
            logger.info(
                    "Round "
                            + round
                            + " complete: "
                            + record.results().size()
                            + " results, "
                            + record.failures().size()
                            + " failures, convergence "
                            + record.convergence().score()
                            + (stop ? ", stopping" : ", continuing"));
            checkpoint(state, "round-" + round + "-complete", listener);
        }

        EvaluationOutcome outcome = toOutcome(state);
        logger.info(
                "Discussion "
                        + state.getExecutionId()
                        + " finished after "
                        + outcome.roundsRun()
                        + " rounds (converged="
                        + outcome.converged()
                        + ")");
        notifyListener("onDiscussionComplete", () -> listener.onDiscussionComplete(outcome));
        return outcome;
    }

    /// Applies the result of one round to the state and returns the appended record.
    private RoundRecord fold(DiscussionState state, RoundOutcome outcome) {
        int round = state.getRoundIndex();
        List<WorkerResult> results = outcome.results();
        List<WorkerResult> previous = state.getPreviousRoundResults();

        Scorecard roundAggregate = aggregator.aggregate(results);
        state.mergeAggregate(roundAggregate);

        ConvergenceResult convergence =
                convergenceDetector.detect(results, previous, state.getConvergenceThreshold());
        state.recordConvergence(convergence);

        Set<String> newlyExcluded =
                state.unionExcludedWorkers(optOutTracker.findStableWorkers(results, previous));

        ResourceUsage roundUsage = ResourceUsage.ZERO;
        for (WorkerResult result : results) {
            roundUsage = roundUsage.plus(result.getResourceUsage());
        }
        state.sumResourceUsage(roundUsage);

        RoundRecord record =
                new RoundRecord(
                        round,
                        results,
                        outcome.failures(),
                        roundAggregate,
                        convergence,
                        newlyExcluded,
                        roundUsage);
        state.appendHistory(record);
        state.replaceCurrentRoundResults(results);
        state.replaceTeamConcerns(collectConcerns(results));
        return record;
    }

    private static boolean shouldStop(
            ConvergenceResult convergence, int round, DiscussionState state) {
        boolean convergedAfterMinimum =
                convergence.converged() && round >= state.getMinRounds() - 1;
        boolean limitReached = round + 1 >= state.getMaxRounds();
        return convergedAfterMinimum || limitReached;
    }

    private List<Worker> eligibleWorkers(
            List<Worker> roster, Set<String> excluded, EvaluationContext context) {
        List<Worker> eligible = new ArrayList<>();
        for (Worker worker : roster) {
            if (excluded.contains(worker.getId())) {
                continue;
            }
            boolean accepted;
            try {
                accepted = worker.canExecute(context);
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Worker "
                                + worker.getId()
                                + " failed eligibility check for round "
                                + context.roundIndex()
                                + ", skipping",
                        e);
                accepted = false;
            }
            if (accepted) {
                eligible.add(worker);
            } else {
                logger.fine(
                        "Worker " + worker.getId() + " sits out round " + context.roundIndex());
            }
        }
        return eligible;
    }

    private static List<TeamConcern> collectConcerns(List<WorkerResult> results) {
        List<TeamConcern> concerns = new ArrayList<>();
        for (WorkerResult result : results) {
            for (String concern : result.getConcerns()) {
                if (concern != null && !concern.isBlank()) {
                    concerns.add(
                            new TeamConcern(
                                    result.getWorkerId(), result.getRoleKey(), concern.trim()));
                }
            }
        }
        return concerns;
    }

    private void checkpoint(DiscussionState state, String reason, DiscussionListener listener) {
        DiscussionSnapshot snapshot = state.snapshot(reason);
        notifyListener("onCheckpoint", () -> listener.onCheckpoint(snapshot));
        if (stateRepository != null) {
            stateRepository.save(snapshot);
        }
    }

    private static EvaluationOutcome toOutcome(DiscussionState state) {
        ConvergenceResult last = state.getLastConvergence();
        return new EvaluationOutcome(
                state.getExecutionId(),
                state.getHistory(),
                state.getRunningAggregate(),
                last.converged(),
                last.score(),
                state.getHistory().size(),
                state.getExcludedWorkers(),
                state.getTotalResourceUsage());
    }

    private static void notifyListener(String event, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Discussion listener failed in " + event, e);
        }
    }

    private static void validateOptions(DiscussionOptions options) {
        if (options.maxRounds() < 1) {
            throw new ControllerFaultException(
                    "maxRounds must be >= 1, was " + options.maxRounds());
        }
        if (options.minRounds() < 1) {
            throw new ControllerFaultException(
                    "minRounds must be >= 1, was " + options.minRounds());
        }
        if (options.minRounds() > options.maxRounds()) {
            throw new ControllerFaultException(
                    "minRounds must be <= maxRounds, was minRounds="
                            + options.minRounds()
                            + ", maxRounds="
                            + options.maxRounds());
        }
        double threshold = options.convergenceThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new ControllerFaultException(
                    "convergenceThreshold must be in [0, 1], was " + threshold);
        }
    }

    private static void validateRoster(List<? extends Worker> roster) {
        if (roster == null || roster.isEmpty()) {
            throw new ControllerFaultException("roster must contain at least one worker");
        }
        Set<String> ids = new HashSet<>();
        for (Worker worker : roster) {
            if (worker == null) {
                throw new ControllerFaultException("roster must not contain null workers");
            }
            if (worker.getId() == null) {
                throw new ControllerFaultException("worker id must not be null");
            }
            if (!ids.add(worker.getId())) {
                throw new ControllerFaultException("Duplicate worker id in roster: " + worker.getId());
            }
        }
    }
}
