package io.conclave.core.execution;

import io.conclave.core.execution.WorkerFailure.Kind;
import io.conclave.core.metric.MetricRegistry;
import io.conclave.core.metric.Scorecard;
import io.conclave.core.worker.EvaluationContext;
import io.conclave.core.worker.Worker;
import io.conclave.core.worker.WorkerResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Runs the eligible workers of one round concurrently and collects their results.
///
/// ### This executor
///
/// - Submits every worker to the shared ExecutorService at once
/// - Waits for each worker against its own deadline, measured from when its call starts
/// - Converts exceptions and timeouts into {@link WorkerFailure} records
/// - Rejects results with a blank summary or a missing required metric
/// - Strips scorecard keys unknown to the {@link MetricRegistry}
/// - Stamps worker id, role key and round index onto each kept result
///
/// A failing worker never aborts the round. Failed workers are not retried. Time a
/// worker spends queued behind other tasks of a shared pool does not count against
/// its timeout.
///
/// @implNote The ExecutorService is NOT shut down by this executor; lifecycle is
/// managed by the owner. The executor holds no per-round state and may serve several
/// discussions concurrently.
///
/// @see DiscussionController for the round loop
public class RoundExecutor {

    private static final Logger logger = Logger.getLogger(RoundExecutor.class.getName());

    private final ExecutorService executorService;
    private final MetricRegistry registry;
    private final Duration timeout;

    /// Creates a round executor.
    ///
    /// @param executorService pool running worker invocations, not null
    /// @param registry metrics a scorecard may contain, not null
    /// @param timeout per-call worker timeout, null for no timeout
    public RoundExecutor(ExecutorService executorService, MetricRegistry registry, Duration timeout) {
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive, was " + timeout);
        }
        this.timeout = timeout;
    }

    /// Executes one round.
    ///
    /// @param workers eligible workers, not null (may be empty)
    /// @param context context shared by all workers of the round, not null
    /// @return valid results and failures, never null
    /// @throws IllegalStateException if the calling thread is interrupted while waiting
    public RoundOutcome runRound(List<Worker> workers, EvaluationContext context) {
        int round = context.roundIndex();
        logger.info("Executing round " + round + " with " + workers.size() + " workers");

        List<TimedCall> calls = new ArrayList<>(workers.size());
        List<Future<WorkerResult>> futures = new ArrayList<>(workers.size());
        for (Worker worker : workers) {
            TimedCall call = new TimedCall(worker, context);
            calls.add(call);
            futures.add(executorService.submit(call));
        }

        List<WorkerResult> results = new ArrayList<>();
        List<WorkerFailure> failures = new ArrayList<>();

        for (int i = 0; i < futures.size(); i++) {
            Future<WorkerResult> future = futures.get(i);
            Worker worker = workers.get(i);
            try {
                WorkerResult raw = await(future, calls.get(i));
                String problem = validate(raw);
                if (problem != null) {
                    logger.warning(
                            "Discarding invalid result from worker "
                                    + worker.getId()
                                    + " in round "
                                    + round
                                    + ": "
                                    + problem);
                    failures.add(failure(worker, round, Kind.INVALID_RESULT, problem));
                } else {
                    results.add(stamp(raw, worker, round));
                }
            } catch (TimeoutException e) {
                logger.warning(
                        "Worker timed out after " + timeout + " in round " + round + ": " + worker.getId());
                future.cancel(true);
                failures.add(failure(worker, round, Kind.TIMEOUT, "Timed out after " + timeout));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.warning(
                        "Worker failed with exception in round "
                                + round
                                + ": "
                                + worker.getId()
                                + " - "
                                + cause.getMessage());
                failures.add(
                        failure(
                                worker,
                                round,
                                Kind.ERROR,
                                cause.getClass().getSimpleName() + ": " + cause.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Round " + round + " interrupted", e);
            }
        }

        if (!failures.isEmpty()) {
            logger.warning(
                    "Round " + round + " completed with " + failures.size() + " failed workers");
        }
        return new RoundOutcome(results, failures);
    }

    private WorkerResult await(Future<WorkerResult> future, TimedCall call)
            throws InterruptedException, ExecutionException, TimeoutException {
        if (timeout == null) {
            return future.get();
        }
        call.started.await();
        long deadline = call.startNanos + timeout.toNanos();
        long remaining = Math.max(0L, deadline - System.nanoTime());
        return future.get(remaining, TimeUnit.NANOSECONDS);
    }

    /// Worker invocation that records when the pool actually started running it.
    private static final class TimedCall implements Callable<WorkerResult> {

        private final Worker worker;
        private final EvaluationContext context;
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startNanos;

        TimedCall(Worker worker, EvaluationContext context) {
            this.worker = worker;
            this.context = context;
        }

        @Override
        public WorkerResult call() throws Exception {
            startNanos = System.nanoTime();
            started.countDown();
            return worker.execute(context);
        }
    }

    /// Returns the reason a result is unusable, or null if it is valid.
    private String validate(WorkerResult result) {
        if (result == null) {
            return "worker returned no result";
        }
        if (!result.hasSummary()) {
            return "summary is blank";
        }
        Scorecard scorecard = result.getScorecard();
        for (String required : registry.requiredNames()) {
            if (scorecard.get(required) == null) {
                return "required metric '" + required + "' is missing or null";
            }
        }
        return null;
    }

    private WorkerResult stamp(WorkerResult raw, Worker worker, int round) {
        Scorecard sanitized = raw.getScorecard().restrictTo(registry);
        if (sanitized.size() < raw.getScorecard().size()) {
            logger.fine("Stripped unknown metrics from worker " + worker.getId());
        }
        return raw.toBuilder()
                .workerId(worker.getId())
                .roleKey(worker.getRoleKey())
                .roundIndex(round)
                .scorecard(sanitized)
                .build();
    }

    private static WorkerFailure failure(Worker worker, int round, Kind kind, String message) {
        return new WorkerFailure(worker.getId(), worker.getRoleKey(), round, kind, message);
    }
}
