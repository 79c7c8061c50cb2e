package io.conclave.core.worker.stub;

import io.conclave.core.worker.EvaluationContext;
import io.conclave.core.worker.Worker;
import io.conclave.core.worker.WorkerResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.logging.Logger;

/// Testing worker that replays scripted results without calling any model.
///
/// Each round consumes the next scripted step. When the script runs out, the last
/// step repeats, so a single step describes a worker that always answers the same.
///
/// ### Usage
/// {@snippet :
/// Worker architect = StubWorker.builder("w-arch", "senior-architect")
///     .respond(firstRoundResult)
///     .fail(new IllegalStateException("model unavailable"))
///     .build();
/// }
///
/// @implNote Thread-safe. Invocations are recorded in a copy-on-write list so
/// tests can inspect which rounds actually ran.
public final class StubWorker implements Worker {

    private static final Logger logger = Logger.getLogger(StubWorker.class.getName());

    private final String id;
    private final String roleKey;
    private final List<Step> script;
    private final Predicate<EvaluationContext> eligibility;
    private final List<Integer> invokedRounds = new CopyOnWriteArrayList<>();

    private StubWorker(Builder builder) {
        this.id = builder.id;
        this.roleKey = builder.roleKey;
        this.script = List.copyOf(builder.script);
        this.eligibility = builder.eligibility;
    }

    public static Builder builder(String id, String roleKey) {
        return new Builder(id, roleKey);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getRoleKey() {
        return roleKey;
    }

    @Override
    public boolean canExecute(EvaluationContext context) {
        return eligibility.test(context);
    }

    @Override
    public WorkerResult execute(EvaluationContext context) throws Exception {
        int call = invokedRounds.size();
        invokedRounds.add(context.roundIndex());
        Step step = script.get(Math.min(call, script.size() - 1));
        logger.info("[STUB] Worker '" + id + "' executing round " + context.roundIndex());

        if (!step.delay().isZero()) {
            Thread.sleep(step.delay().toMillis());
        }
        if (step.failure() != null) {
            throw step.failure();
        }
        return step.result();
    }

    /// Returns the round indexes this worker was invoked for, in call order.
    ///
    /// @return unmodifiable snapshot, never null
    public List<Integer> getInvokedRounds() {
        return Collections.unmodifiableList(new ArrayList<>(invokedRounds));
    }

    public int getInvocationCount() {
        return invokedRounds.size();
    }

    private record Step(WorkerResult result, Exception failure, Duration delay) {}

    /// Builder for scripted stub workers.
    public static final class Builder {
        private final String id;
        private final String roleKey;
        private final List<Step> script = new ArrayList<>();
        private Predicate<EvaluationContext> eligibility = context -> true;

        private Builder(String id, String roleKey) {
            this.id = Objects.requireNonNull(id, "id must not be null");
            this.roleKey = Objects.requireNonNull(roleKey, "roleKey must not be null");
        }

        /// Appends a step that returns the given result.
        public Builder respond(WorkerResult result) {
            script.add(new Step(Objects.requireNonNull(result, "result"), null, Duration.ZERO));
            return this;
        }

        /// Appends a step that throws the given exception.
        public Builder fail(Exception failure) {
            script.add(new Step(null, Objects.requireNonNull(failure, "failure"), Duration.ZERO));
            return this;
        }

        /// Appends a step that sleeps before returning the given result.
        ///
        /// @param delay how long to block, not null
        /// @param result result returned after the delay, not null
        /// @return this builder for chaining
        public Builder respondAfter(Duration delay, WorkerResult result) {
            script.add(
                    new Step(
                            Objects.requireNonNull(result, "result"),
                            null,
                            Objects.requireNonNull(delay, "delay")));
            return this;
        }

        /// Restricts the rounds this worker accepts.
        public Builder eligibleWhen(Predicate<EvaluationContext> eligibility) {
            this.eligibility = Objects.requireNonNull(eligibility, "eligibility");
            return this;
        }

        /// Builds the worker.
        ///
        /// @return new stub worker, never null
        /// @throws IllegalStateException if no step was scripted
        public StubWorker build() {
            if (script.isEmpty()) {
                throw new IllegalStateException("StubWorker '" + id + "' has no scripted steps");
            }
            return new StubWorker(this);
        }
    }
}
