package io.conclave.core.execution;

import static io.conclave.core.metric.DefaultMetrics.CODE_COMPLEXITY;
import static io.conclave.core.metric.DefaultMetrics.CODE_QUALITY;
import static io.conclave.core.metric.DefaultMetrics.TEST_COVERAGE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conclave.core.ResultFixtures;
import io.conclave.core.diff.DiffContext;
import io.conclave.core.execution.WorkerFailure.Kind;
import io.conclave.core.metric.DefaultMetrics;
import io.conclave.core.metric.Scorecard;
import io.conclave.core.worker.EvaluationContext;
import io.conclave.core.worker.Worker;
import io.conclave.core.worker.WorkerResult;
import io.conclave.core.worker.stub.StubWorker;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RoundExecutorTest {

    private ExecutorService executorService;
    private RoundExecutor executor;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        executorService = Executors.newFixedThreadPool(4);
        executor =
                new RoundExecutor(
                        executorService, DefaultMetrics.pillars(), Duration.ofSeconds(10));
        context = new EvaluationContext(DiffContext.of("+ added line"), 1, 3, List.of(), List.of());
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    private static StubWorker answering(String id, String role, WorkerResult result) {
        return StubWorker.builder(id, role).respond(result).build();
    }

    @Nested
    class ValidResults {

        @Test
        void shouldStampWorkerIdentityAndRound() {
            // Given: the worker returns a result without identity
            WorkerResult raw = ResultFixtures.uniform(null, null, 6.0);
            StubWorker worker = answering("w-sdet", "sdet", raw);

            // When
            RoundOutcome outcome = executor.runRound(List.of(worker), context);

            // Then
            assertThat(outcome.failures()).isEmpty();
            WorkerResult result = outcome.results().get(0);
            assertThat(result.getWorkerId()).isEqualTo("w-sdet");
            assertThat(result.getRoleKey()).isEqualTo("sdet");
            assertThat(result.getRoundIndex()).isEqualTo(1);
        }

        @Test
        void shouldStripMetricsUnknownToRegistry() {
            Scorecard card =
                    Scorecard.builder()
                            .put(CODE_QUALITY, 7.0)
                            .put(CODE_COMPLEXITY, 3.0)
                            .put("vibes", 10.0)
                            .build();
            StubWorker worker =
                    answering("w1", "sdet", ResultFixtures.result("w1", "sdet", "Fine", card));

            RoundOutcome outcome = executor.runRound(List.of(worker), context);

            assertThat(outcome.results().get(0).getScorecard().metricNames())
                    .containsExactly(CODE_QUALITY, CODE_COMPLEXITY);
        }

        @Test
        void shouldKeepNullForNullableMetric() {
            Scorecard card =
                    Scorecard.builder()
                            .put(TEST_COVERAGE, null)
                            .put(CODE_QUALITY, 7.0)
                            .put(CODE_COMPLEXITY, 3.0)
                            .build();
            StubWorker worker =
                    answering("w1", "sdet", ResultFixtures.result("w1", "sdet", "Fine", card));

            RoundOutcome outcome = executor.runRound(List.of(worker), context);

            assertThat(outcome.results()).hasSize(1);
            assertThat(outcome.results().get(0).getScorecard().isExplicitNull(TEST_COVERAGE))
                    .isTrue();
        }

        @Test
        void shouldReturnResultsInRosterOrder() {
            List<Worker> workers =
                    List.of(
                            answering("a", "sdet", ResultFixtures.uniform("a", "sdet", 1.0)),
                            answering("b", "sdet", ResultFixtures.uniform("b", "sdet", 2.0)),
                            answering("c", "sdet", ResultFixtures.uniform("c", "sdet", 3.0)));

            RoundOutcome outcome = executor.runRound(workers, context);

            assertThat(outcome.results())
                    .extracting(WorkerResult::getWorkerId)
                    .containsExactly("a", "b", "c");
        }
    }

    @Nested
    class FailureIsolation {

        @Test
        void shouldRecordThrowingWorkerAndKeepOthers() {
            StubWorker failing =
                    StubWorker.builder("w-bad", "sdet")
                            .fail(new IllegalStateException("rate limited"))
                            .build();
            StubWorker healthy =
                    answering("w-ok", "sdet", ResultFixtures.uniform("w-ok", "sdet", 5.0));

            RoundOutcome outcome = executor.runRound(List.of(failing, healthy), context);

            assertThat(outcome.results()).extracting(WorkerResult::getWorkerId).containsExactly("w-ok");
            assertThat(outcome.failures()).hasSize(1);
            WorkerFailure failure = outcome.failures().get(0);
            assertThat(failure.workerId()).isEqualTo("w-bad");
            assertThat(failure.kind()).isEqualTo(Kind.ERROR);
            assertThat(failure.roundIndex()).isEqualTo(1);
            assertThat(failure.message()).contains("rate limited");
        }

        @Test
        void shouldRejectBlankSummary() {
            WorkerResult blank =
                    ResultFixtures.result("w1", "sdet", "   ", ResultFixtures.uniformCard(5.0));

            RoundOutcome outcome =
                    executor.runRound(List.of(answering("w1", "sdet", blank)), context);

            assertThat(outcome.results()).isEmpty();
            assertThat(outcome.failures())
                    .singleElement()
                    .satisfies(f -> assertThat(f.kind()).isEqualTo(Kind.INVALID_RESULT));
        }

        @Test
        void shouldRejectMissingRequiredMetric() {
            Scorecard card = Scorecard.builder().put(CODE_QUALITY, 7.0).build();
            WorkerResult result = ResultFixtures.result("w1", "sdet", "Summary", card);

            RoundOutcome outcome =
                    executor.runRound(List.of(answering("w1", "sdet", result)), context);

            assertThat(outcome.results()).isEmpty();
            assertThat(outcome.failures().get(0).message()).contains(CODE_COMPLEXITY);
        }

        @Test
        void shouldRejectNullRequiredMetric() {
            Scorecard card =
                    Scorecard.builder().put(CODE_QUALITY, null).put(CODE_COMPLEXITY, 3.0).build();
            WorkerResult result = ResultFixtures.result("w1", "sdet", "Summary", card);

            RoundOutcome outcome =
                    executor.runRound(List.of(answering("w1", "sdet", result)), context);

            assertThat(outcome.failedWorkerIds()).containsExactly("w1");
            assertThat(outcome.allFailed()).isTrue();
        }

        @Test
        void shouldRejectNullResult() {
            Worker silent =
                    new Worker() {
                        @Override
                        public String getId() {
                            return "w-null";
                        }

                        @Override
                        public String getRoleKey() {
                            return "sdet";
                        }

                        @Override
                        public WorkerResult execute(EvaluationContext context) {
                            return null;
                        }
                    };

            RoundOutcome outcome = executor.runRound(List.of(silent), context);

            assertThat(outcome.failures().get(0).kind()).isEqualTo(Kind.INVALID_RESULT);
        }

        @Test
        void shouldTimeOutSlowWorker() {
            // Given: a round timeout far shorter than the slow worker's delay
            RoundExecutor fastExecutor =
                    new RoundExecutor(
                            executorService, DefaultMetrics.pillars(), Duration.ofMillis(200));
            StubWorker slow =
                    StubWorker.builder("w-slow", "sdet")
                            .respondAfter(
                                    Duration.ofSeconds(10),
                                    ResultFixtures.uniform("w-slow", "sdet", 5.0))
                            .build();
            StubWorker quick =
                    answering("w-quick", "sdet", ResultFixtures.uniform("w-quick", "sdet", 5.0));

            // When
            RoundOutcome outcome = fastExecutor.runRound(List.of(slow, quick), context);

            // Then
            assertThat(outcome.results())
                    .extracting(WorkerResult::getWorkerId)
                    .containsExactly("w-quick");
            assertThat(outcome.failures())
                    .singleElement()
                    .satisfies(
                            f -> {
                                assertThat(f.workerId()).isEqualTo("w-slow");
                                assertThat(f.kind()).isEqualTo(Kind.TIMEOUT);
                            });
        }

        @Test
        void shouldNotCountQueueTimeAgainstWorkerTimeout() {
            // Given: one pool thread, so the second worker waits for the first to finish
            ExecutorService singleThread = Executors.newSingleThreadExecutor();
            try {
                RoundExecutor perCall =
                        new RoundExecutor(
                                singleThread, DefaultMetrics.pillars(), Duration.ofMillis(1000));
                List<Worker> workers =
                        List.of(
                                StubWorker.builder("a", "sdet")
                                        .respondAfter(
                                                Duration.ofMillis(700),
                                                ResultFixtures.uniform("a", "sdet", 5.0))
                                        .build(),
                                StubWorker.builder("b", "sdet")
                                        .respondAfter(
                                                Duration.ofMillis(700),
                                                ResultFixtures.uniform("b", "sdet", 5.0))
                                        .build());

                // When: the round takes ~1400 ms, each call only 700 ms
                RoundOutcome outcome = perCall.runRound(workers, context);

                // Then
                assertThat(outcome.failures()).isEmpty();
                assertThat(outcome.results())
                        .extracting(WorkerResult::getWorkerId)
                        .containsExactly("a", "b");
            } finally {
                singleThread.shutdownNow();
            }
        }

        @Test
        void shouldHandleEmptyRound() {
            RoundOutcome outcome = executor.runRound(List.of(), context);

            assertThat(outcome.results()).isEmpty();
            assertThat(outcome.failures()).isEmpty();
        }
    }

    @Test
    void shouldRejectNonPositiveTimeout() {
        assertThatThrownBy(
                        () ->
                                new RoundExecutor(
                                        executorService, DefaultMetrics.pillars(), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
