package io.conclave.core.worker.stub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conclave.core.ResultFixtures;
import io.conclave.core.diff.DiffContext;
import io.conclave.core.worker.EvaluationContext;
import io.conclave.core.worker.WorkerResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class StubWorkerTest {

    private static EvaluationContext round(int index) {
        return new EvaluationContext(DiffContext.of("diff"), index, 3, List.of(), List.of());
    }

    @Test
    void shouldReplayScriptAndRepeatLastStep() throws Exception {
        WorkerResult first = ResultFixtures.uniform("w1", "sdet", 5.0);
        WorkerResult second = ResultFixtures.uniform("w1", "sdet", 6.0);
        StubWorker worker = StubWorker.builder("w1", "sdet").respond(first).respond(second).build();

        assertThat(worker.execute(round(0))).isSameAs(first);
        assertThat(worker.execute(round(1))).isSameAs(second);
        assertThat(worker.execute(round(2))).isSameAs(second);
        assertThat(worker.getInvokedRounds()).containsExactly(0, 1, 2);
    }

    @Test
    void shouldThrowScriptedFailure() {
        StubWorker worker =
                StubWorker.builder("w1", "sdet")
                        .fail(new IllegalStateException("model unavailable"))
                        .build();

        assertThatThrownBy(() -> worker.execute(round(0)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("model unavailable");
        assertThat(worker.getInvocationCount()).isEqualTo(1);
    }

    @Test
    void shouldApplyEligibilityPredicate() {
        StubWorker worker =
                StubWorker.builder("w1", "sdet")
                        .respond(ResultFixtures.uniform("w1", "sdet", 5.0))
                        .eligibleWhen(EvaluationContext::isFirstRound)
                        .build();

        assertThat(worker.canExecute(round(0))).isTrue();
        assertThat(worker.canExecute(round(1))).isFalse();
    }

    @Test
    void shouldRequireAtLeastOneStep() {
        assertThatThrownBy(() -> StubWorker.builder("w1", "sdet").build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no scripted steps");
    }
}
