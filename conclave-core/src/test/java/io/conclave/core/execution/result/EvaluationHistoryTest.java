package io.conclave.core.execution.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conclave.core.ResultFixtures;
import io.conclave.core.worker.RoundPhase;
import io.conclave.core.worker.WorkerResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class EvaluationHistoryTest {

    private static RoundRecord round(int index, WorkerResult... results) {
        return new RoundRecord(index, List.of(results), null, null, null, null, null);
    }

    @Test
    void shouldAppendRoundsInOrder() {
        // Given
        EvaluationHistory history = new EvaluationHistory(3);

        // When
        history.append(round(0, ResultFixtures.uniform("w1", "sdet", 7.0)));
        history.append(
                round(
                        1,
                        ResultFixtures.uniform("w1", "sdet", 7.0),
                        ResultFixtures.uniform("w2", "senior-architect", 6.0)));

        // Then
        assertThat(history.size()).isEqualTo(2);
        assertThat(history.resultCount()).isEqualTo(3);
        assertThat(history.lastRound()).get().extracting(RoundRecord::roundIndex).isEqualTo(1);
    }

    @Test
    void shouldRejectOutOfOrderRound() {
        EvaluationHistory history = new EvaluationHistory(3);

        assertThatThrownBy(() -> history.append(round(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected round 0");
    }

    @Test
    void shouldBeEmptyInitially() {
        EvaluationHistory history = new EvaluationHistory();

        assertThat(history.isEmpty()).isTrue();
        assertThat(history.lastRound()).isEmpty();
        assertThat(history.transcript()).isEmpty();
    }

    @Test
    void shouldRenderTranscriptWithPhases() {
        // Given
        EvaluationHistory history = new EvaluationHistory(3);
        WorkerResult first =
                ResultFixtures.uniform("w1", "sdet", 7.0).toBuilder().details("More tests").build();
        WorkerResult second = ResultFixtures.uniform("w1", "sdet", 7.0).toBuilder().roundIndex(1).build();
        WorkerResult third = ResultFixtures.uniform("w1", "sdet", 7.0).toBuilder().roundIndex(2).build();
        history.append(round(0, first));
        history.append(round(1, second));
        history.append(round(2, third));

        // When
        List<ConversationMessage> transcript = history.transcript();

        // Then
        assertThat(transcript)
                .extracting(ConversationMessage::phase)
                .containsExactly(
                        RoundPhase.INITIAL_ANALYSIS,
                        RoundPhase.TEAM_DISCUSSION,
                        RoundPhase.FINAL_REVIEW);
        assertThat(transcript.get(0).message())
                .isEqualTo("Reviewed the change carefully\n\nMore tests");
        assertThat(transcript.get(1).message()).isEqualTo("Reviewed the change carefully");
    }

    @Test
    void shouldCopyIndependently() {
        EvaluationHistory history = new EvaluationHistory(2);
        history.append(round(0, ResultFixtures.uniform("w1", "sdet", 7.0)));

        EvaluationHistory copy = history.copy();
        copy.append(round(1));

        assertThat(history.size()).isEqualTo(1);
        assertThat(copy.size()).isEqualTo(2);
        assertThat(copy.getMaxRounds()).isEqualTo(2);
    }
}
