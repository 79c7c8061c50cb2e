package io.conclave.core.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conclave.core.diff.DiffContext;
import io.conclave.core.execution.DiscussionOptions;
import io.conclave.core.state.DiscussionPhase;
import io.conclave.core.state.DiscussionSnapshot;
import io.conclave.core.state.DiscussionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryDiscussionStateRepositoryTest {

    private InMemoryDiscussionStateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryDiscussionStateRepository();
    }

    private static DiscussionSnapshot snapshot(String executionId, DiscussionPhase phase) {
        DiscussionState state =
                DiscussionState.builder()
                        .executionId(executionId)
                        .diff(DiffContext.of("+ line"))
                        .phase(phase)
                        .build();
        return state.snapshot("test");
    }

    @Test
    void shouldSaveAndFindByExecutionId() {
        DiscussionSnapshot saved = snapshot("exec-1", DiscussionPhase.AWAITING_ROUND);

        repository.save(saved);

        assertThat(repository.findByExecutionId("exec-1")).contains(saved);
        assertThat(repository.findByExecutionId("missing")).isEmpty();
    }

    @Test
    void shouldReplaceEarlierCheckpoint() {
        repository.save(snapshot("exec-1", DiscussionPhase.AWAITING_ROUND));
        repository.save(snapshot("exec-1", DiscussionPhase.DONE));

        assertThat(repository.size()).isEqualTo(1);
        assertThat(repository.findByExecutionId("exec-1"))
                .get()
                .extracting(DiscussionSnapshot::isCompleted)
                .isEqualTo(true);
    }

    @Test
    void shouldListOnlyUnfinishedDiscussions() {
        repository.save(snapshot("running", DiscussionPhase.AWAITING_ROUND));
        repository.save(snapshot("finished", DiscussionPhase.DONE));

        assertThat(repository.findUnfinished())
                .extracting(DiscussionSnapshot::executionId)
                .containsExactly("running");
    }

    @Test
    void shouldDeleteSnapshot() {
        repository.save(snapshot("exec-1", DiscussionPhase.AWAITING_ROUND));

        assertThat(repository.delete("exec-1")).isTrue();
        assertThat(repository.delete("exec-1")).isFalse();
        assertThat(repository.size()).isZero();
    }

    @Test
    void shouldRejectNullSnapshot() {
        assertThatThrownBy(() -> repository.save(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldClearAllSnapshots() {
        repository.save(
                DiscussionState.start(DiffContext.of("+ a"), DiscussionOptions.defaults())
                        .snapshot("initial"));
        repository.save(snapshot("exec-2", DiscussionPhase.DONE));

        repository.clear();

        assertThat(repository.size()).isZero();
    }
}
