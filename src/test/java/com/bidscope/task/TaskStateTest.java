package com.bidscope.task;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TaskState Tests")
class TaskStateTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @ParameterizedTest
    @EnumSource(value = TaskState.class, names = {"SUCCESS", "FAILURE", "CANCELLED"})
    @DisplayName("Should refuse every move out of a terminal state")
    void shouldFreezeTerminalStates(TaskState terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (TaskState next : TaskState.values()) {
            assertThat(terminal.canMoveTo(next)).as("%s -> %s", terminal, next).isFalse();
        }
    }

    @Test
    @DisplayName("Should only start from pending and only succeed after starting")
    void shouldOrderLifecycle() {
        assertThat(TaskState.PENDING.canMoveTo(TaskState.STARTED)).isTrue();
        assertThat(TaskState.PENDING.canMoveTo(TaskState.SUCCESS)).isFalse();
        assertThat(TaskState.PENDING.canMoveTo(TaskState.PROGRESS)).isFalse();
        assertThat(TaskState.PENDING.canMoveTo(TaskState.CANCELLED)).isTrue();
        assertThat(TaskState.STARTED.canMoveTo(TaskState.STARTED)).isFalse();
        assertThat(TaskState.PROGRESS.canMoveTo(TaskState.PROGRESS)).isTrue();
        assertThat(TaskState.PROGRESS.canMoveTo(TaskState.SUCCESS)).isTrue();
        assertThat(TaskState.STARTED.canMoveTo(TaskState.FAILURE)).isTrue();
    }

    // ========== TaskRecord ==========

    @Test
    @DisplayName("Should never lower progress")
    void shouldKeepProgressMonotonic() {
        TaskRecord record = new TaskRecord("t1", TaskKind.SEARCH, "key", NOW);
        record.start(NOW);

        assertThat(record.progress(30, "Searching contracts")).isTrue();
        assertThat(record.progress(10, "Filters compiled")).isFalse();
        assertThat(record.snapshot().getProgress()).isEqualTo(30);
        assertThat(record.snapshot().getMessage()).isEqualTo("Searching contracts");
    }

    @Test
    @DisplayName("Should keep the first terminal state")
    void shouldKeepFirstTerminalState() {
        TaskRecord record = new TaskRecord("t1", TaskKind.AGGREGATE, "key", NOW);
        record.start(NOW);

        assertThat(record.cancel(NOW)).isTrue();
        assertThat(record.succeed(NOW.plusSeconds(1))).isFalse();
        assertThat(record.fail("late failure", NOW.plusSeconds(1))).isFalse();

        TaskSnapshot snapshot = record.snapshot();
        assertThat(snapshot.getState()).isEqualTo(TaskState.CANCELLED);
        assertThat(snapshot.getCompletedAt()).isEqualTo(NOW);
        assertThat(record.getCancellationToken().isCancelled()).isTrue();
    }

    @Test
    @DisplayName("Should count every attempt but start only once")
    void shouldCountAttempts() {
        TaskRecord record = new TaskRecord("t1", TaskKind.EXPORT, "key", NOW);

        assertThat(record.start(NOW)).isTrue();
        assertThat(record.start(NOW.plusSeconds(30))).isFalse();

        TaskSnapshot snapshot = record.snapshot();
        assertThat(snapshot.getAttempts()).isEqualTo(2);
        assertThat(snapshot.getStartedAt()).isEqualTo(NOW);
    }
}
