package com.taskflow.backend.modules.task.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.taskflow.backend.global.error.ProblemException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpStatus;

class TaskStatusTest {

    @ParameterizedTest
    @EnumSource(TaskStatus.class)
    void fromLabel_resolvesEveryExactLabel(TaskStatus status) {
        assertThat(TaskStatus.fromLabel(status.label())).isEqualTo(status);
    }

    @ParameterizedTest
    @ValueSource(strings = {"COMPLETED", " new ", "In-Progress", "Cancelled", "new "})
    @DisplayName("labels must match exactly; case and surrounding whitespace are not folded")
    void fromLabel_rejectsInexactLabels(String label) {
        assertThatThrownBy(() -> TaskStatus.fromLabel(label))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_STATUS"));
    }

    @Test
    void fromLabel_rejectsNull() {
        assertThatThrownBy(() -> TaskStatus.fromLabel(null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_STATUS"));
    }

    @Test
    void terminalStatuses_matchIsTerminal() {
        assertThat(TaskStatus.terminalStatuses())
                .containsExactlyInAnyOrder(TaskStatus.COMPLETED, TaskStatus.CANCELLED);
        assertThat(TaskStatus.NEW.isTerminal()).isFalse();
        assertThat(TaskStatus.IN_PROGRESS.isTerminal()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"done", "IN_PROGRESS", "", "archived"})
    @DisplayName("labels outside the four statuses are a validation error")
    void fromLabel_rejectsUnknown(String label) {
        assertThatThrownBy(() -> TaskStatus.fromLabel(label))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(ex.getCode()).isEqualTo("INVALID_STATUS");
                });
    }

    @ParameterizedTest
    @EnumSource(TaskStatus.class)
    @DisplayName("every status may move to every status")
    void transitions_areUnrestricted(TaskStatus from) {
        for (TaskStatus to : TaskStatus.values()) {
            assertThat(TaskTransitionPolicy.isAllowed(from, to)).isTrue();
        }
    }

    @Test
    void priority_defaultsToNormalAndRejectsUnknown() {
        assertThat(TaskPriority.fromLabel(null)).isEqualTo(TaskPriority.NORMAL);
        assertThat(TaskPriority.fromLabel("HIGH")).isEqualTo(TaskPriority.HIGH);
        assertThatThrownBy(() -> TaskPriority.fromLabel("urgent"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_PRIORITY"));
    }
}
