package com.relevx.project;

import com.relevx.domain.ProjectStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectTransitionTableTest {

    private final ProjectTransitionTable table = new ProjectTransitionTable();

    private static void assertRejected(Runnable call, String errorCode) {
        assertThatThrownBy(call::run)
                .isInstanceOf(ProjectOperationException.class)
                .satisfies(e -> assertThat(((ProjectOperationException) e).getErrorCode()).isEqualTo(errorCode));
    }

    @ParameterizedTest
    @EnumSource(ProjectStatus.class)
    @DisplayName("same status is always status_unchanged")
    void sameStatus(ProjectStatus status) {
        assertRejected(() -> table.resolve(status, status), ProjectStatusMachine.STATUS_UNCHANGED);
    }

    @ParameterizedTest
    @EnumSource(value = ProjectStatus.class, names = {"DRAFT", "PAUSED"})
    void activateFromDraftOrPaused(ProjectStatus current) {
        assertThat(table.resolve(current, ProjectStatus.ACTIVE)).isEqualTo(ProjectTransition.ACTIVATE);
    }

    @ParameterizedTest
    @EnumSource(value = ProjectStatus.class, names = {"DRAFT", "ACTIVE"})
    @DisplayName("pause is allowed from draft and active")
    void pauseFromDraftOrActive(ProjectStatus current) {
        assertThat(table.resolve(current, ProjectStatus.PAUSED)).isEqualTo(ProjectTransition.PAUSE);
    }

    @Test
    void pauseFromDeletedIsInvalid() {
        assertRejected(() -> table.resolve(ProjectStatus.DELETED, ProjectStatus.PAUSED),
                ProjectStatusMachine.INVALID_STATUS);
    }

    @ParameterizedTest
    @EnumSource(value = ProjectStatus.class, names = {"RUNNING", "ERROR"})
    @DisplayName("execution-owned statuses block activate and pause but allow delete")
    void executionOwned(ProjectStatus current) {
        assertRejected(() -> table.resolve(current, ProjectStatus.ACTIVE), ProjectStatusMachine.INVALID_STATUS);
        assertRejected(() -> table.resolve(current, ProjectStatus.PAUSED), ProjectStatusMachine.INVALID_STATUS);
        assertThat(table.resolve(current, ProjectStatus.DELETED)).isEqualTo(ProjectTransition.DELETE);
    }

    @ParameterizedTest
    @EnumSource(value = ProjectStatus.class, names = {"DRAFT", "RUNNING", "ERROR"})
    void targetsNotSettableByCallers(ProjectStatus target) {
        assertRejected(() -> table.resolve(ProjectStatus.PAUSED, target), ProjectStatusMachine.INVALID_STATUS);
    }

    @ParameterizedTest
    @EnumSource(value = ProjectStatus.class, mode = EnumSource.Mode.EXCLUDE, names = "DELETED")
    void deleteFromAnyLiveStatus(ProjectStatus current) {
        assertThat(table.resolve(current, ProjectStatus.DELETED)).isEqualTo(ProjectTransition.DELETE);
    }

    @Test
    void scheduleEditGuard() {
        assertThat(table.scheduleEditRequiresQuota(ProjectStatus.ACTIVE)).isTrue();
        for (ProjectStatus s : ProjectStatus.values()) {
            if (s != ProjectStatus.ACTIVE) {
                assertThat(table.scheduleEditRequiresQuota(s)).as(s.name()).isFalse();
            }
        }
    }
}
