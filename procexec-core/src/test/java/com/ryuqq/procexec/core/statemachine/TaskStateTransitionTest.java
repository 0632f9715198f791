package com.ryuqq.procexec.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.procexec.core.statemachine.TaskState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskStateTransition 테스트.
 *
 * <ul>
 *   <li>정상 전이 (QUEUED → ... → FINISHED / FAILED) 성공</li>
 *   <li>종료 상태에서의 전이는 IllegalStateException</li>
 *   <li>단계 건너뛰기 / 역방향 전이는 IllegalStateException</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskStateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_NormalFlowToFinished_Succeeds() {
        // Given
        TaskState state = QUEUED;

        // When
        state = TaskStateTransition.transition(state, ADMITTED);
        state = TaskStateTransition.transition(state, RUNNING);
        state = TaskStateTransition.transition(state, COMPLETED);
        state = TaskStateTransition.transition(state, CALLBACK_INVOKED);
        state = TaskStateTransition.transition(state, FINISHED);

        // Then
        assertEquals(FINISHED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void validate_CallbackInvokedToFailed_Succeeds() {
        assertDoesNotThrow(() -> TaskStateTransition.validate(CALLBACK_INVOKED, FAILED));
    }

    @Test
    void validate_InfrastructureFailureEdges_Succeed() {
        assertDoesNotThrow(() -> TaskStateTransition.validate(QUEUED, FAILED));
        assertDoesNotThrow(() -> TaskStateTransition.validate(ADMITTED, FAILED));
        assertDoesNotThrow(() -> TaskStateTransition.validate(RUNNING, FAILED));
    }

    // ========== 금지된 전이 테스트 ==========

    @Test
    void validate_FinishedToAnything_ThrowsException() {
        for (TaskState target : TaskState.values()) {
            IllegalStateException exception = assertThrows(
                IllegalStateException.class,
                () -> TaskStateTransition.validate(FINISHED, target)
            );
            assertTrue(exception.getMessage().contains("Cannot transition from terminal state"));
        }
    }

    @Test
    void validate_FailedToFinished_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> TaskStateTransition.validate(FAILED, FINISHED));
    }

    @Test
    void validate_QueuedToRunning_SkipsAdmission_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> TaskStateTransition.validate(QUEUED, RUNNING)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_CompletedToFailed_SkipsCallback_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> TaskStateTransition.validate(COMPLETED, FAILED));
    }

    @Test
    void validate_RunningToAdmitted_Backwards_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> TaskStateTransition.validate(RUNNING, ADMITTED));
    }

    @Test
    void validate_NullStates_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> TaskStateTransition.validate(null, ADMITTED));
        assertThrows(IllegalArgumentException.class, () -> TaskStateTransition.validate(QUEUED, null));
    }

    // ========== TaskState 헬퍼 ==========

    @Test
    void holdsSlot_OnlyAdmittedAndRunning() {
        for (TaskState state : TaskState.values()) {
            assertEquals(state == ADMITTED || state == RUNNING, state.holdsSlot(), state.name());
        }
    }

    @Test
    void isTerminal_OnlyFinishedAndFailed() {
        for (TaskState state : TaskState.values()) {
            assertEquals(state == FINISHED || state == FAILED, state.isTerminal(), state.name());
        }
    }
}
