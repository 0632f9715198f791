package com.ryuqq.procexec.core.statemachine;

/**
 * 작업 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>QUEUED → ADMITTED, QUEUED → FAILED</li>
 *   <li>ADMITTED → RUNNING, ADMITTED → FAILED</li>
 *   <li>RUNNING → COMPLETED, RUNNING → FAILED</li>
 *   <li>COMPLETED → CALLBACK_INVOKED</li>
 *   <li>CALLBACK_INVOKED → FINISHED, CALLBACK_INVOKED → FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태(FINISHED, FAILED)에서는 어떤 상태로도 전이 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskStateTransition {

    // Utility class - prevent instantiation
    private TaskStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(TaskState from, TaskState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case QUEUED -> to == TaskState.ADMITTED || to == TaskState.FAILED;
            case ADMITTED -> to == TaskState.RUNNING || to == TaskState.FAILED;
            case RUNNING -> to == TaskState.COMPLETED || to == TaskState.FAILED;
            case COMPLETED -> to == TaskState.CALLBACK_INVOKED;
            case CALLBACK_INVOKED -> to == TaskState.FINISHED || to == TaskState.FAILED;
            case FINISHED, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static TaskState transition(TaskState current, TaskState next) {
        validate(current, next);
        return next;
    }
}
