package com.ryuqq.procexec.application.manager;

import com.ryuqq.procexec.core.contract.ProcessCommand;
import com.ryuqq.procexec.core.statemachine.TaskState;

/**
 * 제출된 작업 핸들.
 *
 * <p>작업의 현재 생명주기 상태를 조회합니다. 상태는 매니저만 변경합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TaskHandle {

    /**
     * 매니저 내 작업 번호 (제출 순서, 1부터 시작).
     *
     * @return 작업 번호
     */
    long taskId();

    /**
     * 실행 명령.
     *
     * @return 제출된 명령
     */
    ProcessCommand command();

    /**
     * 현재 상태.
     *
     * @return 현재 TaskState
     */
    TaskState state();

    /**
     * 종료 여부.
     *
     * @return FINISHED 또는 FAILED인 경우 true
     */
    default boolean isDone() {
        return state().isTerminal();
    }
}
