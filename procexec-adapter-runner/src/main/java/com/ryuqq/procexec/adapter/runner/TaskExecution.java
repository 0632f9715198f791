package com.ryuqq.procexec.adapter.runner;

import com.ryuqq.procexec.application.manager.TaskHandle;
import com.ryuqq.procexec.core.contract.ProcessCommand;
import com.ryuqq.procexec.core.statemachine.TaskState;
import com.ryuqq.procexec.core.statemachine.TaskStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 제출된 작업 하나의 실행 상태.
 *
 * <p>상태 전이는 {@link TaskStateTransition}으로 검증합니다.</p>
 */
final class TaskExecution implements TaskHandle {

    private static final Logger log = LoggerFactory.getLogger(TaskExecution.class);

    private final long taskId;
    private final ProcessCommand command;
    private volatile TaskState state = TaskState.QUEUED;

    TaskExecution(long taskId, ProcessCommand command) {
        this.taskId = taskId;
        this.command = command;
    }

    /**
     * 다음 상태로 전이.
     *
     * @param next 다음 상태
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    synchronized void advance(TaskState next) {
        TaskState previous = state;
        state = TaskStateTransition.transition(previous, next);
        log.debug("Task {} ({}): {} → {}", taskId, command.executable(), previous, next);
    }

    @Override
    public long taskId() {
        return taskId;
    }

    @Override
    public ProcessCommand command() {
        return command;
    }

    @Override
    public TaskState state() {
        return state;
    }

    @Override
    public String toString() {
        return "TaskExecution{taskId=" + taskId + ", executable=" + command.executable() + ", state=" + state + "}";
    }
}
