package com.ryuqq.procexec.adapter.runner;

/**
 * TaskGroup에서 실행되는 비동기 작업 단위.
 *
 * <p>예외를 던지면 해당 단위의 실패로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface GroupTask {

    /**
     * 작업 실행.
     *
     * @throws Exception 작업 실패 시
     */
    void run() throws Exception;
}
