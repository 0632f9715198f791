package com.ryuqq.procexec.core.contract;

/**
 * 실행 요청 단위 (명령 + 완료 콜백).
 *
 * <p>제출된 이후 콜백이 반환될 때까지 매니저가 독점적으로 소유합니다.</p>
 *
 * @param command 실행할 프로세스 명령
 * @param onComplete 완료 콜백
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProcessTask(
    ProcessCommand command,
    CompletionCallback onComplete
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException command 또는 onComplete가 null인 경우
     */
    public ProcessTask {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (onComplete == null) {
            throw new IllegalArgumentException("onComplete cannot be null");
        }
    }

    /**
     * ProcessTask 생성.
     *
     * @param command 실행할 프로세스 명령
     * @param onComplete 완료 콜백
     * @return ProcessTask 인스턴스
     */
    public static ProcessTask of(ProcessCommand command, CompletionCallback onComplete) {
        return new ProcessTask(command, onComplete);
    }
}
