package com.ryuqq.procexec.core.exception;

/**
 * 작업 그룹의 대표 오류를 감싸는 예외.
 *
 * <p>join 시점에 그룹이 보관한 첫 번째 오류를 cause로 전달합니다.
 * 원래 예외 체인은 그대로 조회할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProcessGroupException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param cause 그룹이 보관한 첫 번째 오류
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public ProcessGroupException(Throwable cause) {
        super(describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        return "process group failed: " + cause.getMessage();
    }
}
