package com.ryuqq.procexec.core.exception;

/**
 * 인프라 수준 실행 실패.
 *
 * <p>프로세스를 시작할 수 없거나, 표준 입력 파이프에 쓸 수 없거나,
 * 종료를 기다리는 도중 실패한 경우입니다. 원인 예외는 항상 보존됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProcessTransportException extends ProcessExecutionException {

    /**
     * 생성자.
     *
     * @param executable 실행 파일 이름
     * @param message 오류 메시지
     * @param cause 원인
     */
    public ProcessTransportException(String executable, String message, Throwable cause) {
        super(executable, message, cause);
    }
}
