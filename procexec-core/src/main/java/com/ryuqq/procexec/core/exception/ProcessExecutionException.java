package com.ryuqq.procexec.core.exception;

/**
 * 프로세스 실행 오류의 공통 상위 타입.
 *
 * <p>하위 타입:</p>
 * <ul>
 *   <li>{@link ProcessTransportException}: 프로세스 생성, 표준 입력 쓰기, 종료 대기 실패</li>
 *   <li>{@link AbnormalTerminationException}: 시그널 종료 또는 출력 없는 non-zero 종료</li>
 * </ul>
 *
 * <p>외부 도구가 non-zero 종료와 함께 출력을 남긴 경우(finding 보고)는 오류가 아닙니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class ProcessExecutionException extends RuntimeException {

    private final String executable;

    /**
     * 생성자.
     *
     * @param executable 실행 파일 이름
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     */
    protected ProcessExecutionException(String executable, String message, Throwable cause) {
        super(message, cause);
        this.executable = executable;
    }

    /**
     * 오류가 발생한 실행 파일 이름.
     *
     * @return 실행 파일 이름
     */
    public String getExecutable() {
        return executable;
    }
}
