package com.ryuqq.procexec.core.exception;

/**
 * 프로세스 비정상 종료.
 *
 * <p>시그널로 종료되었거나, non-zero 상태로 종료되면서 표준 출력이 비어 있는 경우입니다.
 * {@link #getDiagnostic()}은 캡처된 표준 에러 내용입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AbnormalTerminationException extends ProcessExecutionException {

    private final int exitCode;
    private final boolean signalled;
    private final String diagnostic;

    /**
     * 생성자.
     *
     * @param executable 실행 파일 이름
     * @param exitCode 종료 코드 (알 수 없으면 음수)
     * @param signalled 시그널 종료 여부
     * @param diagnostic 표준 에러 내용
     */
    public AbnormalTerminationException(String executable, int exitCode, boolean signalled, String diagnostic) {
        super(executable, buildMessage(executable, exitCode, signalled, diagnostic), null);
        this.exitCode = exitCode;
        this.signalled = signalled;
        this.diagnostic = diagnostic == null ? "" : diagnostic;
    }

    private static String buildMessage(String executable, int exitCode, boolean signalled, String diagnostic) {
        String stderr = diagnostic == null ? "" : diagnostic;
        if (signalled) {
            return String.format("%s was terminated (exit code %d). stderr: \"%s\"", executable, exitCode, stderr);
        }
        return String.format("%s exited with status %d but stdout was empty. stderr: \"%s\"", executable, exitCode, stderr);
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isSignalled() {
        return signalled;
    }

    public String getDiagnostic() {
        return diagnostic;
    }
}
