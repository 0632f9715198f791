package com.ryuqq.procexec.core.outcome;

import com.ryuqq.procexec.core.exception.AbnormalTerminationException;
import com.ryuqq.procexec.core.exception.ProcessExecutionException;

/**
 * 비정상 종료 (시그널 종료 또는 출력 없는 non-zero 종료).
 *
 * @param executable 실행 파일 이름
 * @param exitCode 종료 코드
 * @param signalled 시그널 종료 여부
 * @param diagnostic 캡처된 표준 에러
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TerminatedAbnormally(
    String executable,
    int exitCode,
    boolean signalled,
    String diagnostic
) implements ProcessOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException executable이 null이거나, 시그널 종료가 아닌데 exitCode가 0인 경우
     */
    public TerminatedAbnormally {
        if (executable == null) {
            throw new IllegalArgumentException("executable cannot be null");
        }
        if (!signalled && exitCode == 0) {
            throw new IllegalArgumentException("exitCode cannot be 0 unless signalled");
        }
        diagnostic = diagnostic == null ? "" : diagnostic;
    }

    @Override
    public byte[] output() {
        return new byte[0];
    }

    @Override
    public ProcessExecutionException errorOrNull() {
        return new AbnormalTerminationException(executable, exitCode, signalled, diagnostic);
    }
}
