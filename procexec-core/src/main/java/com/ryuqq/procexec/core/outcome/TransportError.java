package com.ryuqq.procexec.core.outcome;

import com.ryuqq.procexec.core.exception.ProcessExecutionException;
import com.ryuqq.procexec.core.exception.ProcessTransportException;

/**
 * 전송 오류 (프로세스 생성, 입력 쓰기, 종료 대기 실패).
 *
 * @param error 원인을 보존한 전송 예외
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TransportError(ProcessTransportException error) implements ProcessOutcome {

    public TransportError {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    @Override
    public byte[] output() {
        return new byte[0];
    }

    @Override
    public ProcessExecutionException errorOrNull() {
        return error;
    }
}
