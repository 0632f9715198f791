package com.ryuqq.procexec.core.outcome;

import com.ryuqq.procexec.core.exception.ProcessExecutionException;

import java.util.Arrays;

/**
 * 종료 코드 0.
 *
 * @param output 표준 출력 전체
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Success(byte[] output) implements ProcessOutcome {

    public Success {
        output = output == null ? new byte[0] : output.clone();
    }

    @Override
    public byte[] output() {
        return output.clone();
    }

    @Override
    public ProcessExecutionException errorOrNull() {
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(output, ((Success) o).output);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(output);
    }

    @Override
    public String toString() {
        return "Success{" + output.length + " bytes}";
    }
}
