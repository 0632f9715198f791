package com.ryuqq.procexec.core.outcome;

import com.ryuqq.procexec.core.exception.ProcessExecutionException;

import java.util.Arrays;

/**
 * non-zero 종료 + 비어 있지 않은 표준 출력.
 *
 * <p>린트 도구는 문제를 발견하면 non-zero 상태로 종료하면서 결과를 출력합니다.
 * 이는 실행 실패가 아니라 정상적인 결과 보고이므로 오류로 취급하지 않습니다.</p>
 *
 * @param exitCode 종료 코드 (양수)
 * @param output 표준 출력 전체 (비어 있지 않음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FindingsReported(int exitCode, byte[] output) implements ProcessOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException exitCode가 0이거나 output이 비어 있는 경우
     */
    public FindingsReported {
        if (exitCode == 0) {
            throw new IllegalArgumentException("exitCode cannot be 0 for findings");
        }
        if (output == null || output.length == 0) {
            throw new IllegalArgumentException("output cannot be empty for findings");
        }
        output = output.clone();
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
        FindingsReported that = (FindingsReported) o;
        return exitCode == that.exitCode && Arrays.equals(output, that.output);
    }

    @Override
    public int hashCode() {
        return 31 * exitCode + Arrays.hashCode(output);
    }

    @Override
    public String toString() {
        return "FindingsReported{exitCode=" + exitCode + ", " + output.length + " bytes}";
    }
}
