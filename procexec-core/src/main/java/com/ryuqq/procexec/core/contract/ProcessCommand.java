package com.ryuqq.procexec.core.contract;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * 외부 프로세스 실행 명령.
 *
 * <p>실행 파일, 인자 목록, 표준 입력으로 전달할 바이트를 담습니다.
 * 실행 파일 경로는 호출 측 프로세스 환경(PATH)에 따라 해석됩니다.</p>
 *
 * <p><strong>불변성:</strong> 인자 목록과 입력 바이트는 생성 시 복사되며, 조회 시에도 복사본을 반환합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ProcessCommand command = ProcessCommand.of(
 *     "shellcheck",
 *     List.of("--norc", "-f", "json", "-"),
 *     "echo $FOO"
 * );
 * </pre>
 *
 * @param executable 실행 파일 이름 또는 경로
 * @param arguments 인자 목록 (순서 유지)
 * @param standardInput 표준 입력으로 전달할 바이트 (빈 배열 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProcessCommand(
    String executable,
    List<String> arguments,
    byte[] standardInput
) {

    private static final byte[] NO_INPUT = new byte[0];

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException executable이 null/blank이거나 arguments에 null 원소가 있는 경우
     */
    public ProcessCommand {
        if (executable == null || executable.isBlank()) {
            throw new IllegalArgumentException("executable cannot be null or blank");
        }
        if (arguments == null) {
            arguments = List.of();
        }
        for (String argument : arguments) {
            if (argument == null) {
                throw new IllegalArgumentException("arguments cannot contain null");
            }
        }
        arguments = List.copyOf(arguments);
        standardInput = standardInput == null ? NO_INPUT : standardInput.clone();
    }

    /**
     * 문자열 입력으로 명령 생성 (UTF-8 인코딩).
     *
     * @param executable 실행 파일 이름 또는 경로
     * @param arguments 인자 목록
     * @param standardInput 표준 입력 문자열 (null이면 빈 입력)
     * @return ProcessCommand 인스턴스
     */
    public static ProcessCommand of(String executable, List<String> arguments, String standardInput) {
        byte[] input = standardInput == null ? NO_INPUT : standardInput.getBytes(StandardCharsets.UTF_8);
        return new ProcessCommand(executable, arguments, input);
    }

    /**
     * 입력 없이 명령 생성.
     *
     * @param executable 실행 파일 이름 또는 경로
     * @param arguments 인자 목록
     * @return ProcessCommand 인스턴스
     */
    public static ProcessCommand of(String executable, List<String> arguments) {
        return new ProcessCommand(executable, arguments, NO_INPUT);
    }

    /**
     * 표준 입력 바이트 조회 (복사본).
     *
     * @return 표준 입력 바이트
     */
    @Override
    public byte[] standardInput() {
        return standardInput.clone();
    }

    /**
     * 실행 파일과 인자를 합친 커맨드 라인.
     *
     * @return [executable, arg1, arg2, ...]
     */
    public List<String> commandLine() {
        String[] line = new String[arguments.size() + 1];
        line[0] = executable;
        for (int i = 0; i < arguments.size(); i++) {
            line[i + 1] = arguments.get(i);
        }
        return List.of(line);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcessCommand that = (ProcessCommand) o;
        return executable.equals(that.executable)
            && arguments.equals(that.arguments)
            && Arrays.equals(standardInput, that.standardInput);
    }

    @Override
    public int hashCode() {
        int result = executable.hashCode();
        result = 31 * result + arguments.hashCode();
        result = 31 * result + Arrays.hashCode(standardInput);
        return result;
    }

    @Override
    public String toString() {
        return "ProcessCommand{" + String.join(" ", commandLine()) + ", stdin=" + standardInput.length + " bytes}";
    }
}
