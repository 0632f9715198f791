package com.ryuqq.procexec.core.outcome;

import com.ryuqq.procexec.core.exception.ProcessExecutionException;

/**
 * 단일 프로세스 실행 결과.
 *
 * <p>ProcessOutcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 종료 코드 0</li>
 *   <li>{@link FindingsReported}: non-zero 종료 + 출력 있음 (도구가 finding을 보고함, 오류 아님)</li>
 *   <li>{@link TerminatedAbnormally}: 시그널 종료 또는 출력 없는 non-zero 종료</li>
 *   <li>{@link TransportError}: 프로세스 생성, 입력 쓰기, 종료 대기 실패</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ProcessOutcome permits Success, FindingsReported, TerminatedAbnormally, TransportError {

    /**
     * 콜백에 전달할 표준 출력.
     *
     * @return 표준 출력 바이트 (오류 결과는 빈 배열)
     */
    byte[] output();

    /**
     * 콜백에 전달할 오류.
     *
     * @return 오류 (오류가 아닌 결과는 null)
     */
    ProcessExecutionException errorOrNull();

    /**
     * 오류 결과인지 확인.
     *
     * @return TerminatedAbnormally 또는 TransportError인 경우 true
     */
    default boolean isError() {
        return errorOrNull() != null;
    }
}
