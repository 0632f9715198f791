package com.ryuqq.procexec.core.runner;

import com.ryuqq.procexec.core.context.ExecutionContext;
import com.ryuqq.procexec.core.contract.ProcessCommand;
import com.ryuqq.procexec.core.outcome.ProcessOutcome;

/**
 * 외부 프로세스 실행자.
 *
 * <p>프로세스 하나를 생성하고, 표준 입력을 전달하고, 종료를 기다린 뒤 결과를 분류합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>프로세스 생성 (표준 에러는 부모에게 상속하지 않고 내부에서 캡처)</li>
 *   <li>표준 입력 전체 쓰기 후 파이프 닫기 (모든 경로에서 닫힘 보장)</li>
 *   <li>표준 출력 전체 수집</li>
 *   <li>종료 상태 분류 ({@link ProcessOutcome})</li>
 * </ul>
 *
 * <p>프로세스 실행 실패는 예외가 아니라 {@link ProcessOutcome}으로 반환합니다.
 * 재시도는 하지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> 구현체는 thread-safe해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ProcessRunner {

    /**
     * 프로세스 실행.
     *
     * @param context 실행 컨텍스트
     * @param command 실행할 명령
     * @return 실행 결과 (Success, FindingsReported, TerminatedAbnormally, TransportError)
     * @throws IllegalArgumentException context 또는 command가 null인 경우
     * @throws java.util.concurrent.CancellationException 프로세스 생성 전에 context가 취소된 경우
     */
    ProcessOutcome run(ExecutionContext context, ProcessCommand command);
}
