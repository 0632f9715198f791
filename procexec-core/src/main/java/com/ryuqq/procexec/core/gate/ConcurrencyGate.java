package com.ryuqq.procexec.core.gate;

import com.ryuqq.procexec.core.context.ExecutionContext;

/**
 * ConcurrencyGate SPI.
 *
 * <p>동시에 실행 중인 외부 프로세스 수를 설정된 상한 이하로 제한합니다.
 * 프로세스를 무제한으로 띄우면 OS 자원(프로세스 생성, 파일 디스크립터, 파이프)이 고갈되어
 * 프로세스 생성이 멈추거나 "too many open files" 오류가 발생합니다.</p>
 *
 * <p><strong>불변식:</strong> 0 ≤ getCurrentConcurrency() ≤ getConfig().capacity()</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * gate.acquire(context);
 * try {
 *     ProcessOutcome outcome = runner.run(context, command);
 * } finally {
 *     gate.release();
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ConcurrencyGate {

    /**
     * 슬롯 획득 (블로킹).
     *
     * <p>빈 슬롯이 생길 때까지 호출 스레드를 대기시킨 뒤 슬롯 하나를 예약합니다.
     * 공정성(FIFO)은 {@link GateConfig#fair()} 설정을 따릅니다.</p>
     *
     * @param context 실행 컨텍스트
     * @throws java.util.concurrent.CancellationException context가 취소된 경우
     * @throws IllegalStateException 대기 중 인터럽트 발생 시 (인터럽트 플래그 복원)
     */
    void acquire(ExecutionContext context);

    /**
     * 슬롯 획득 시도 (비블로킹).
     *
     * @return true: 획득 성공, false: 빈 슬롯 없음
     */
    boolean tryAcquire();

    /**
     * 슬롯 반환.
     *
     * <p>성공한 acquire 한 번당 정확히 한 번 호출해야 합니다.
     * 반드시 finally 블록에서 호출되어야 합니다.</p>
     *
     * @throws IllegalStateException 획득한 슬롯 없이 호출된 경우
     */
    void release();

    /**
     * 현재 점유 중인 슬롯 수.
     *
     * @return 점유 슬롯 수
     */
    int getCurrentConcurrency();

    /**
     * 게이트 설정 조회.
     *
     * @return 게이트 설정
     */
    GateConfig getConfig();
}
