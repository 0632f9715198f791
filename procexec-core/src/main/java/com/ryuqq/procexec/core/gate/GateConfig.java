package com.ryuqq.procexec.core.gate;

/**
 * ConcurrencyGate 설정.
 *
 * @param capacity 최대 동시 실행 수 (1 이상)
 * @param fair 대기 순서 보장(FIFO) 여부
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GateConfig(int capacity, boolean fair) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if capacity is not positive
     */
    public GateConfig {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
    }

    /**
     * 비공정 게이트 설정 생성.
     *
     * @param capacity 최대 동시 실행 수
     * @return GateConfig 인스턴스
     */
    public static GateConfig of(int capacity) {
        return new GateConfig(capacity, false);
    }
}
