package com.ryuqq.procexec.adapter.runner;

import com.ryuqq.procexec.core.gate.GateConfig;

/**
 * ConcurrentProcessManager 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>parallelism: 동시 실행 프로세스 상한 (기본: 사용 가능한 CPU 수)</li>
 *   <li>fairAdmission: 슬롯 대기 순서 보장(FIFO) 여부 (기본 false)</li>
 *   <li>threadNamePrefix: 작업 스레드 이름 접두사 (기본 "procexec-worker-")</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param parallelism 동시 실행 프로세스 상한 (1 이상이어야 함)
 * @param fairAdmission 슬롯 대기 순서 보장 여부
 * @param threadNamePrefix 작업 스레드 이름 접두사
 */
public record ProcessManagerConfig(
    int parallelism,
    boolean fairAdmission,
    String threadNamePrefix
) {

    private static final String DEFAULT_THREAD_NAME_PREFIX = "procexec-worker-";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: parallelism=availableProcessors(), fairAdmission=false, threadNamePrefix="procexec-worker-"</p>
     */
    public ProcessManagerConfig() {
        this(Runtime.getRuntime().availableProcessors(), false, DEFAULT_THREAD_NAME_PREFIX);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ProcessManagerConfig {
        if (parallelism <= 0) {
            throw new IllegalArgumentException(
                "parallelism must be positive (current: " + parallelism + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
    }

    /**
     * parallelism만 지정한 설정 생성.
     *
     * @param parallelism 동시 실행 프로세스 상한
     * @return ProcessManagerConfig 인스턴스
     */
    public static ProcessManagerConfig ofParallelism(int parallelism) {
        return new ProcessManagerConfig(parallelism, false, DEFAULT_THREAD_NAME_PREFIX);
    }

    /**
     * parallelism만 변경한 새 인스턴스 생성.
     */
    public ProcessManagerConfig withParallelism(int parallelism) {
        return new ProcessManagerConfig(parallelism, fairAdmission, threadNamePrefix);
    }

    /**
     * fairAdmission만 변경한 새 인스턴스 생성.
     */
    public ProcessManagerConfig withFairAdmission(boolean fairAdmission) {
        return new ProcessManagerConfig(parallelism, fairAdmission, threadNamePrefix);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public ProcessManagerConfig withThreadNamePrefix(String threadNamePrefix) {
        return new ProcessManagerConfig(parallelism, fairAdmission, threadNamePrefix);
    }

    /**
     * 게이트 설정으로 변환.
     *
     * @return capacity=parallelism인 GateConfig
     */
    public GateConfig toGateConfig() {
        return new GateConfig(parallelism, fairAdmission);
    }
}
