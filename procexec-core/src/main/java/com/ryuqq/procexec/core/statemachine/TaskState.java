package com.ryuqq.procexec.core.statemachine;

/**
 * 제출된 작업의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * QUEUED
 *    │ (게이트 슬롯 획득)
 *    ▼
 * ADMITTED
 *    │ (프로세스 실행 시작)
 *    ▼
 * RUNNING
 *    │ (프로세스 종료, 슬롯 반환)
 *    ▼
 * COMPLETED
 *    │ (콜백 호출)
 *    ▼
 * CALLBACK_INVOKED
 *    │
 *    ├─► FINISHED (콜백 정상 반환)
 *    │
 *    └─► FAILED (콜백 예외)
 * </pre>
 *
 * <p>게이트 획득 실패(취소, 인터럽트), 작업 스케줄링 거부, 실행자 예외처럼 콜백에 도달하지 못한 경우
 * QUEUED / ADMITTED / RUNNING에서 바로 FAILED로 전이합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TaskState {

    /**
     * 게이트 슬롯 대기 중.
     */
    QUEUED,

    /**
     * 슬롯 획득, 실행 예약됨.
     */
    ADMITTED,

    /**
     * 프로세스 실행 중.
     */
    RUNNING,

    /**
     * 프로세스 종료, 결과 확보.
     */
    COMPLETED,

    /**
     * 콜백 실행 중.
     */
    CALLBACK_INVOKED,

    /**
     * 정상 종료.
     */
    FINISHED,

    /**
     * 실패.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return FINISHED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == FINISHED || this == FAILED;
    }

    /**
     * 게이트 슬롯을 점유하는 상태인지 확인.
     *
     * @return ADMITTED 또는 RUNNING인 경우 true
     */
    public boolean holdsSlot() {
        return this == ADMITTED || this == RUNNING;
    }
}
