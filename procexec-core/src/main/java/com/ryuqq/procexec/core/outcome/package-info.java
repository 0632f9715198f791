/**
 * 프로세스 실행 결과 분류.
 *
 * <p>종료 상태 분류 순서:</p>
 * <pre>
 * 1. 대기 실패 (정상 종료 아님)       → TransportError
 * 2. 시그널 종료 / 음수 종료 코드      → TerminatedAbnormally
 * 3. non-zero + 빈 출력              → TerminatedAbnormally
 * 4. non-zero + 출력 있음            → FindingsReported (오류 아님)
 * 5. 0                              → Success
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.procexec.core.outcome;
