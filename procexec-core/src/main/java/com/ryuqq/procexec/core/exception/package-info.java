/**
 * 프로세스 실행 오류 분류.
 *
 * <pre>
 * ProcessExecutionException (RuntimeException)
 *   ├─ ProcessTransportException     프로세스 생성/입력/대기 실패
 *   └─ AbnormalTerminationException  시그널 종료, 출력 없는 non-zero 종료
 *
 * ProcessGroupException              join 결과의 대표 오류 래퍼
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.procexec.core.exception;
