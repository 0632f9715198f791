/**
 * 프로세스 실행 요청 계약.
 *
 * <ul>
 *   <li>{@link com.ryuqq.procexec.core.contract.ProcessCommand} - 실행 파일, 인자, 표준 입력</li>
 *   <li>{@link com.ryuqq.procexec.core.contract.CompletionCallback} - 결과 해석 콜백</li>
 *   <li>{@link com.ryuqq.procexec.core.contract.ProcessTask} - 명령 + 콜백</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.procexec.core.contract;
