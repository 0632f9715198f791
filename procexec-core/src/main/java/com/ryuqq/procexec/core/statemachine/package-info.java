/**
 * 작업 생명주기 상태 머신.
 *
 * <ul>
 *   <li>{@link com.ryuqq.procexec.core.statemachine.TaskState} - 상태 정의</li>
 *   <li>{@link com.ryuqq.procexec.core.statemachine.TaskStateTransition} - 전이 검증</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.procexec.core.statemachine;
