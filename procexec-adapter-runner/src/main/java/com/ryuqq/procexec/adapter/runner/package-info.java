/**
 * Runner Adapter Layer - ProcessManager 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.procexec.adapter.runner.ConcurrentProcessManager} - 게이트 + 실행자 + 작업 그룹 조합</li>
 *   <li>{@link com.ryuqq.procexec.adapter.runner.SystemProcessRunner} - ProcessBuilder 기반 프로세스 실행자</li>
 *   <li>{@link com.ryuqq.procexec.adapter.runner.SemaphoreConcurrencyGate} - Semaphore 기반 게이트</li>
 *   <li>{@link com.ryuqq.procexec.adapter.runner.TaskGroup} - 완료 장벽 + 첫 번째 오류 보관</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ConcurrentProcessManager)
 *   ↓ implements
 * application (ProcessManager interface)
 *   ↓ depends on
 * core (ProcessCommand, ProcessOutcome, ConcurrencyGate, ProcessRunner, TaskState)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.procexec.adapter.runner;
