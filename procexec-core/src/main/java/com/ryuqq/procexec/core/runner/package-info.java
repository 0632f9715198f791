/**
 * 프로세스 실행 SPI.
 *
 * <p>구현체는 adapter-runner 모듈의 {@code SystemProcessRunner}이며,
 * 테스트용 구현은 testkit 모듈의 {@code ScriptedProcessRunner}입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.procexec.core.runner;
