/**
 * 동시 실행 수 제한 SPI.
 *
 * <p>구현체는 adapter-runner 모듈의 {@code SemaphoreConcurrencyGate}입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.procexec.core.gate;
