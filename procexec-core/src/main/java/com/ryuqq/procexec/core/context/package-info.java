/**
 * 명시적 실행 컨텍스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.procexec.core.context;
