/**
 * Reusable contract tests for SPI implementations.
 *
 * <p>Extend {@link com.ryuqq.procexec.testkit.contract.AbstractConcurrencyGateContractTest}
 * and supply a gate factory to verify a ConcurrencyGate implementation.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.procexec.testkit.contract;
