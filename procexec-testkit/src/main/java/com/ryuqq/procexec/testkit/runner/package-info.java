/**
 * Test doubles for the ProcessRunner SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.procexec.testkit.runner;
