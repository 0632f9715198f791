package com.ryuqq.procexec.core.gate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GateConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class GateConfigTest {

    @Test
    void of_PositiveCapacity_CreatesUnfairConfig() {
        // When
        GateConfig config = GateConfig.of(4);

        // Then
        assertEquals(4, config.capacity());
        assertFalse(config.fair());
    }

    @Test
    void constructor_ZeroCapacity_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> new GateConfig(0, true));
        assertTrue(exception.getMessage().contains("capacity must be positive (current: 0)"));
    }

    @Test
    void constructor_NegativeCapacity_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> GateConfig.of(-1));
    }
}
