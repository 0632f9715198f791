package com.ryuqq.procexec.core.contract;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProcessTask Record 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ProcessTaskTest {

    private static final CompletionCallback NOOP = (output, error) -> { };

    @Test
    void of_ValidValues_CreatesTask() {
        // Given
        ProcessCommand command = ProcessCommand.of("cat", List.of(), "x");

        // When
        ProcessTask task = ProcessTask.of(command, NOOP);

        // Then
        assertSame(command, task.command());
        assertSame(NOOP, task.onComplete());
    }

    @Test
    void constructor_NullCommand_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new ProcessTask(null, NOOP)
        );
        assertTrue(exception.getMessage().contains("command cannot be null"));
    }

    @Test
    void constructor_NullCallback_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new ProcessTask(ProcessCommand.of("cat", List.of()), null)
        );
        assertTrue(exception.getMessage().contains("onComplete cannot be null"));
    }
}
