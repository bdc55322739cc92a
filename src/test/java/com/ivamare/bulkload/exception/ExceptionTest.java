package com.ivamare.bulkload.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Exceptions")
class ExceptionTest {

    @Test
    @DisplayName("should format code and message of unrecoverable conditions")
    void shouldFormatCodeAndMessage() {
        UnrecoverableConditionException ex = new UnrecoverableConditionException(
            "DUPLICATE_COPY", "Partition 3 is already being copied", Map.of("partition", 3));

        assertEquals("[DUPLICATE_COPY] Partition 3 is already being copied", ex.getMessage());
        assertEquals("DUPLICATE_COPY", ex.getCode());
        assertEquals("Partition 3 is already being copied", ex.getErrorMessage());
        assertEquals(Map.of("partition", 3), ex.getDetails());
        assertInstanceOf(BulkLoadException.class, ex);
    }

    @Test
    @DisplayName("should default to empty details")
    void shouldDefaultToEmptyDetails() {
        assertTrue(new UnrecoverableConditionException("X", "y").getDetails().isEmpty());
        assertTrue(new UnrecoverableConditionException("X", "y", null).getDetails().isEmpty());
    }

    @Test
    @DisplayName("should keep the cause of bulk load exceptions")
    void shouldKeepCause() {
        IllegalStateException cause = new IllegalStateException();

        assertSame(cause, new BulkLoadException("wrapped", cause).getCause());
    }
}
