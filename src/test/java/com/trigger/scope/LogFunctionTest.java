package com.trigger.scope;

import com.trigger.exception.ArgumentException;
import com.trigger.value.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the log action.
 */
class LogFunctionTest {

    private final LogFunction log = new LogFunction();

    @Test
    @DisplayName("Logs a single string and returns nil")
    void logsMessage() {
        assertEquals(Value.nil(), log.call(List.of(Value.of("motion in hallway"))));
    }

    @Test
    @DisplayName("Rejects a non-string argument")
    void rejectsNonString() {
        ArgumentException e = assertThrows(ArgumentException.class, () -> log.call(List.of(Value.of(42))));
        assertTrue(e.getMessage().contains("42"));
    }

    @Test
    @DisplayName("Rejects more than one argument")
    void rejectsTwoArguments() {
        ArgumentException e = assertThrows(ArgumentException.class,
                () -> log.call(List.of(Value.of("a"), Value.of("b"))));
        assertTrue(e.getMessage().contains("2 arguments"));
    }

    @Test
    @DisplayName("Rejects no arguments")
    void rejectsNoArguments() {
        assertThrows(ArgumentException.class, () -> log.call(List.of()));
    }
}
