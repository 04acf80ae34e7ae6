package com.trigger.scope;

import com.trigger.exception.ArgumentException;
import com.trigger.value.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the run action.
 */
class RunFunctionTest {

    private final RunFunction run = new RunFunction();

    @Test
    @DisplayName("Returns nil for a command that runs")
    void runsCommand() {
        assertEquals(Value.nil(), run.call(List.of(Value.of("echo"), Value.of("hello"))));
    }

    @Test
    @DisplayName("Missing program is logged, not raised")
    void missingProgramIsNotAnError() {
        assertEquals(Value.nil(), run.call(List.of(Value.of("/nonexistent/trigger-test-command"))));
    }

    @Test
    @DisplayName("Requires at least one argument")
    void requiresCommand() {
        assertThrows(ArgumentException.class, () -> run.call(List.of()));
    }

    @Test
    @DisplayName("Rejects non-string arguments")
    void rejectsNonStrings() {
        ArgumentException e = assertThrows(ArgumentException.class,
                () -> run.call(List.of(Value.of("sleep"), Value.of(1))));
        assertTrue(e.getMessage().contains("string"));
    }

    @Test
    @DisplayName("Passes program and arguments in order")
    void passesArguments() {
        List<List<String>> executed = new ArrayList<>();
        RunFunction recording = new RunFunction() {
            @Override
            void execute(List<String> command) {
                executed.add(command);
            }
        };

        recording.call(List.of(Value.of("notify-send"), Value.of("-u"), Value.of("low"), Value.of("hi")));

        assertEquals(List.of(List.of("notify-send", "-u", "low", "hi")), executed);
    }
}
