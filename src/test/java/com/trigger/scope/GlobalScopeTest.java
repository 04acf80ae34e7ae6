package com.trigger.scope;

import com.trigger.exception.UndefinedSymbolException;
import com.trigger.exception.UnsupportedScopeOperationException;
import com.trigger.lisp.DefaultScope;
import com.trigger.lisp.Parser;
import com.trigger.store.InMemoryKeyValueStore;
import com.trigger.value.Value;
import com.trigger.variable.ChangeEvent;
import com.trigger.variable.VariableManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GlobalScope.
 */
class GlobalScopeTest {

    private InMemoryKeyValueStore store;
    private VariableManager variables;
    private GlobalScope scope;
    private ExecutorService evaluator;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        variables = new VariableManager(store);
        scope = new GlobalScope(variables);
        evaluator = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        evaluator.shutdownNow();
    }

    @Test
    @DisplayName("Declaring, branching and enclosing are rejected")
    void unsupportedOperationsFail() {
        UnsupportedScopeOperationException create = assertThrows(UnsupportedScopeOperationException.class,
                () -> scope.create("x", Value.of(1)));
        assertTrue(create.getMessage().startsWith("operation not supported at global scope"));

        assertThrows(UnsupportedScopeOperationException.class, () -> scope.branch());
        assertThrows(UnsupportedScopeOperationException.class, () -> scope.enclose(new DefaultScope()));

        assertTrue(store.get("var~x").isEmpty());
    }

    @Test
    @DisplayName("get reads variables")
    void getReadsVariables() {
        store.set("var~door", "{\"value\":\"open\"}");

        assertEquals(Value.of("open"), scope.get("door"));
        assertThrows(UndefinedSymbolException.class, () -> scope.get("window"));
    }

    @Test
    @DisplayName("Assignments in evaluated code write variables")
    void evalWritesVariables() throws Exception {
        store.set("var~x", "{\"value\":20}");

        Future<Value> result = evaluator.submit(() ->
                scope.eval(Parser.parse("t.rule", "(set y (+ x 1))")));

        ChangeEvent event = variables.pollChange(2, TimeUnit.SECONDS);
        assertEquals(new ChangeEvent("y", Value.of(21)), event);
        assertEquals(Value.of(21), result.get(2, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Local declarations stay out of the variable store")
    void localsAreNotPersisted() {
        Value result = scope.eval(Parser.parse("t.rule", "(var tmp 5) (* tmp 2)"));

        assertEquals(Value.of(10), result);
        assertTrue(store.get("var~tmp").isEmpty());
    }

    @Test
    @DisplayName("Each evaluation starts with fresh locals")
    void evaluationsAreIndependent() {
        scope.eval(Parser.parse("t.rule", "(var tmp 1)"));
        assertEquals(Value.of(2), scope.eval(Parser.parse("t.rule", "(var tmp 2) tmp")));
    }

    @Test
    @DisplayName("Built-in actions are bound during evaluation")
    void builtinsAreBound() {
        assertEquals(Value.nil(), scope.eval(Parser.parse("t.rule", "(log \"hello\")")));
    }
}
