package com.trigger.lisp;

import com.trigger.exception.ArgumentException;
import com.trigger.exception.EvaluationException;
import com.trigger.exception.UndefinedSymbolException;
import com.trigger.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultScope evaluation and the standard library.
 */
class DefaultScopeTest {

    private DefaultScope scope;

    @BeforeEach
    void setUp() {
        scope = new DefaultScope();
    }

    private Value eval(String source) {
        return scope.eval(Parser.parse("test.rule", source));
    }

    @ParameterizedTest
    @DisplayName("Arithmetic and comparison")
    @CsvSource(delimiter = '|', value = {
            "(+ 1 2 3)            | 6",
            "(- 10 4)             | 6",
            "(- 5)                | -5",
            "(* 2 3 4)            | 24",
            "(/ 7 2)              | 3",
            "(+ 1 2.5)            | 3.5",
            "(/ 7.0 2)            | 3.5",
            "(< 1 2)              | true",
            "(>= 2 2.0)           | true",
            "(> \"b\" \"a\")      | true",
            "(== 1 1 1)           | true",
            "(== 1 1.0)           | false",
            "(!= \"a\" \"b\")     | true",
            "(not nil)            | true",
            "(and 1 false 2)      | false",
            "(or nil 0)           | 0"
    })
    void arithmeticAndComparison(String source, String expected) {
        assertEquals(expected, eval(source).display());
    }

    @Test
    @DisplayName("var declares and set assigns local bindings")
    void varAndSet() {
        assertEquals(Value.of(3), eval("(var a 1) (set a (+ a 2)) a"));
    }

    @Test
    @DisplayName("Redeclaring in the same scope fails")
    void redeclareFails() {
        assertThrows(EvaluationException.class, () -> eval("(var a 1) (var a 2)"));
    }

    @Test
    @DisplayName("do opens a nested scope")
    void doIsNested() {
        assertEquals(Value.of(1), eval("(var a 1) (do (var a 2) a) a"));
        assertEquals(Value.of(5), eval("(var b 1) (do (set b 5)) b"));
    }

    @Test
    @DisplayName("if picks a branch by truthiness")
    void ifBranches() {
        assertEquals(Value.of("yes"), eval("(if 0 \"yes\" \"no\")"));
        assertEquals(Value.of("no"), eval("(if false \"yes\" \"no\")"));
        assertEquals(Value.nil(), eval("(if nil \"yes\")"));
    }

    @Test
    @DisplayName("Named and anonymous functions close over their scope")
    void functions() {
        assertEquals(Value.of(12), eval("(var k 3) (func times-k (n) (* n k)) (times-k 4)"));
        assertEquals(Value.of(9), eval("((func (x) (* x x)) 3)"));
    }

    @Test
    @DisplayName("Function arity is checked")
    void functionArity() {
        assertThrows(ArgumentException.class, () -> eval("(func f (a b) a) (f 1)"));
    }

    @Test
    @DisplayName("string concatenates display forms")
    void stringConcatenation() {
        assertEquals(Value.of("t=5s ok"), eval("(string \"t=\" 5 \"s \" \"ok\")"));
        assertEquals(Value.of("ab"), eval("(+ \"a\" \"b\")"));
    }

    @Test
    @DisplayName("Runtime errors surface as evaluation exceptions")
    void runtimeErrors() {
        assertEquals("boom", assertThrows(EvaluationException.class, () -> eval("(error \"boom\")")).getMessage());
        assertThrows(EvaluationException.class, () -> eval("(/ 1 0)"));
        assertThrows(ArgumentException.class, () -> eval("(+ 1 \"a\")"));
        assertThrows(ArgumentException.class, () -> eval("(< 1 \"a\")"));
        assertThrows(EvaluationException.class, () -> eval("(1 2)"));
        assertThrows(UndefinedSymbolException.class, () -> eval("missing"));
        assertThrows(UndefinedSymbolException.class, () -> eval("(set missing 1)"));
    }

    @Test
    @DisplayName("Lookups and assignments fall through to an enclosing scope")
    void enclosingScope() {
        DefaultScope outer = new DefaultScope();
        outer.create("shared", Value.of(1));

        scope.enclose(outer);
        eval("(set shared (+ shared 1))");

        assertEquals(Value.of(2), outer.get("shared"));
        assertThrows(EvaluationException.class, () -> scope.enclose(outer));
    }

    @Test
    @DisplayName("Branches see parent bindings but keep their own")
    void branches() {
        scope.create("a", Value.of(1));
        Scope child = scope.branch();
        child.create("b", Value.of(2));

        assertEquals(Value.of(1), child.get("a"));
        assertThrows(UndefinedSymbolException.class, () -> scope.get("b"));
    }
}
