package com.trigger.lisp;

import com.trigger.exception.RuleParseException;
import com.trigger.value.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Parser.
 */
class ParserTest {

    @Test
    @DisplayName("Should parse nested forms")
    void shouldParseNestedForms() {
        ProgramNode program = Parser.parse("a.rule", "(if (== x 1) (log \"one\"))");

        assertEquals("a.rule", program.name());
        assertEquals(1, program.forms().size());

        ListNode form = (ListNode) program.forms().get(0);
        assertEquals(new SymbolNode("if", 1), form.head());
        assertEquals(2, form.arguments().size());

        ListNode condition = (ListNode) form.arguments().get(0);
        assertEquals(new LiteralNode(Value.of(1), 10), condition.elements().get(2));
    }

    @Test
    @DisplayName("Should parse several top-level forms")
    void shouldParseTopLevelForms() {
        ProgramNode program = Parser.parse("b.rule", "(var a 1)\n(var b 2)\n\"done\"");

        assertEquals(3, program.forms().size());
        assertInstanceOf(LiteralNode.class, program.forms().get(2));
    }

    @Test
    @DisplayName("Empty source is an empty program")
    void shouldParseEmptySource() {
        assertTrue(Parser.parse("empty.rule", "  ; nothing here\n").forms().isEmpty());
    }

    @Test
    @DisplayName("Should reject unbalanced parentheses")
    void shouldRejectUnbalanced() {
        assertThrows(RuleParseException.class, () -> Parser.parse("c.rule", "(log \"x\""));
        assertThrows(RuleParseException.class, () -> Parser.parse("c.rule", "(log \"x\"))"));
    }

    @Test
    @DisplayName("Error names the source and line")
    void errorNamesSource() {
        RuleParseException e = assertThrows(RuleParseException.class,
                () -> Parser.parse("bad.rule", "(var a 1)\n)"));

        assertTrue(e.getMessage().startsWith("bad.rule:2:1:"), e.getMessage());
    }
}
