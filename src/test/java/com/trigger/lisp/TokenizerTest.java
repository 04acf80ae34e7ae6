package com.trigger.lisp;

import com.trigger.exception.RuleParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Tokenizer.
 */
class TokenizerTest {

    private List<Token> tokenize(String source) {
        return new Tokenizer("test.rule", source).tokenize();
    }

    @Test
    @DisplayName("Should split a form into delimiters, symbols and literals")
    void shouldTokenizeForm() {
        List<Token> tokens = tokenize("(set time:second 42)");

        assertEquals(List.of(TokenType.LPAREN, TokenType.SYMBOL, TokenType.SYMBOL, TokenType.INTEGER,
                TokenType.RPAREN, TokenType.EOF), tokens.stream().map(Token::type).toList());
        assertEquals("time:second", tokens.get(2).text());
        assertEquals(42L, tokens.get(3).literal());
    }

    @Test
    @DisplayName("Should classify numbers, operators and keywords")
    void shouldClassifyAtoms() {
        List<Token> tokens = tokenize("-7 3.5 - + true nil >=");

        assertEquals(TokenType.INTEGER, tokens.get(0).type());
        assertEquals(-7L, tokens.get(0).literal());
        assertEquals(TokenType.FLOAT, tokens.get(1).type());
        assertEquals(3.5, tokens.get(1).literal());
        assertEquals(TokenType.SYMBOL, tokens.get(2).type());
        assertEquals(TokenType.SYMBOL, tokens.get(3).type());
        assertEquals(TokenType.BOOLEAN, tokens.get(4).type());
        assertEquals(true, tokens.get(4).literal());
        assertEquals(TokenType.NULL, tokens.get(5).type());
        assertEquals(TokenType.SYMBOL, tokens.get(6).type());
    }

    @Test
    @DisplayName("Should unescape string literals")
    void shouldReadStrings() {
        List<Token> tokens = tokenize("\"say \\\"hi\\\"\\n\"");

        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("say \"hi\"\n", tokens.get(0).literal());
    }

    @Test
    @DisplayName("Should skip comments")
    void shouldSkipComments() {
        List<Token> tokens = tokenize("; comment (ignored)\n(log \"x\") ; trailing");

        assertEquals(5, tokens.size());
        assertEquals(TokenType.LPAREN, tokens.get(0).type());
    }

    @Test
    @DisplayName("Should reject unterminated strings with a position")
    void shouldRejectUnterminatedString() {
        RuleParseException e = assertThrows(RuleParseException.class,
                () -> tokenize("(log\n  \"oops)"));

        assertTrue(e.getMessage().startsWith("test.rule:2:3:"), e.getMessage());
        assertTrue(e.getMessage().contains("Unterminated string"));
    }
}
