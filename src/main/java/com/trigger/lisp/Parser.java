package com.trigger.lisp;

import com.trigger.exception.RuleParseException;
import com.trigger.value.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for rule source.
 * Converts tokens into a program tree using recursive descent.
 * <p>
 * Grammar:
 * <pre>
 * program := form* EOF
 * form    := '(' form* ')' | atom
 * atom    := STRING | INTEGER | FLOAT | BOOLEAN | NULL | SYMBOL
 * </pre>
 */
public final class Parser {

    private final String name;
    private final String input;
    private final List<Token> tokens;
    private int index;

    public Parser(String name, String input, List<Token> tokens) {
        this.name = name;
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Tokenize and parse rule source.
     *
     * @param name   Source name, used in error messages
     * @param source Source text
     * @return Parsed program
     * @throws RuleParseException if the source is not well formed
     */
    public static ProgramNode parse(String name, String source) {
        List<Token> tokens = new Tokenizer(name, source).tokenize();
        return new Parser(name, source, tokens).parse();
    }

    /**
     * Parse the token stream into a program.
     *
     * @return Parsed program
     */
    public ProgramNode parse() {
        List<Node> forms = new ArrayList<>();
        while (!check(TokenType.EOF)) {
            forms.add(parseForm());
        }
        return new ProgramNode(name, forms);
    }

    private Node parseForm() {
        if (match(TokenType.LPAREN)) {
            int start = previous().position();
            List<Node> elements = new ArrayList<>();
            while (!check(TokenType.RPAREN)) {
                if (check(TokenType.EOF)) {
                    throw error("Unclosed '(' opened at offset " + start);
                }
                elements.add(parseForm());
            }
            advance();
            return new ListNode(elements, start);
        }
        return parseAtom();
    }

    private Node parseAtom() {
        Token token = peek();
        Node node = switch (token.type()) {
            case STRING -> new LiteralNode(Value.of((String) token.literal()), token.position());
            case INTEGER -> new LiteralNode(Value.of((long) (Long) token.literal()), token.position());
            case FLOAT -> new LiteralNode(Value.of((double) (Double) token.literal()), token.position());
            case BOOLEAN -> new LiteralNode(Value.of((boolean) (Boolean) token.literal()), token.position());
            case NULL -> new LiteralNode(Value.nil(), token.position());
            case SYMBOL -> new SymbolNode(token.text(), token.position());
            case RPAREN -> throw error("Unexpected ')'");
            default -> throw error("Unexpected " + token.type());
        };
        advance();
        return node;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) {
            index++;
        }
        return previous();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private RuleParseException error(String message) {
        return parseError(name, input, peek().position(), message);
    }

    static RuleParseException parseError(String name, String input, int position, String message) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < position && i < input.length(); i++) {
            if (input.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new RuleParseException(name + ":" + line + ":" + column + ": " + message);
    }
}
