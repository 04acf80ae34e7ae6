package com.trigger.lisp;

import com.trigger.exception.RuleParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static com.trigger.lisp.LispConfig.*;

/**
 * Tokenizer for rule source.
 * Converts input text into a sequence of tokens.
 */
public final class Tokenizer {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+(\\.\\d*)?[eE][+-]?\\d+)");

    private final String name;
    private final String input;
    private final int length;
    private int pos;

    public Tokenizer(String name, String input) {
        this.name = name;
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input text.
     *
     * @return List of tokens, ending with {@link TokenType#EOF}
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Delimiters.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", null, start));
                }
                case Delimiters.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", null, start));
                }
                case Delimiters.QUOTE -> tokens.add(readString());
                case Delimiters.COMMENT -> skipComment();
                default -> tokens.add(readAtom());
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token readAtom() {
        int start = pos;

        while (!isAtEnd() && isAtomPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);

        TokenType keywordType = KEYWORDS.get(text);
        if (keywordType != null) {
            return new Token(keywordType, text, BOOLEAN_VALUES.get(text), start);
        }

        try {
            if (INTEGER.matcher(text).matches()) {
                return new Token(TokenType.INTEGER, text, Long.parseLong(text), start);
            }
            if (FLOAT.matcher(text).matches()) {
                return new Token(TokenType.FLOAT, text, Double.parseDouble(text), start);
            }
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }

        return new Token(TokenType.SYMBOL, text, null, start);
    }

    private Token readString() {
        int start = pos;
        advance(); // opening quote
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != Delimiters.QUOTE) {
            char c = advance();

            if (c == Delimiters.BACKSLASH && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string", start);
        }

        advance(); // closing quote
        return new Token(TokenType.STRING, sb.toString(), sb.toString(), start);
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != Delimiters.NEWLINE) {
            advance();
        }
    }

    private boolean isAtomPart(char c) {
        return !Character.isWhitespace(c)
                && c != Delimiters.LEFT_PAREN
                && c != Delimiters.RIGHT_PAREN
                && c != Delimiters.QUOTE
                && c != Delimiters.COMMENT;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private RuleParseException error(String message, int position) {
        return Parser.parseError(name, input, position, message);
    }
}
