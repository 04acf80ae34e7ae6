package com.trigger.lisp;

import java.util.Map;
import java.util.Set;

/**
 * Keywords, special forms and delimiters of the rule language.
 */
public final class LispConfig {

    private LispConfig() {
    }

    /**
     * Reserved atoms mapped to literal token types.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "true", TokenType.BOOLEAN,
            "false", TokenType.BOOLEAN,
            "nil", TokenType.NULL
    );

    /**
     * Boolean literal values.
     */
    public static final Map<String, Boolean> BOOLEAN_VALUES = Map.of(
            "true", true,
            "false", false
    );

    /**
     * Forms whose arguments are not evaluated before the form runs.
     */
    public static final class SpecialForms {
        public static final String VAR = "var";
        public static final String SET = "set";
        public static final String DO = "do";
        public static final String IF = "if";
        public static final String AND = "and";
        public static final String OR = "or";
        public static final String FUNC = "func";

        public static final Set<String> ALL = Set.of(VAR, SET, DO, IF, AND, OR, FUNC);

        private SpecialForms() {
        }
    }

    /**
     * Delimiter symbols.
     */
    public static final class Delimiters {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char QUOTE = '"';
        public static final char BACKSLASH = '\\';
        public static final char COMMENT = ';';
        public static final char NEWLINE = '\n';

        private Delimiters() {
        }
    }
}
