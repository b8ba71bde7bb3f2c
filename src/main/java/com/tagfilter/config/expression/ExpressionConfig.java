package com.tagfilter.config.expression;

import com.tagfilter.element.ElementType;

import java.util.Map;

/**
 * Keywords and operator symbols of the filter expression language.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Keywords mapped to token types.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "WITH", TokenType.WITH,
            "AND", TokenType.AND,
            "OR", TokenType.OR
    );

    /**
     * Element type names as written in a filter.
     */
    public static final Map<String, ElementType> ELEMENT_TYPES = Map.of(
            "NODES", ElementType.NODE,
            "WAYS", ElementType.WAY,
            "RELATIONS", ElementType.RELATION
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char COMMA = ',';
        public static final char EQUALS = '=';
        public static final char BANG = '!';
        public static final char TILDE = '~';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKSLASH = '\\';
        public static final char DOT = '.';
        public static final char MINUS = '-';
        public static final char UNDERSCORE = '_';
        public static final char COLON = ':';

        private Operators() {
        }
    }
}
