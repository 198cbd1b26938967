package com.boolparser.token;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Character classes and literal spellings recognized by the lexer.
 * Operator symbols are not listed here: they come from the grammar.
 */
public final class LexerConfig {

    private LexerConfig() {
    }

    /**
     * Boolean literal spellings. Matching is exact and case-sensitive.
     */
    public static final Map<String, Boolean> BOOLEAN_VALUES = Map.of(
            "True", true,
            "False", false
    );

    /**
     * Digits with at most one decimal point, at least one digit.
     */
    public static final Pattern NUMERIC_LITERAL = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");

    public static final char LEFT_PAREN = '(';
    public static final char RIGHT_PAREN = ')';
    public static final char UNDERSCORE = '_';
    public static final char DOT = '.';

    /**
     * Letters, digits, underscore and dot make up identifiers and literals.
     */
    public static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == UNDERSCORE
                || c == DOT;
    }

    public static boolean isParenthesis(char c) {
        return c == LEFT_PAREN || c == RIGHT_PAREN;
    }
}
