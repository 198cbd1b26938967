package com.boolparser.token;

import com.boolparser.parser.ParseItem;

/**
 * Represents a token in an expression.
 *
 * @param type     Token type
 * @param text     Original text
 * @param position Position in the whitespace-stripped input
 */
public record Token(TokenType type, String text, int position) implements ParseItem {

    public boolean isOperator() {
        return type == TokenType.OPERATOR;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
