package com.boolparser.token;

/**
 * Token types produced by the lexer.
 */
public enum TokenType {
    // Delimiters
    LEFT_PAREN,
    RIGHT_PAREN,

    // Operator symbols registered in the grammar
    OPERATOR,

    // Literals and identifiers
    BOOLEAN_LITERAL,
    NUMERIC_LITERAL,
    IDENTIFIER;

    /**
     * Whether a token of this type can be the last token of an operand.
     */
    public boolean endsOperand() {
        return this == RIGHT_PAREN || isLeaf();
    }

    /**
     * Whether a token of this type becomes a leaf expression on its own.
     */
    public boolean isLeaf() {
        return this == BOOLEAN_LITERAL || this == NUMERIC_LITERAL || this == IDENTIFIER;
    }
}
