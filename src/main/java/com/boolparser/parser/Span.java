package com.boolparser.parser;

/**
 * Indices of a matched parenthesis pair in the token buffer.
 *
 * @param start Index of the left parenthesis
 * @param end   Index of the right parenthesis
 */
public record Span(int start, int end) {

    /**
     * Whether there is nothing between the parentheses.
     */
    public boolean isEmpty() {
        return end - start <= 1;
    }
}
