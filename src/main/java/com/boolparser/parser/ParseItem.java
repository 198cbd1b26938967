package com.boolparser.parser;

/**
 * Element of the working sequence folded by the {@link PrecedenceMatcher}:
 * either a raw {@link com.boolparser.token.Token} or an already built
 * {@link com.boolparser.expression.Expression}.
 */
public interface ParseItem {
}
