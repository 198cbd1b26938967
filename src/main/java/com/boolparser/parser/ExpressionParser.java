package com.boolparser.parser;

import com.boolparser.config.GrammarConfig;
import com.boolparser.expression.Expression;
import com.boolparser.token.Token;

import java.util.List;

/**
 * Builds an expression tree from tokens: parentheses are resolved first,
 * then the flat remainder is folded tier by tier.
 */
public final class ExpressionParser {

    private final PrecedenceMatcher matcher;

    public ExpressionParser(GrammarConfig grammar) {
        this.matcher = new PrecedenceMatcher(grammar);
    }

    /**
     * Parse the token stream into an expression tree.
     *
     * @param input  Whitespace-stripped input the tokens came from (for error messages)
     * @param tokens Tokens from the lexer
     * @return Root of the tree
     */
    public Expression parse(String input, List<Token> tokens) {
        return new SubexpressionResolver(input, tokens, matcher).reduce();
    }
}
