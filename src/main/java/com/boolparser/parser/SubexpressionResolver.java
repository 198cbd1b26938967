package com.boolparser.parser;

import com.boolparser.exception.MissingLeftParenthesisException;
import com.boolparser.exception.MissingRightParenthesisException;
import com.boolparser.expression.Expression;
import com.boolparser.expression.impl.BooleanLiteral;
import com.boolparser.expression.impl.Identifier;
import com.boolparser.expression.impl.NumericLiteral;
import com.boolparser.token.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Removes parenthesization from a token buffer.
 * <p>
 * Each outermost parenthesis group of a range is reduced to a single expression
 * by recursing into the range between its parentheses, so that the
 * {@link PrecedenceMatcher} only ever sees a flat sequence. All recursion works on
 * index ranges of the one buffer given at construction.
 */
public final class SubexpressionResolver {

    private final String input;
    private final List<Token> tokens;
    private final PrecedenceMatcher matcher;

    public SubexpressionResolver(String input, List<Token> tokens, PrecedenceMatcher matcher) {
        this.input = input;
        this.tokens = List.copyOf(tokens);
        this.matcher = matcher;
    }

    /**
     * Reduce the whole buffer to one expression.
     */
    public Expression reduce() {
        return reduce(0, tokens.size());
    }

    /**
     * Reduce the tokens in {@code [from, to)} to one expression.
     */
    public Expression reduce(int from, int to) {
        return matcher.reduce(resolve(from, to), input);
    }

    /**
     * Find the outermost complete parenthesis groups in {@code [from, to)}.
     * Groups nested inside them are left for the recursive call on their interior.
     *
     * @return Groups in left-to-right order
     * @throws MissingLeftParenthesisException  on a ')' with nothing open
     * @throws MissingRightParenthesisException when a '(' is still open at {@code to}
     */
    public List<Span> findGroups(int from, int to) {
        List<Span> groups = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();

        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            switch (token.type()) {
                case LEFT_PAREN -> stack.push(i);
                case RIGHT_PAREN -> {
                    if (stack.isEmpty()) {
                        throw new MissingLeftParenthesisException(token.position(), input);
                    }
                    int start = stack.pop();
                    if (stack.isEmpty()) {
                        groups.add(new Span(start, i));
                    }
                }
                default -> {
                }
            }
        }

        if (!stack.isEmpty()) {
            throw new MissingRightParenthesisException(tokens.get(stack.peek()).position(), input);
        }
        return groups;
    }

    /**
     * Flatten {@code [from, to)}: tokens outside groups are copied in order (leaf
     * tokens as leaf expressions), each non-empty group is replaced by the
     * expression its interior reduces to, and empty groups are dropped.
     */
    public List<ParseItem> resolve(int from, int to) {
        List<ParseItem> items = new ArrayList<>();
        int next = from;

        for (Span group : findGroups(from, to)) {
            copyTokens(next, group.start(), items);
            if (!group.isEmpty()) {
                items.add(reduce(group.start() + 1, group.end()));
            }
            next = group.end() + 1;
        }
        copyTokens(next, to, items);

        return items;
    }

    private void copyTokens(int from, int to, List<ParseItem> items) {
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            items.add(token.type().isLeaf() ? toLeaf(token) : token);
        }
    }

    static Expression toLeaf(Token token) {
        return switch (token.type()) {
            case BOOLEAN_LITERAL -> new BooleanLiteral(token.text());
            case NUMERIC_LITERAL -> new NumericLiteral(token.text());
            case IDENTIFIER -> new Identifier(token.text());
            default -> throw new IllegalArgumentException("Not a leaf token: " + token);
        };
    }
}
