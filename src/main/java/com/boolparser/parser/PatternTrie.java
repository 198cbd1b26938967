package com.boolparser.parser;

import com.boolparser.expression.Expression;
import com.boolparser.expression.PatternElement;
import com.boolparser.expression.ValueType;
import com.boolparser.token.Token;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Trie over the patterns of one precedence tier.
 * <p>
 * Operator requirements match an operator token with the same symbol; operand
 * requirements match any expression whose type they accept. Identifiers are of
 * type {@link ValueType#ANY} and so may satisfy several branches: the walk
 * backtracks and takes the first branch that reaches a complete pattern.
 */
final class PatternTrie {

    private final Node root = new Node();

    PatternTrie(List<List<PatternElement>> patterns) {
        for (List<PatternElement> pattern : patterns) {
            Node node = root;
            for (PatternElement element : pattern) {
                node = node.children.computeIfAbsent(element, e -> new Node());
            }
            node.terminal = true;
        }
    }

    /**
     * Try to complete a pattern starting at {@code start}.
     *
     * @return The match, or empty if no pattern completes there
     */
    Optional<Match> matchAt(List<ParseItem> items, int start) {
        return Optional.ofNullable(walk(root, items, start, start, new ArrayList<>()));
    }

    private Match walk(Node node, List<ParseItem> items, int start, int index, List<ParseItem> consumed) {
        if (node.terminal) {
            return Match.of(start, index, consumed);
        }
        if (index >= items.size()) {
            return null;
        }

        ParseItem item = items.get(index);
        for (Node child : node.candidates(item)) {
            consumed.add(item);
            Match match = walk(child, items, start, index + 1, consumed);
            if (match != null) {
                return match;
            }
            consumed.remove(consumed.size() - 1);
        }
        return null;
    }

    private static final class Node {
        private final Map<PatternElement, Node> children = new LinkedHashMap<>();
        private boolean terminal;

        List<Node> candidates(ParseItem item) {
            if (item instanceof Token token) {
                if (!token.isOperator()) {
                    return List.of();
                }
                Node child = children.get(PatternElement.operator(token.text()));
                return child == null ? List.of() : List.of(child);
            }

            ValueType type = ((Expression) item).returns();
            return children.entrySet().stream()
                    .filter(e -> !e.getKey().isOperator())
                    .filter(e -> e.getKey().operandType().accepts(type))
                    .sorted(Comparator.comparingInt(e -> rank(e.getKey().operandType(), type)))
                    .map(Map.Entry::getValue)
                    .toList();
        }

        // Exact type first, then a requirement accepting anything, then the rest
        private static int rank(ValueType required, ValueType actual) {
            if (required == actual) {
                return 0;
            }
            return required == ValueType.ANY ? 1 : 2;
        }
    }

    /**
     * A completed pattern.
     *
     * @param start     Index of the first consumed item
     * @param end       Index after the last consumed item
     * @param operands  Consumed expressions, in order
     * @param operators Consumed operator symbols, in order
     */
    record Match(int start, int end, List<Expression> operands, List<String> operators) {

        static Match of(int start, int end, List<ParseItem> consumed) {
            List<Expression> operands = new ArrayList<>();
            List<String> operators = new ArrayList<>();
            for (ParseItem item : consumed) {
                if (item instanceof Token token) {
                    operators.add(token.text());
                } else {
                    operands.add((Expression) item);
                }
            }
            return new Match(start, end, List.copyOf(operands), List.copyOf(operators));
        }
    }
}
