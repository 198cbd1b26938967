package com.boolparser.parser;

import com.boolparser.config.GrammarConfig;
import com.boolparser.config.OperationSpec;
import com.boolparser.config.PrecedenceTier;
import com.boolparser.exception.InvalidExpressionException;
import com.boolparser.exception.MatchException;
import com.boolparser.expression.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Folds a flat sequence of tokens and expressions into a single expression.
 * <p>
 * Tiers are processed in grammar order. Within a tier the leftmost complete
 * pattern is folded into a new node and the scan restarts from the beginning,
 * until the tier finds nothing more to fold. Earlier tiers therefore bind
 * tighter, and operators sharing a tier associate to the left.
 */
public final class PrecedenceMatcher {

    private static final Logger log = LoggerFactory.getLogger(PrecedenceMatcher.class);

    private final List<PrecedenceTier> tiers;
    private final List<PatternTrie> tries;

    public PrecedenceMatcher(GrammarConfig grammar) {
        this.tiers = grammar.tiers();
        this.tries = tiers.stream()
                .map(tier -> new PatternTrie(tier.patterns()))
                .toList();
    }

    /**
     * Reduce a sequence to one expression.
     *
     * @param items Flat sequence, free of parentheses
     * @param input Input being parsed (for error messages)
     * @return The root of the folded tree
     * @throws MatchException             if a tier completes a pattern that names no operation
     * @throws InvalidExpressionException if the sequence does not fold to exactly one expression
     */
    public Expression reduce(List<ParseItem> items, String input) {
        List<ParseItem> sequence = new ArrayList<>(items);

        for (int t = 0; t < tiers.size(); t++) {
            PrecedenceTier tier = tiers.get(t);
            PatternTrie trie = tries.get(t);

            Optional<PatternTrie.Match> match = findLeftmost(trie, sequence);
            while (match.isPresent()) {
                fold(tier, match.get(), sequence, input);
                match = findLeftmost(trie, sequence);
            }
        }

        if (sequence.size() != 1 || !(sequence.get(0) instanceof Expression)) {
            throw new InvalidExpressionException("Invalid expression '" + input
                    + "': could not reduce to a single expression, left with " + sequence, input, sequence);
        }
        return (Expression) sequence.get(0);
    }

    private Optional<PatternTrie.Match> findLeftmost(PatternTrie trie, List<ParseItem> sequence) {
        for (int start = 0; start < sequence.size(); start++) {
            Optional<PatternTrie.Match> match = trie.matchAt(sequence, start);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private void fold(PrecedenceTier tier, PatternTrie.Match match, List<ParseItem> sequence, String input) {
        if (match.operators().isEmpty()) {
            throw new MatchException("Tier '" + tier.name() + "' matched " + sequence.subList(match.start(), match.end())
                    + " without an operator, so no operation can be identified", input);
        }

        String symbol = match.operators().get(0);
        int arity = match.operands().size();
        OperationSpec spec = tier.find(symbol, arity)
                .orElseThrow(() -> new MatchException("Tier '" + tier.name() + "' has no operation for '"
                        + symbol + "' with " + arity + " operand(s)", input));

        Expression expression = spec.create(match.operands());
        List<ParseItem> span = sequence.subList(match.start(), match.end());
        span.clear();
        span.add(expression);

        log.debug("Folded {} in tier '{}'", expression, tier.name());
    }
}
