package com.boolparser.config;

import com.boolparser.exception.ConfigurationException;
import com.boolparser.expression.Operation;
import com.boolparser.expression.PatternElement;
import com.boolparser.token.LexerConfig;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Grammar of a boolean expression language: operations grouped in tiers,
 * listed from the tightest binding to the loosest.
 *
 * @param name  Grammar name
 * @param tiers Precedence tiers in precedence order
 */
public record GrammarConfig(
        String name,
        List<PrecedenceTier> tiers
) {
    public GrammarConfig {
        if (tiers == null || tiers.isEmpty()) {
            throw new ConfigurationException("Grammar '" + name + "' has no precedence tiers");
        }
        tiers = List.copyOf(tiers);

        for (PrecedenceTier tier : tiers) {
            for (OperationSpec spec : tier.operations()) {
                for (PatternElement element : spec.expects()) {
                    if (element.isOperator()) {
                        validateSymbol(element.symbol(), tier);
                    }
                }
            }
        }
    }

    /**
     * Default grammar: C-like precedence with negation binding tightest and OR loosest.
     */
    public static GrammarConfig defaults() {
        return new GrammarConfig("default", List.of(
                PrecedenceTier.of("negation", Operation.NOT),
                PrecedenceTier.of("multiplicative", Operation.MULTIPLY, Operation.DIVIDE),
                PrecedenceTier.of("additive", Operation.ADD, Operation.SUBTRACT),
                PrecedenceTier.of("relational", Operation.GREATER_THAN, Operation.GREATER_THAN_OR_EQUALS,
                        Operation.LESS_THAN, Operation.LESS_THAN_OR_EQUALS),
                PrecedenceTier.of("equality", Operation.EQUALS, Operation.NOT_EQUALS),
                PrecedenceTier.of("conjunction", Operation.AND),
                PrecedenceTier.of("exclusive-disjunction", Operation.XOR),
                PrecedenceTier.of("disjunction", Operation.OR)
        ));
    }

    /**
     * Every operator symbol registered in any tier.
     */
    public Set<String> operatorSymbols() {
        Set<String> symbols = new LinkedHashSet<>();
        for (PrecedenceTier tier : tiers) {
            for (OperationSpec spec : tier.operations()) {
                spec.expects().stream()
                        .filter(PatternElement::isOperator)
                        .forEach(e -> symbols.add(e.symbol()));
            }
        }
        return symbols;
    }

    /**
     * Symbols used by patterns that start with their operator.
     */
    public Set<String> prefixSymbols() {
        Set<String> symbols = new LinkedHashSet<>();
        for (PrecedenceTier tier : tiers) {
            for (OperationSpec spec : tier.operations()) {
                if (spec.isPrefix()) {
                    symbols.add(spec.expects().get(0).symbol());
                }
            }
        }
        return symbols;
    }

    /**
     * Symbols used after an operand in some pattern.
     */
    public Set<String> infixSymbols() {
        Set<String> symbols = new LinkedHashSet<>();
        for (PrecedenceTier tier : tiers) {
            for (OperationSpec spec : tier.operations()) {
                List<PatternElement> expects = spec.expects();
                for (int i = 1; i < expects.size(); i++) {
                    if (expects.get(i).isOperator() && !expects.get(i - 1).isOperator()) {
                        symbols.add(expects.get(i).symbol());
                    }
                }
            }
        }
        return symbols;
    }

    private static void validateSymbol(String symbol, PrecedenceTier tier) {
        if (symbol.isEmpty()) {
            throw new ConfigurationException("Tier '" + tier.name() + "' uses an empty operator symbol");
        }
        for (char c : symbol.toCharArray()) {
            if (LexerConfig.isWordChar(c) || LexerConfig.isParenthesis(c) || Character.isWhitespace(c)) {
                throw new ConfigurationException("Tier '" + tier.name() + "' uses operator symbol '"
                        + symbol + "' containing reserved character '" + c + "'");
            }
        }
    }
}
