package com.boolparser.config;

import com.boolparser.exception.ConfigurationException;
import com.boolparser.expression.Operation;
import com.boolparser.expression.PatternElement;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Group of operations folded together, before any later tier is considered.
 *
 * @param name       Tier name (for diagnostics)
 * @param operations Operations legal to fold in this tier
 */
public record PrecedenceTier(
        String name,
        List<OperationSpec> operations
) {
    public PrecedenceTier {
        if (operations == null || operations.isEmpty()) {
            throw new ConfigurationException("Precedence tier '" + name + "' has no operations");
        }
        operations = List.copyOf(operations);

        Set<String> keys = new HashSet<>();
        for (OperationSpec spec : operations) {
            String key = spec.symbol() + "/" + spec.arity();
            if (!keys.add(key)) {
                throw new ConfigurationException("Precedence tier '" + name + "' registers symbol '"
                        + spec.symbol() + "' with " + spec.arity() + " operand(s) more than once");
            }
        }
    }

    public static PrecedenceTier of(String name, Operation... operations) {
        return new PrecedenceTier(name, Arrays.stream(operations).map(OperationSpec::of).toList());
    }

    /**
     * Find the operation written with the given symbol and operand count.
     */
    public Optional<OperationSpec> find(String symbol, int arity) {
        return operations.stream()
                .filter(spec -> spec.arity() == arity)
                .filter(spec -> spec.expects().stream()
                        .anyMatch(e -> e.isOperator() && e.symbol().equals(symbol)))
                .findFirst();
    }

    /**
     * Patterns of all operations in this tier.
     */
    public List<List<PatternElement>> patterns() {
        return operations.stream().map(OperationSpec::expects).toList();
    }
}
