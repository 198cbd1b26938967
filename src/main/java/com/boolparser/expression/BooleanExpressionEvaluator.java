package com.boolparser.expression;

import com.boolparser.config.GrammarConfig;
import com.boolparser.exception.InvalidExpressionException;
import com.boolparser.exception.TypeMismatchException;
import com.boolparser.parser.ExpressionParser;
import com.boolparser.token.Lexer;
import com.boolparser.token.Token;
import com.boolparser.variable.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Evaluates boolean expressions against a symbol table.
 * <p>
 * Every call tokenizes and parses from scratch; nothing is kept between calls, so
 * one instance can be shared by any number of threads. Identifiers are looked up
 * only while the finished tree is evaluated, so a table missing a name never makes
 * parsing fail.
 * <p>
 * {@code &} and {@code |} short-circuit: when the left operand decides the result,
 * the right operand is not evaluated, so its identifiers are not looked up and its
 * value is not type-checked. With {@code A} false, {@code A & x} is false whatever
 * {@code x} holds.
 * <p>
 * With the default grammar the following are supported:
 * - Logical: ! (NOT), &amp; (AND), ^ (XOR), | (OR)
 * - Comparison: &gt;, &gt;=, &lt;, &lt;=
 * - Equality: ==, != on two booleans or two numbers
 * - Arithmetic: *, /, +, -
 * - Parentheses for grouping
 * - Boolean literals: True, False
 */
public class BooleanExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(BooleanExpressionEvaluator.class);

    private final Lexer lexer;
    private final ExpressionParser parser;

    public BooleanExpressionEvaluator() {
        this(GrammarConfig.defaults());
    }

    public BooleanExpressionEvaluator(GrammarConfig grammar) {
        this.lexer = new Lexer(grammar);
        this.parser = new ExpressionParser(grammar);
    }

    /**
     * Evaluate an expression against a symbol table.
     *
     * @param expression Expression text (e.g., "(x > 3 &amp; enabled) | override")
     * @param symbols    Table identifiers are resolved against
     * @return The value of the expression
     * @throws com.boolparser.exception.ExpressionParseException if the text does not parse
     * @throws com.boolparser.exception.EvaluationException      if evaluation fails
     */
    public boolean evaluate(String expression, SymbolTable symbols) {
        Expression root = parse(expression);
        Object value = root.evaluate(symbols);

        if (!(value instanceof Boolean result)) {
            throw new TypeMismatchException("Expression '" + expression + "' evaluated to "
                    + value + ", not a boolean");
        }
        log.debug("Evaluated '{}' as {} to {}", expression, root, result);
        return result;
    }

    /**
     * Evaluate an expression against a map of values. The map is not copied.
     */
    public boolean evaluate(String expression, Map<String, ?> symbols) {
        return evaluate(expression, SymbolTable.of(symbols));
    }

    /**
     * Parse an expression without evaluating it. No symbol table is involved, so
     * this checks syntax only.
     *
     * @param expression Expression text
     * @return Root of the parsed tree
     * @throws InvalidExpressionException if the root can only yield a number
     */
    public Expression parse(String expression) {
        String source = Lexer.stripWhitespace(expression);
        List<Token> tokens = lexer.tokenize(source);
        Expression root = parser.parse(source, tokens);

        if (root.returns() == ValueType.NUMERIC) {
            throw new InvalidExpressionException("Invalid expression '" + source
                    + "': yields a number, not a boolean", source, List.of(root));
        }
        return root;
    }
}
