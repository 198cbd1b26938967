package com.boolparser;

import com.boolparser.exception.BoolParserException;
import com.boolparser.expression.BooleanExpressionEvaluator;
import com.boolparser.spring.EnableBoolParser;
import com.boolparser.variable.SymbolTable;
import com.boolparser.variable.SymbolTableFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Command-line application evaluating one expression.
 * <p>
 * Arguments: the expression, then optionally a JSON object used as the symbol table:
 * <pre>
 * java -jar boolparser.jar "x &gt; 3 &amp; enabled" '{"x": 5, "enabled": true}'
 * </pre>
 */
@SpringBootApplication
@EnableBoolParser
public class BoolParserApplication {

    private static final Logger log = LoggerFactory.getLogger(BoolParserApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(BoolParserApplication.class, args);
    }

    @Bean
    public CommandLineRunner evaluateArguments(BooleanExpressionEvaluator evaluator) {
        return args -> {
            if (args.length == 0) {
                log.info("Usage: <expression> [json-symbol-table]");
                return;
            }
            try {
                boolean result = run(evaluator, args);
                log.info("{} => {}", args[0], result);
            } catch (BoolParserException | IllegalArgumentException e) {
                log.error("Could not evaluate '{}': {}", args[0], e.getMessage());
            }
        };
    }

    /**
     * Evaluate {@code args[0]} against the table in {@code args[1]}, if any.
     */
    static boolean run(BooleanExpressionEvaluator evaluator, String... args) {
        SymbolTable symbols = args.length > 1 ? SymbolTableFactory.fromJson(args[1]) : SymbolTable.empty();
        return evaluator.evaluate(args[0], symbols);
    }
}
