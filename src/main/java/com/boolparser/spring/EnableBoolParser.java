package com.boolparser.spring;

import com.boolparser.adapter.spring.BoolParserAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Registers a {@code GrammarConfig} and a {@code BooleanExpressionEvaluator} bean.
 * <p>
 * The grammar is read from {@code boolparser.grammar-path} (the bundled default
 * grammar unless set), and {@code boolparser.enabled=false} turns the beans off.
 * Beans of either type that the application declares itself take precedence.
 * <pre>
 * &#64;Configuration
 * &#64;EnableBoolParser
 * class RulesConfiguration {
 *     &#64;Bean
 *     RuleChecker ruleChecker(BooleanExpressionEvaluator evaluator) {
 *         return new RuleChecker(evaluator);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(BoolParserAutoConfiguration.class)
public @interface EnableBoolParser {
}
