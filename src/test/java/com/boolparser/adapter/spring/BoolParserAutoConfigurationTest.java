package com.boolparser.adapter.spring;

import com.boolparser.config.GrammarConfig;
import com.boolparser.expression.BooleanExpressionEvaluator;
import com.boolparser.spring.EnableBoolParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for BoolParserAutoConfiguration.
 */
class BoolParserAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(BoolParserAutoConfiguration.class));

    @Test
    @DisplayName("Should create an evaluator for the bundled grammar")
    void createsEvaluator() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(BooleanExpressionEvaluator.class);
            assertThat(context.getBean(GrammarConfig.class)).isEqualTo(GrammarConfig.defaults());
            assertThat(context.getBean(BooleanExpressionEvaluator.class)
                    .evaluate("x > 3 & A", Map.of("x", 5, "A", true))).isTrue();
        });
    }

    @Test
    @DisplayName("Should load the grammar from the configured path")
    void usesConfiguredGrammarPath() {
        contextRunner
                .withPropertyValues("boolparser.grammar-path=classpath:grammar-logical.yaml")
                .run(context -> {
                    assertThat(context.getBean(GrammarConfig.class).name()).isEqualTo("logical");
                    assertThat(context.getBean(BooleanExpressionEvaluator.class)
                            .evaluate("A && ~B", Map.of("A", true, "B", false))).isTrue();
                });
    }

    @Test
    @DisplayName("Should back off when a grammar bean exists")
    void backsOffForUserGrammar() {
        contextRunner
                .withBean(GrammarConfig.class, GrammarConfig::defaults)
                .withPropertyValues("boolparser.grammar-path=classpath:no-such-grammar.yaml")
                .run(context -> assertThat(context).hasSingleBean(BooleanExpressionEvaluator.class));
    }

    @Test
    @DisplayName("Should create nothing when disabled")
    void disabled() {
        contextRunner
                .withPropertyValues("boolparser.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(BooleanExpressionEvaluator.class));
    }

    @Test
    @DisplayName("Should register the beans through @EnableBoolParser")
    void enableAnnotation() {
        new ApplicationContextRunner()
                .withUserConfiguration(EnabledConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(GrammarConfig.class);
                    assertThat(context.getBean(BooleanExpressionEvaluator.class)
                            .evaluate("!A", Map.of("A", false))).isTrue();
                });
    }

    @Configuration
    @EnableBoolParser
    static class EnabledConfiguration {
    }
}
