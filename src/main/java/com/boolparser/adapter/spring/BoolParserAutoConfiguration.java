package com.boolparser.adapter.spring;

import com.boolparser.config.GrammarConfig;
import com.boolparser.config.GrammarLoader;
import com.boolparser.expression.BooleanExpressionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the boolean expression parser.
 */
@Configuration
@ConditionalOnProperty(prefix = "boolparser", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(BoolParserProperties.class)
public class BoolParserAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BoolParserAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public GrammarConfig grammarConfig(BoolParserProperties properties) {
        return GrammarLoader.load(properties.getGrammarPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public BooleanExpressionEvaluator booleanExpressionEvaluator(GrammarConfig grammar) {
        log.info("Creating BooleanExpressionEvaluator for grammar '{}'", grammar.name());
        return new BooleanExpressionEvaluator(grammar);
    }
}
