package com.boolparser.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the boolean expression parser.
 */
@ConfigurationProperties(prefix = "boolparser")
public class BoolParserProperties {

    /**
     * Whether the evaluator beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the grammar configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String grammarPath = "classpath:grammar.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getGrammarPath() {
        return grammarPath;
    }

    public void setGrammarPath(String grammarPath) {
        this.grammarPath = grammarPath;
    }
}
