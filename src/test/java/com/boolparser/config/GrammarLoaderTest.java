package com.boolparser.config;

import com.boolparser.exception.ConfigurationException;
import com.boolparser.expression.BooleanExpressionEvaluator;
import com.boolparser.expression.Operation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GrammarLoader.
 */
class GrammarLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Bundled grammar matches the built-in defaults")
    void bundledGrammarMatchesDefaults() {
        assertEquals(GrammarConfig.defaults(), GrammarLoader.load("classpath:grammar.yaml"));
    }

    @Test
    @DisplayName("Should load custom symbols")
    void loadCustomSymbols() {
        GrammarConfig grammar = GrammarLoader.load("classpath:grammar-logical.yaml");

        assertEquals("logical", grammar.name());
        assertEquals(3, grammar.tiers().size());
        assertEquals(Operation.AND, grammar.tiers().get(1).find("&&", 2).orElseThrow().operation());

        BooleanExpressionEvaluator evaluator = new BooleanExpressionEvaluator(grammar);
        assertTrue(evaluator.evaluate("~A && B || C", Map.of("A", false, "B", true, "C", false)));
        assertFalse(evaluator.evaluate("~(A || B)", Map.of("A", false, "B", true)));
    }

    @Test
    @DisplayName("Should accept a grammar at the document root")
    void loadRootLevelGrammar() {
        GrammarConfig grammar = GrammarLoader.load(yaml("""
                name: inline
                tiers:
                  - name: conjunction
                    operations: [and]
                  - operations:
                      - operation: not-equals
                        symbol: "<>"
                """));

        assertEquals("inline", grammar.name());
        assertEquals("tier-1", grammar.tiers().get(1).name());
        assertEquals(Operation.NOT_EQUALS, grammar.tiers().get(1).find("<>", 2).orElseThrow().operation());
    }

    @Test
    @DisplayName("Should fall back to default tiers when none are configured")
    void fallbackToDefaultTiers() {
        GrammarConfig grammar = GrammarLoader.load("classpath:grammar-no-tiers.yaml");

        assertEquals("fallback", grammar.name());
        assertEquals(GrammarConfig.defaults().tiers(), grammar.tiers());
    }

    @Test
    @DisplayName("Should reject unknown operations")
    void unknownOperation() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> GrammarLoader.load("classpath:grammar-unknown-operation.yaml"));

        assertTrue(ex.getMessage().contains("NAND"));
    }

    @Test
    @DisplayName("Should reject missing, empty and malformed files")
    void invalidFiles() {
        assertThrows(ConfigurationException.class, () -> GrammarLoader.load("classpath:no-such-grammar.yaml"));
        assertThrows(ConfigurationException.class, () -> GrammarLoader.load(yaml("")));
        assertThrows(ConfigurationException.class, () -> GrammarLoader.load(yaml("- a\n- b\n")));
        assertThrows(ConfigurationException.class, () -> GrammarLoader.load(yaml("tiers: [")));
        assertThrows(ConfigurationException.class, () -> GrammarLoader.load(yaml("""
                tiers:
                  - name: empty
                    operations: []
                """)));
    }

    @Test
    @DisplayName("Should reject sections of the wrong shape")
    void malformedSections() {
        assertThrows(ConfigurationException.class, () -> GrammarLoader.load(yaml("grammar: [x]\n")));
        assertThrows(ConfigurationException.class, () -> GrammarLoader.load(yaml("grammar:\n  tiers: foo\n")));
        assertThrows(ConfigurationException.class, () -> GrammarLoader.load(yaml("""
                tiers:
                  - conjunction
                """)));
        assertThrows(ConfigurationException.class, () -> GrammarLoader.load(yaml("""
                tiers:
                  - name: conjunction
                    operations: AND
                """)));
    }
}
