package com.boolparser.token;

import com.boolparser.config.GrammarConfig;
import com.boolparser.config.OperationSpec;
import com.boolparser.config.PrecedenceTier;
import com.boolparser.exception.InvalidCharacterException;
import com.boolparser.expression.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Lexer.
 */
class LexerTest {

    private Lexer lexer;

    @BeforeEach
    void setUp() {
        lexer = new Lexer(GrammarConfig.defaults());
    }

    @Test
    @DisplayName("Should tokenize identifiers and operators with positions")
    void shouldTokenizeSimpleExpression() {
        List<Token> tokens = lexer.tokenize("A&B");

        assertEquals(List.of(
                new Token(TokenType.IDENTIFIER, "A", 0),
                new Token(TokenType.OPERATOR, "&", 1),
                new Token(TokenType.IDENTIFIER, "B", 2)
        ), tokens);
    }

    @Test
    @DisplayName("Should ignore whitespace anywhere")
    void shouldIgnoreWhitespace() {
        assertEquals(lexer.tokenize("A&B"), lexer.tokenize(" A \t&\n B "));
    }

    @Test
    @DisplayName("Should emit parentheses as single tokens")
    void shouldTokenizeParentheses() {
        List<Token> tokens = lexer.tokenize("(A)");

        assertEquals(TokenType.LEFT_PAREN, tokens.get(0).type());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
        assertEquals(TokenType.RIGHT_PAREN, tokens.get(2).type());
    }

    @ParameterizedTest
    @DisplayName("Should classify words as boolean literal, numeric literal or identifier")
    @CsvSource({
            "True, BOOLEAN_LITERAL",
            "False, BOOLEAN_LITERAL",
            "true, IDENTIFIER",
            "TRUE, IDENTIFIER",
            "42, NUMERIC_LITERAL",
            "3.14, NUMERIC_LITERAL",
            ".5, NUMERIC_LITERAL",
            "1.2.3, IDENTIFIER",
            "x_1.y, IDENTIFIER",
            "1abc, IDENTIFIER",
            "Trueish, IDENTIFIER"
    })
    void shouldClassifyWords(String text, TokenType expected) {
        List<Token> tokens = lexer.tokenize(text);

        assertEquals(1, tokens.size());
        assertEquals(expected, tokens.get(0).type());
        assertEquals(text, tokens.get(0).text());
    }

    // =====================================================================
    // Operator scanning
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Should take the longest registered operator")
    @CsvSource({
            "x>=3, >=",
            "x<=3, <=",
            "x>3, >",
            "x==3, ==",
            "A!=B, !="
    })
    void shouldApplyMaximalMunch(String input, String operator) {
        List<Token> tokens = lexer.tokenize(input);

        assertEquals(3, tokens.size());
        assertEquals(new Token(TokenType.OPERATOR, operator, 1), tokens.get(1));
    }

    @Test
    @DisplayName("Should prefer the prefix operator where an operand must start")
    void shouldPreferPrefixOperatorBeforeOperand() {
        List<Token> tokens = lexer.tokenize("A&!B");

        assertEquals("&", tokens.get(1).text());
        assertEquals("!", tokens.get(2).text());
        assertEquals("B", tokens.get(3).text());
    }

    @Test
    @DisplayName("Should not merge a leading '!' with a following '='")
    void shouldNotMergeNegationWithEquals() {
        InvalidCharacterException ex = assertThrows(InvalidCharacterException.class,
                () -> lexer.tokenize("!=A"));

        assertEquals('=', ex.getCharacter());
        assertEquals(1, ex.getPosition());
    }

    @Test
    @DisplayName("Should split unregistered operator runs into registered symbols")
    void shouldSplitUnregisteredRuns() {
        List<Token> tokens = lexer.tokenize("A&&B");

        assertEquals(4, tokens.size());
        assertEquals("&", tokens.get(1).text());
        assertEquals("&", tokens.get(2).text());
    }

    // =====================================================================
    // Invalid input
    // =====================================================================

    @Test
    @DisplayName("Should reject characters outside the alphabet")
    void shouldRejectInvalidCharacter() {
        InvalidCharacterException ex = assertThrows(InvalidCharacterException.class,
                () -> lexer.tokenize("A#B"));

        assertEquals('#', ex.getCharacter());
        assertEquals(1, ex.getPosition());
        assertEquals("A#B", ex.getInput());
    }

    @Test
    @DisplayName("Should reject an operator character that starts no registered symbol")
    void shouldRejectPartialSymbol() {
        Lexer custom = new Lexer(new GrammarConfig("custom", List.of(
                new PrecedenceTier("conjunction", List.of(OperationSpec.of(Operation.AND, "&&"))))));

        assertEquals(3, custom.tokenize("A&&B").size());
        assertThrows(InvalidCharacterException.class, () -> custom.tokenize("A&B"));
    }

    @Test
    @DisplayName("Should return no tokens for blank input")
    void shouldHandleBlankInput() {
        assertTrue(lexer.tokenize("   ").isEmpty());
        assertTrue(lexer.tokenize(null).isEmpty());
    }
}
