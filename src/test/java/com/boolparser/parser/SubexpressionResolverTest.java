package com.boolparser.parser;

import com.boolparser.config.GrammarConfig;
import com.boolparser.exception.MissingLeftParenthesisException;
import com.boolparser.exception.MissingRightParenthesisException;
import com.boolparser.expression.impl.AndExpression;
import com.boolparser.expression.impl.Identifier;
import com.boolparser.token.Lexer;
import com.boolparser.token.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SubexpressionResolver.
 */
class SubexpressionResolverTest {

    private final GrammarConfig grammar = GrammarConfig.defaults();
    private final Lexer lexer = new Lexer(grammar);
    private final PrecedenceMatcher matcher = new PrecedenceMatcher(grammar);

    private SubexpressionResolver resolverFor(String input) {
        List<Token> tokens = lexer.tokenize(input);
        return new SubexpressionResolver(input, tokens, matcher);
    }

    @Test
    @DisplayName("Should record only outermost groups")
    void shouldFindOutermostGroups() {
        // ( A & B ) | ( C )
        // 0 1 2 3 4 5 6 7 8
        assertEquals(List.of(new Span(0, 4), new Span(6, 8)), resolverFor("(A&B)|(C)").findGroups(0, 9));

        // ( ( A ) ) | B
        assertEquals(List.of(new Span(0, 4)), resolverFor("((A))|B").findGroups(0, 7));
    }

    @Test
    @DisplayName("Should find groups inside a sub-range")
    void shouldFindGroupsInRange() {
        // ( ( A ) | B )
        // 0 1 2 3 4 5 6
        assertEquals(List.of(new Span(1, 3)), resolverFor("((A)|B)").findGroups(1, 6));
    }

    @Test
    @DisplayName("Should fail on ')' without matching '('")
    void shouldFailOnMissingLeftParenthesis() {
        MissingLeftParenthesisException ex = assertThrows(MissingLeftParenthesisException.class,
                () -> resolverFor("A&B)").findGroups(0, 4));

        assertEquals(3, ex.getPosition());
    }

    @Test
    @DisplayName("Should fail on '(' left open")
    void shouldFailOnMissingRightParenthesis() {
        MissingRightParenthesisException ex = assertThrows(MissingRightParenthesisException.class,
                () -> resolverFor("((A)").findGroups(0, 4));

        assertEquals(0, ex.getPosition());
    }

    @Test
    @DisplayName("Should replace each group by the expression it reduces to")
    void shouldResolveGroups() {
        List<ParseItem> items = resolverFor("(A&B)|C").resolve(0, 7);

        assertEquals(3, items.size());
        assertInstanceOf(AndExpression.class, items.get(0));
        assertEquals("|", ((Token) items.get(1)).text());
        assertInstanceOf(Identifier.class, items.get(2));
    }

    @Test
    @DisplayName("Should drop empty groups")
    void shouldDropEmptyGroups() {
        List<ParseItem> items = resolverFor("A()").resolve(0, 3);

        assertEquals(1, items.size());
        assertInstanceOf(Identifier.class, items.get(0));
    }

    @Test
    @DisplayName("Should resolve nested groups through recursion")
    void shouldReduceNestedGroups() {
        assertEquals("((A | B) & C)", resolverFor("((A|(B)))&C").reduce().toString());
    }
}
