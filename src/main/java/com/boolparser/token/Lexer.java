package com.boolparser.token;

import com.boolparser.config.GrammarConfig;
import com.boolparser.exception.InvalidCharacterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.boolparser.token.LexerConfig.*;

/**
 * Converts expression text into a sequence of tokens.
 * <p>
 * Whitespace is removed before scanning, so it never separates tokens. Operators
 * are matched by maximal munch over the grammar's symbols; where two symbols
 * overlap (e.g. "!" and "!="), a symbol that fits the position is preferred:
 * a prefix operator where an operand must start, an infix operator after an operand.
 */
public final class Lexer {

    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    private final List<String> symbolsLongestFirst;
    private final Set<String> prefixSymbols;
    private final Set<String> infixSymbols;
    private final Set<Character> operatorChars;

    public Lexer(GrammarConfig grammar) {
        this.symbolsLongestFirst = grammar.operatorSymbols().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        this.prefixSymbols = grammar.prefixSymbols();
        this.infixSymbols = grammar.infixSymbols();
        this.operatorChars = new HashSet<>();
        for (String symbol : symbolsLongestFirst) {
            for (char c : symbol.toCharArray()) {
                operatorChars.add(c);
            }
        }
    }

    /**
     * Tokenize the input string.
     *
     * @param input Expression text
     * @return List of tokens, positions relative to the whitespace-stripped input
     * @throws InvalidCharacterException on a character outside the alphabet
     */
    public List<Token> tokenize(String input) {
        String source = stripWhitespace(input);
        List<Token> tokens = new Scan(source).run();
        log.debug("Tokenized '{}' into {}", source, tokens);
        return tokens;
    }

    /**
     * Remove every whitespace character.
     */
    public static String stripWhitespace(String input) {
        if (input == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * State of a single tokenize call.
     */
    private class Scan {
        private final String input;
        private final List<Token> tokens = new ArrayList<>();
        private int pos;

        Scan(String input) {
            this.input = input;
        }

        List<Token> run() {
            while (!isAtEnd()) {
                char c = peek();
                int start = pos;

                if (c == LEFT_PAREN) {
                    pos++;
                    tokens.add(new Token(TokenType.LEFT_PAREN, "(", start));
                } else if (c == RIGHT_PAREN) {
                    pos++;
                    tokens.add(new Token(TokenType.RIGHT_PAREN, ")", start));
                } else if (operatorChars.contains(c)) {
                    tokens.add(readOperator());
                } else if (isWordChar(c)) {
                    tokens.add(readWord());
                } else {
                    throw new InvalidCharacterException(c, start, input);
                }
            }
            return tokens;
        }

        private Token readOperator() {
            int start = pos;
            List<String> candidates = symbolsLongestFirst.stream()
                    .filter(symbol -> input.startsWith(symbol, start))
                    .toList();
            if (candidates.isEmpty()) {
                throw new InvalidCharacterException(peek(), start, input);
            }

            Set<String> fitting = followsOperand() ? infixSymbols : prefixSymbols;
            String symbol = candidates.stream()
                    .filter(fitting::contains)
                    .findFirst()
                    .orElse(candidates.get(0));

            pos += symbol.length();
            return new Token(TokenType.OPERATOR, symbol, start);
        }

        private Token readWord() {
            int start = pos;
            while (!isAtEnd() && isWordChar(peek())) {
                pos++;
            }

            String text = input.substring(start, pos);
            if (BOOLEAN_VALUES.containsKey(text)) {
                return new Token(TokenType.BOOLEAN_LITERAL, text, start);
            }
            if (NUMERIC_LITERAL.matcher(text).matches()) {
                return new Token(TokenType.NUMERIC_LITERAL, text, start);
            }
            return new Token(TokenType.IDENTIFIER, text, start);
        }

        private boolean followsOperand() {
            return !tokens.isEmpty() && tokens.get(tokens.size() - 1).type().endsOperand();
        }

        private char peek() {
            return input.charAt(pos);
        }

        private boolean isAtEnd() {
            return pos >= input.length();
        }
    }
}
