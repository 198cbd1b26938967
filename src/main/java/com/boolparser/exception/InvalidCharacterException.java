package com.boolparser.exception;

/**
 * Thrown when the lexer meets a character outside the recognized alphabet.
 */
public class InvalidCharacterException extends ExpressionParseException {

    private final char character;
    private final int position;

    public InvalidCharacterException(char character, int position, String input) {
        super(format("Unexpected character '" + character + "'", position, input), input);
        this.character = character;
        this.position = position;
    }

    public char getCharacter() {
        return character;
    }

    public int getPosition() {
        return position;
    }
}
