package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.ErrorKind;
import io.github.cyfko.truthtable.core.parsing.FormulaTokenizer;

/**
 * Exception thrown when an expression contains a character that is neither a variable letter,
 * whitespace, a parenthesis nor a recognized connective symbol.
 *
 * <p><strong>Examples:</strong></p>
 * <pre>{@code
 * tokenizer.tokenize("P ∧ 1");
 * // → "Unrecognized character '1' at position 4"
 *
 * tokenizer.tokenize("P <- Q");
 * // → "Unrecognized character '<' at position 2"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see FormulaTokenizer
 */
public class LexicalException extends TruthTableException {

    private final int position;
    private final char character;

    /**
     * Creates an exception for an unrecognized character.
     *
     * @param character the offending character
     * @param position  zero-based position of the character in the expression
     */
    public LexicalException(char character, int position) {
        super(String.format("Unrecognized character '%s' at position %d", character, position));
        this.character = character;
        this.position = position;
    }

    /**
     * @return zero-based position of the offending character
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return the offending character
     */
    public char getCharacter() {
        return character;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.LEX;
    }
}
