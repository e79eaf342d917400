package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.ErrorKind;
import io.github.cyfko.truthtable.core.parsing.FormulaParser;

/**
 * Exception thrown when an expression is lexically valid but does not form a well-formed formula.
 * <p>
 * The message is meant to be shown to end users as is. It names the problem and, where it
 * applies, the position of the token at fault.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("");          // → "Expression cannot be null or empty"
 * parser.parse("(P ∧ Q");    // → "Unmatched '(' at position 0"
 * parser.parse("P ∧");       // → "Missing operand after '∧' at position 2"
 * parser.parse("∨ Q");       // → "Expression cannot start with binary operator '∨'"
 * parser.parse("P Q");       // → "Missing operator between operands at position 2"
 * parser.parse("()");        // → "No variables found in expression"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see FormulaParser
 */
public class FormulaSyntaxException extends TruthTableException {

    private final int position;

    /**
     * Creates an exception that is not tied to a specific position.
     *
     * @param message the message describing the syntax error
     */
    public FormulaSyntaxException(String message) {
        this(message, -1);
    }

    /**
     * Creates an exception tied to the token at {@code position}.
     *
     * @param message  the message describing the syntax error
     * @param position zero-based character position, or {@code -1} when not applicable
     */
    public FormulaSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * @param message the message describing the syntax error
     * @param cause   the original cause of this exception
     */
    public FormulaSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.position = -1;
    }

    /**
     * @return zero-based position of the token at fault, or {@code -1} when not applicable
     */
    public int getPosition() {
        return position;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.PARSE;
    }
}
