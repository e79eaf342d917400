package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.ErrorKind;
import io.github.cyfko.truthtable.core.api.TruthTableEngine;

/**
 * Base class of every failure raised while turning an expression into a truth table.
 * <p>
 * All failures are recoverable: the engine never returns a partial table, so callers
 * receive either a complete result or one of the subclasses below.
 * </p>
 *
 * <p><strong>Hierarchy:</strong></p>
 * <ul>
 *   <li>{@link LexicalException} - unrecognized character ({@link ErrorKind#LEX})</li>
 *   <li>{@link FormulaSyntaxException} - malformed formula ({@link ErrorKind#PARSE})</li>
 *   <li>{@link EvaluationException} - incomplete assignment ({@link ErrorKind#EVAL})</li>
 *   <li>{@link VariableLimitExceededException} - too many variables ({@link ErrorKind#VARIABLE_LIMIT})</li>
 * </ul>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     TruthTable table = engine.generateTruthTable(userExpression);
 * } catch (TruthTableException e) {
 *     log.warning("Rejected expression '" + userExpression + "': " + e.getMessage());
 *     showError(e.getErrorKind(), e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see TruthTableEngine
 */
public abstract class TruthTableException extends RuntimeException {

    /**
     * @param message the message describing the failure
     */
    protected TruthTableException(String message) {
        super(message);
    }

    /**
     * @param message the message describing the failure
     * @param cause   the original cause of this exception
     */
    protected TruthTableException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the category of this failure.
     *
     * @return the error kind, never {@code null}
     */
    public abstract ErrorKind getErrorKind();
}
