package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.ErrorKind;
import io.github.cyfko.truthtable.core.parsing.FormulaEvaluator;

/**
 * Exception thrown when a formula is evaluated against an assignment that does not define
 * one of its variables.
 * <p>
 * The truth table generator always builds complete assignments, so this exception signals
 * a caller passing its own incomplete assignment to {@link FormulaEvaluator}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EvaluationException extends TruthTableException {

    private final String variable;

    /**
     * Creates an exception for a variable missing from the assignment.
     *
     * @param variable the name of the unassigned variable
     */
    public EvaluationException(String variable) {
        super(String.format("Variable '%s' has no assigned value", variable));
        this.variable = variable;
    }

    /**
     * @return the name of the unassigned variable
     */
    public String getVariable() {
        return variable;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.EVAL;
    }
}
